package io.troupe.core.form;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * User answers collected for one template.
 *
 * <p>Answers are keyed by question id. Values are scalars ({@code String}, {@code Boolean},
 * {@code Number}) or lists of strings for multi-select questions. The engine performs no
 * validation beyond presence and the typed lookups offered here.
 *
 * <h2>Matching</h2>
 *
 * {@link #matches(String, Object)} implements the comparison used by declarative required
 * responses:
 *
 * <ul>
 *   <li>a list answer matches when it contains the expected value
 *   <li>a boolean answer matches {@code true}/{@code false} and the strings {@code "Yes"}/{@code
 *       "No"}
 *   <li>anything else matches by string equality
 * </ul>
 *
 * @implNote Immutable and thread-safe.
 */
public final class FormResponse {

    private final String templateId;
    private final String responseId;
    private final Instant timestamp;
    private final Map<String, Object> answers;

    private FormResponse(Builder builder) {
        this.templateId = Objects.requireNonNull(builder.templateId, "Template ID required");
        this.responseId =
                builder.responseId != null
                        ? builder.responseId
                        : "resp-" + UUID.randomUUID().toString().substring(0, 12);
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.answers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.answers));
    }

    public static FormResponse of(String templateId, Map<String, Object> answers) {
        return builder().templateId(templateId).answers(answers).build();
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getResponseId() {
        return responseId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAnswers() {
        return answers;
    }

    public boolean has(String questionId) {
        return answers.containsKey(questionId);
    }

    public Optional<Object> get(String questionId) {
        return Optional.ofNullable(answers.get(questionId));
    }

    public Object get(String questionId, Object defaultValue) {
        Object value = answers.get(questionId);
        return value != null ? value : defaultValue;
    }

    public Optional<String> getString(String questionId) {
        return get(questionId).map(String::valueOf);
    }

    /**
     * Returns a boolean answer, accepting {@code "yes"}/{@code "true"} strings.
     *
     * @param questionId question id, not null
     * @return the answer, or empty if absent
     */
    public Optional<Boolean> getBoolean(String questionId) {
        return get(questionId).map(FormResponse::toBoolean);
    }

    /**
     * Returns a list answer; a scalar answer is wrapped in a single-element list.
     *
     * @param questionId question id, not null
     * @return the answer as strings, empty list if absent
     */
    public List<String> getList(String questionId) {
        Object value = answers.get(questionId);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(value));
    }

    /**
     * Tests whether the stored answer satisfies an expected value.
     *
     * @param questionId question id, not null
     * @param expected expected value, not null
     * @return {@code true} if an answer is present and matches
     */
    public boolean matches(String questionId, Object expected) {
        Object actual = answers.get(questionId);
        if (actual == null) {
            return false;
        }
        if (actual instanceof List<?> list) {
            if (expected instanceof List<?> expectedList) {
                return list.stream()
                        .map(String::valueOf)
                        .toList()
                        .containsAll(expectedList.stream().map(String::valueOf).toList());
            }
            return list.stream().map(String::valueOf).anyMatch(String.valueOf(expected)::equals);
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return toBoolean(actual) == toBoolean(expected);
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim();
        return text.equalsIgnoreCase("true") || text.equalsIgnoreCase("yes");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String templateId;
        private String responseId;
        private Instant timestamp;
        private final Map<String, Object> answers = new LinkedHashMap<>();

        private Builder() {}

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder responseId(String responseId) {
            this.responseId = responseId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder answer(String questionId, Object value) {
            Objects.requireNonNull(questionId, "questionId must not be null");
            if (value != null) {
                answers.put(questionId, value);
            }
            return this;
        }

        public Builder answers(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::answer);
            }
            return this;
        }

        public FormResponse build() {
            return new FormResponse(this);
        }
    }
}
