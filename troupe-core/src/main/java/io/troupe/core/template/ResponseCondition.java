package io.troupe.core.template;

import io.troupe.core.form.FormResponse;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Gate deciding whether a composition rule produces an agent for a given response.
 *
 * <p>Every condition declares the response keys it reads so that templates can be validated
 * against their form schema before any response arrives.
 *
 * <ul>
 *   <li>{@link Always}: unconditional
 *   <li>{@link RequiredResponses}: every listed answer must match, see {@link
 *       FormResponse#matches(String, Object)}
 *   <li>{@link Custom}: arbitrary predicate with explicitly declared keys; not serializable
 * </ul>
 */
public sealed interface ResponseCondition
        permits ResponseCondition.Always,
                ResponseCondition.RequiredResponses,
                ResponseCondition.Custom {

    /**
     * Evaluates the condition.
     *
     * @param response user answers, not null
     * @return {@code true} if the rule should produce an agent
     */
    boolean test(FormResponse response);

    /**
     * Returns the response keys this condition reads.
     *
     * @return declared keys, never null
     */
    Set<String> readKeys();

    static ResponseCondition always() {
        return Always.INSTANCE;
    }

    static ResponseCondition required(String questionId, Object expected) {
        return new RequiredResponses(Map.of(questionId, expected));
    }

    static ResponseCondition required(Map<String, Object> expected) {
        return new RequiredResponses(expected);
    }

    static ResponseCondition custom(
            String description, Set<String> readKeys, Predicate<FormResponse> predicate) {
        return new Custom(description, readKeys, predicate);
    }

    /** Condition that always holds. */
    record Always() implements ResponseCondition {
        static final Always INSTANCE = new Always();

        @Override
        public boolean test(FormResponse response) {
            return true;
        }

        @Override
        public Set<String> readKeys() {
            return Set.of();
        }
    }

    /**
     * Condition satisfied when every expected answer matches.
     *
     * @param expected question id to expected value, insertion ordered
     */
    record RequiredResponses(Map<String, Object> expected) implements ResponseCondition {

        public RequiredResponses {
            Objects.requireNonNull(expected, "expected must not be null");
            expected = Collections.unmodifiableMap(new LinkedHashMap<>(expected));
        }

        @Override
        public boolean test(FormResponse response) {
            for (Map.Entry<String, Object> entry : expected.entrySet()) {
                if (!response.matches(entry.getKey(), entry.getValue())) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Set<String> readKeys() {
            return expected.keySet();
        }
    }

    /**
     * Condition backed by Java code.
     *
     * @param description label used in logs and skip reasons, not null
     * @param readKeys keys the predicate reads, not null
     * @param predicate the test itself, not null
     */
    record Custom(String description, Set<String> readKeys, Predicate<FormResponse> predicate)
            implements ResponseCondition {

        public Custom {
            Objects.requireNonNull(description, "description must not be null");
            Objects.requireNonNull(predicate, "predicate must not be null");
            readKeys = readKeys != null ? Set.copyOf(readKeys) : Set.of();
        }

        @Override
        public boolean test(FormResponse response) {
            return predicate.test(response);
        }
    }
}
