package io.troupe.core.form;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of questions that describes which response keys a template expects.
 *
 * <p>The schema is the typed contract between the questionnaire front end and the composition
 * rules: conditions and config mappings declare the keys they read, and template validation
 * checks those keys against {@link #declares(String)}.
 */
public final class FormSchema {

    private static final FormSchema EMPTY = new FormSchema(List.of());

    private final List<FormQuestion> questions;
    private final Map<String, FormQuestion> byId;

    private FormSchema(List<FormQuestion> questions) {
        this.questions = List.copyOf(questions);
        Map<String, FormQuestion> index = new LinkedHashMap<>();
        for (FormQuestion question : this.questions) {
            if (index.put(question.id(), question) != null) {
                throw new IllegalArgumentException("Duplicate question id: " + question.id());
            }
        }
        this.byId = Map.copyOf(index);
    }

    public static FormSchema of(List<FormQuestion> questions) {
        return questions == null || questions.isEmpty() ? EMPTY : new FormSchema(questions);
    }

    public static FormSchema of(FormQuestion... questions) {
        return of(List.of(questions));
    }

    /** Returns a schema without questions; validation of read keys is skipped for it. */
    public static FormSchema empty() {
        return EMPTY;
    }

    public List<FormQuestion> getQuestions() {
        return questions;
    }

    public Optional<FormQuestion> find(String questionId) {
        return Optional.ofNullable(byId.get(questionId));
    }

    public boolean declares(String questionId) {
        return byId.containsKey(questionId);
    }

    public boolean isEmpty() {
        return questions.isEmpty();
    }
}
