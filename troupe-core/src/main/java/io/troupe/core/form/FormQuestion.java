package io.troupe.core.form;

import java.util.List;
import java.util.Objects;

/**
 * One question of a template's form schema.
 *
 * @param id key under which the answer is stored in a {@link FormResponse}, not null
 * @param text prompt shown by the front end, defaults to the id
 * @param type expected answer shape, not null
 * @param options allowed values for select questions, empty otherwise
 * @param defaultValue answer assumed by front ends when the user skips the question, may be null
 */
public record FormQuestion(
        String id, String text, QuestionType type, List<String> options, Object defaultValue) {

    public FormQuestion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        text = text != null ? text : id;
        options = options != null ? List.copyOf(options) : List.of();
    }

    public static FormQuestion bool(String id, String text) {
        return new FormQuestion(id, text, QuestionType.BOOLEAN, List.of(), null);
    }

    public static FormQuestion singleSelect(String id, String text, List<String> options) {
        return new FormQuestion(id, text, QuestionType.SINGLE_SELECT, options, null);
    }

    public static FormQuestion multiSelect(String id, String text, List<String> options) {
        return new FormQuestion(id, text, QuestionType.MULTI_SELECT, options, null);
    }

    public static FormQuestion text(String id, String text) {
        return new FormQuestion(id, text, QuestionType.TEXT_INPUT, List.of(), null);
    }
}
