package io.troupe.core.form;

/** Answer shape a {@link FormQuestion} expects. */
public enum QuestionType {
    SINGLE_SELECT,
    MULTI_SELECT,
    BOOLEAN,
    TEXT_INPUT
}
