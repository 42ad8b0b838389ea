package com.examgrader.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One free-text answer as the student submitted it
 */
public class SubmittedAnswer {
    private final String questionNumber;
    private final String answerText;

    @JsonCreator
    public SubmittedAnswer(
            @JsonProperty("questionNumber") String questionNumber,
            @JsonProperty("answerText") String answerText) {
        this.questionNumber = questionNumber;
        this.answerText = answerText;
    }

    public String getQuestionNumber() { return questionNumber; }
    public String getAnswerText() { return answerText; }
}
