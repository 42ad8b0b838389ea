package com.examgrader.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of grading one submitted answer
 */
public class Evaluation {
    public static final String QUESTION_NOT_FOUND_FEEDBACK = "Question not found in exam config.";

    private final String questionNumber;
    private final double marks;
    private final String feedback;
    private final boolean usedFallback;

    @JsonCreator
    public Evaluation(
            @JsonProperty("questionNumber") String questionNumber,
            @JsonProperty("marks") double marks,
            @JsonProperty("feedback") String feedback,
            @JsonProperty("usedFallback") boolean usedFallback) {
        this.questionNumber = questionNumber;
        this.marks = marks;
        this.feedback = feedback;
        this.usedFallback = usedFallback;
    }

    public static Evaluation questionNotFound(String questionNumber) {
        return new Evaluation(questionNumber, 0, QUESTION_NOT_FOUND_FEEDBACK, false);
    }

    public String getQuestionNumber() { return questionNumber; }
    public double getMarks() { return marks; }
    public String getFeedback() { return feedback; }
    public boolean isUsedFallback() { return usedFallback; }

    @Override
    public String toString() {
        return "Evaluation{" +
                "questionNumber='" + questionNumber + '\'' +
                ", marks=" + marks +
                ", usedFallback=" + usedFallback +
                '}';
    }
}
