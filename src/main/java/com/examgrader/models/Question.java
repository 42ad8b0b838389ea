package com.examgrader.models;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * A single exam question with its maximum marks
 */
public class Question {
    private String questionNumber;
    private String questionText;
    private double maxMarks;

    public Question() {}

    public Question(String questionNumber, String questionText, double maxMarks) {
        this.questionNumber = questionNumber;
        this.questionText = questionText;
        this.maxMarks = maxMarks;
    }

    public String getQuestionNumber() {
        return questionNumber;
    }

    public void setQuestionNumber(String questionNumber) {
        this.questionNumber = questionNumber;
    }

    public String getQuestionText() {
        return questionText;
    }

    @JsonAlias("question")
    public void setQuestionText(String questionText) {
        this.questionText = questionText;
    }

    public double getMaxMarks() {
        return maxMarks;
    }

    @JsonAlias("marks")
    public void setMaxMarks(double maxMarks) {
        this.maxMarks = maxMarks;
    }

    @Override
    public String toString() {
        return "Question{" +
                "questionNumber='" + questionNumber + '\'' +
                ", maxMarks=" + maxMarks +
                '}';
    }
}
