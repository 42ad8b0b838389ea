package com.examgrader.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A student's answer sheet together with its latest evaluation
 */
public class Submission {
    private String rollNumber;
    private String examId;
    private List<SubmittedAnswer> answers = new ArrayList<>();
    private List<Evaluation> evaluated = new ArrayList<>();
    private double totalMarks;
    private Verdict result;
    private Instant evaluatedAt;

    public Submission() {}

    public Submission(String rollNumber, List<SubmittedAnswer> answers) {
        this.rollNumber = rollNumber;
        this.answers = new ArrayList<>(answers);
    }

    // Getters and Setters
    public String getRollNumber() {
        return rollNumber;
    }

    public void setRollNumber(String rollNumber) {
        this.rollNumber = rollNumber;
    }

    public String getExamId() {
        return examId;
    }

    public void setExamId(String examId) {
        this.examId = examId;
    }

    public List<SubmittedAnswer> getAnswers() {
        return answers;
    }

    public void setAnswers(List<SubmittedAnswer> answers) {
        this.answers = answers != null ? new ArrayList<>(answers) : new ArrayList<>();
    }

    public List<Evaluation> getEvaluated() {
        return evaluated;
    }

    public void setEvaluated(List<Evaluation> evaluated) {
        this.evaluated = evaluated != null ? new ArrayList<>(evaluated) : new ArrayList<>();
    }

    public double getTotalMarks() {
        return totalMarks;
    }

    public void setTotalMarks(double totalMarks) {
        this.totalMarks = totalMarks;
    }

    public Verdict getResult() {
        return result;
    }

    public void setResult(Verdict result) {
        this.result = result;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public void setEvaluatedAt(Instant evaluatedAt) {
        this.evaluatedAt = evaluatedAt;
    }

    /**
     * Shallow copy; answers and evaluations are immutable so sharing them is safe.
     */
    public Submission copy() {
        Submission copy = new Submission();
        copy.rollNumber = rollNumber;
        copy.examId = examId;
        copy.answers = new ArrayList<>(answers);
        copy.evaluated = new ArrayList<>(evaluated);
        copy.totalMarks = totalMarks;
        copy.result = result;
        copy.evaluatedAt = evaluatedAt;
        return copy;
    }

    @Override
    public String toString() {
        return "Submission{" +
                "rollNumber='" + rollNumber + '\'' +
                ", examId='" + examId + '\'' +
                ", answers=" + answers.size() +
                ", totalMarks=" + totalMarks +
                ", result=" + result +
                '}';
    }
}
