package com.examgrader.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body returned to the caller once a submission has been evaluated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationResult {
    public static final String COMPLETE_MESSAGE = "Evaluation complete";

    private final String message;
    private final List<Evaluation> evaluations;
    private final double totalMarks;
    private final Verdict result;
    private final String warning;

    public EvaluationResult(List<Evaluation> evaluations, double totalMarks, Verdict result, String warning) {
        this.message = COMPLETE_MESSAGE;
        this.evaluations = List.copyOf(evaluations);
        this.totalMarks = totalMarks;
        this.result = result;
        this.warning = warning;
    }

    public String getMessage() { return message; }
    public List<Evaluation> getEvaluations() { return evaluations; }
    public double getTotalMarks() { return totalMarks; }
    public Verdict getResult() { return result; }
    public String getWarning() { return warning; }
}
