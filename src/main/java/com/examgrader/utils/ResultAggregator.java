package com.examgrader.utils;

import com.examgrader.models.Evaluation;
import com.examgrader.models.Verdict;

import java.util.List;

/**
 * Totals per-question marks and derives the pass/fail verdict
 */
public final class ResultAggregator {

    private ResultAggregator() {}

    public static Aggregate aggregate(List<Evaluation> evaluations, double passMarks) {
        double total = 0;
        for (Evaluation evaluation : evaluations) {
            total += evaluation.getMarks();
        }
        Verdict verdict = total >= passMarks ? Verdict.PASS : Verdict.FAIL;
        return new Aggregate(total, verdict);
    }

    public record Aggregate(double totalMarks, Verdict verdict) {}
}
