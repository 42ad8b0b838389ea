package com.examgrader.utils;

import java.util.List;

/**
 * Scores an answer when the grading service's output cannot be trusted.
 *
 * <p>Marks are a uniform integer in {@code [0, floor(maxMarks)]}; feedback is one of a few
 * generic phrases that make no claim about correctness.
 */
public class FallbackScorer {

    public static final List<String> FEEDBACK_PHRASES = List.of(
        "Answer is somewhat related to the topic.",
        "Fair attempt, but lacks depth.",
        "Contains partial relevant information.",
        "Needs improvement, but shows effort.",
        "Answer lacks clarity but is understandable."
    );

    private final UniformSampler sampler;

    public FallbackScorer() {
        this(UniformSampler.threadLocal());
    }

    public FallbackScorer(UniformSampler sampler) {
        this.sampler = sampler;
    }

    public FallbackScore fallback(double maxMarks) {
        int ceiling = Double.isFinite(maxMarks) && maxMarks > 0 ? (int) Math.floor(maxMarks) : 0;
        int marks = sampler.nextInt(ceiling + 1);
        String feedback = FEEDBACK_PHRASES.get(sampler.nextInt(FEEDBACK_PHRASES.size()));
        return new FallbackScore(marks, feedback);
    }

    public record FallbackScore(int marks, String feedback) {}
}
