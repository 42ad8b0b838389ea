package com.examgrader.utils;

/**
 * Result of one call to the grading service: either a usable grade or the reason it was rejected.
 */
public interface GradingOutcome {

    record Graded(double marks, String feedback) implements GradingOutcome {}

    record Failed(FailureReason reason, String detail) implements GradingOutcome {
        public Failed(FailureReason reason) {
            this(reason, reason.getMessage());
        }
    }

    enum FailureReason {
        TRANSPORT("Grading service request failed"),
        EMPTY_RESPONSE("Empty response from model"),
        MALFORMED_JSON("Malformed JSON from model"),
        MISSING_FIELDS("Missing marks or feedback in parsed response");

        private final String message;

        FailureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
