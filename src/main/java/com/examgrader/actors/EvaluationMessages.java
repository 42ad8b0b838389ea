package com.examgrader.actors;

import akka.actor.typed.ActorRef;
import com.examgrader.models.EvaluationResult;
import com.examgrader.models.Question;
import com.examgrader.models.Submission;
import com.examgrader.utils.GradingOutcome;

/**
 * Message types for the evaluation pipeline
 */
public class EvaluationMessages {

    // Base message interface
    public interface Message {}

    // Replies sent back to whoever asked for an evaluation
    public interface EvaluationReply {}

    public enum ErrorKind {
        BAD_REQUEST(400, "error"),
        NOT_FOUND(404, "message"),
        INTERNAL(500, "error");

        private final int status;
        private final String payloadField;

        ErrorKind(int status, String payloadField) {
            this.status = status;
            this.payloadField = payloadField;
        }

        public int getStatus() { return status; }

        /**
         * JSON field the error text is reported under
         */
        public String getPayloadField() { return payloadField; }
    }

    // Evaluation requests
    public static class EvaluateSubmission implements Message {
        private final String rollNumber;
        private final String examId;
        private final ActorRef<EvaluationReply> replyTo;

        public EvaluateSubmission(String rollNumber, String examId, ActorRef<EvaluationReply> replyTo) {
            this.rollNumber = rollNumber;
            this.examId = examId;
            this.replyTo = replyTo;
        }

        public String getRollNumber() { return rollNumber; }
        public String getExamId() { return examId; }
        public ActorRef<EvaluationReply> getReplyTo() { return replyTo; }
    }

    public static class EvaluationComplete implements EvaluationReply {
        private final EvaluationResult result;

        public EvaluationComplete(EvaluationResult result) {
            this.result = result;
        }

        public EvaluationResult getResult() { return result; }
    }

    public static class EvaluationFailed implements EvaluationReply {
        private final ErrorKind kind;
        private final String error;

        public EvaluationFailed(ErrorKind kind, String error) {
            this.kind = kind;
            this.error = error;
        }

        public ErrorKind getKind() { return kind; }
        public String getError() { return error; }
    }

    // Grading worker messages
    public static class GradeAnswer implements Message {
        private final int index;
        private final Question question;
        private final String answerText;
        private final ActorRef<Message> replyTo;

        public GradeAnswer(int index, Question question, String answerText, ActorRef<Message> replyTo) {
            this.index = index;
            this.question = question;
            this.answerText = answerText;
            this.replyTo = replyTo;
        }

        public int getIndex() { return index; }
        public Question getQuestion() { return question; }
        public String getAnswerText() { return answerText; }
        public ActorRef<Message> getReplyTo() { return replyTo; }
    }

    public static class AnswerGraded implements Message {
        private final int index;
        private final GradingOutcome outcome;

        public AnswerGraded(int index, GradingOutcome outcome) {
            this.index = index;
            this.outcome = outcome;
        }

        public int getIndex() { return index; }
        public GradingOutcome getOutcome() { return outcome; }
    }

    // Sent by the coordinator's own timer
    public enum EvaluationTimedOut implements Message {
        INSTANCE
    }

    // Coordinator lifecycle, delivered to the service through death watch
    public static class CoordinatorFinished implements Message {
        private final String rollNumber;

        public CoordinatorFinished(String rollNumber) {
            this.rollNumber = rollNumber;
        }

        public String getRollNumber() { return rollNumber; }
    }

    // Sent by the service's own timer when a queued request has waited too long
    public static class QueuedRequestExpired implements Message {
        private final String rollNumber;
        private final long ticket;

        public QueuedRequestExpired(String rollNumber, long ticket) {
            this.rollNumber = rollNumber;
            this.ticket = ticket;
        }

        public String getRollNumber() { return rollNumber; }
        public long getTicket() { return ticket; }
    }

    // Result writing messages
    public static class WriteResults implements Message {
        private final Submission submission;

        public WriteResults(Submission submission) {
            this.submission = submission;
        }

        public Submission getSubmission() { return submission; }
    }
}
