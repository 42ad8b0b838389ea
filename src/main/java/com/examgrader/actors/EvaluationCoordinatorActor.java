package com.examgrader.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.*;
import com.examgrader.models.Evaluation;
import com.examgrader.models.EvaluationResult;
import com.examgrader.models.Exam;
import com.examgrader.models.Question;
import com.examgrader.models.Submission;
import com.examgrader.models.SubmittedAnswer;
import com.examgrader.utils.ExamKeys;
import com.examgrader.utils.FallbackScorer;
import com.examgrader.utils.GradingOutcome;
import com.examgrader.utils.QuestionMatcher;
import com.examgrader.utils.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Actor that evaluates one submission against its exam.
 *
 * <p>Unmatched answers are scored zero on the spot. Matched answers are fanned out to the
 * grading workers and written back by index, so the evaluation list always follows the
 * submission's answer order. Failed grading outcomes are replaced by a fallback score, and
 * so are answers still ungraded when the evaluation timeout fires. The submission is
 * persisted once, after every answer has an evaluation; any earlier failure leaves the
 * stored submission untouched. The actor stops after replying.
 */
public class EvaluationCoordinatorActor extends AbstractBehavior<EvaluationMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationCoordinatorActor.class);

    static final String MISSING_IDS = "rollNumber and examId are required";
    static final String INVALID_EXAM_ID = "Invalid examId";
    static final String STUDENT_NOT_FOUND = "Student not found";
    static final String EXAM_NOT_FOUND = "Exam not found";
    static final String EVALUATION_FAILED = "Evaluation failed";
    static final String TIMED_OUT = "Grading timed out";

    private final EvaluationResources resources;
    private final TimerScheduler<EvaluationMessages.Message> timers;

    private EvaluationMessages.EvaluateSubmission request;
    private Submission submission;
    private Exam exam;
    private String examId;
    private String warning;
    private String[] questionNumbers;
    private Question[] matchedQuestions;
    private Evaluation[] evaluations;
    private int pendingGradings;

    private EvaluationCoordinatorActor(ActorContext<EvaluationMessages.Message> context,
                                       TimerScheduler<EvaluationMessages.Message> timers,
                                       EvaluationResources resources) {
        super(context);
        this.timers = timers;
        this.resources = resources;
    }

    public static Behavior<EvaluationMessages.Message> create(EvaluationResources resources) {
        return Behaviors.setup(context ->
            Behaviors.withTimers(timers -> new EvaluationCoordinatorActor(context, timers, resources)));
    }

    @Override
    public Receive<EvaluationMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(EvaluationMessages.EvaluateSubmission.class, this::onEvaluateSubmission)
                .onMessage(EvaluationMessages.AnswerGraded.class, this::onAnswerGraded)
                .onMessage(EvaluationMessages.EvaluationTimedOut.class, msg -> onTimedOut())
                .build();
    }

    private Behavior<EvaluationMessages.Message> onEvaluateSubmission(EvaluationMessages.EvaluateSubmission msg) {
        if (request != null) {
            logger.warn("Coordinator already handling {}; rejecting second request", request.getRollNumber());
            msg.getReplyTo().tell(new EvaluationMessages.EvaluationFailed(
                EvaluationMessages.ErrorKind.INTERNAL, EVALUATION_FAILED));
            return this;
        }
        this.request = msg;
        try {
            return startEvaluation();
        } catch (RuntimeException e) {
            return abort(e);
        }
    }

    private Behavior<EvaluationMessages.Message> startEvaluation() {
        String rollNumber = trimToNull(request.getRollNumber());
        String requestedExamId = trimToNull(request.getExamId());
        if (rollNumber == null || requestedExamId == null) {
            return fail(EvaluationMessages.ErrorKind.BAD_REQUEST, MISSING_IDS);
        }
        if (!ExamKeys.isWellFormed(requestedExamId)) {
            return fail(EvaluationMessages.ErrorKind.BAD_REQUEST, INVALID_EXAM_ID);
        }

        Optional<Submission> storedSubmission = resources.getSubmissionStore().findByRollNumber(rollNumber);
        if (storedSubmission.isEmpty()) {
            return fail(EvaluationMessages.ErrorKind.NOT_FOUND, STUDENT_NOT_FOUND);
        }
        submission = storedSubmission.get();

        // First binding wins; a different exam id on a later call is reported, not applied
        String boundExamId = trimToNull(submission.getExamId());
        if (boundExamId == null) {
            examId = requestedExamId;
        } else {
            examId = boundExamId;
            if (!boundExamId.equals(requestedExamId)) {
                warning = String.format("Submission %s is bound to exam %s; requested exam %s was ignored",
                    rollNumber, boundExamId, requestedExamId);
                logger.warn(warning);
            }
        }

        Optional<Exam> storedExam = resources.getExamStore().findById(examId);
        if (storedExam.isEmpty()) {
            return fail(EvaluationMessages.ErrorKind.NOT_FOUND, EXAM_NOT_FOUND);
        }
        exam = storedExam.get();

        List<SubmittedAnswer> answers = submission.getAnswers();
        logger.info("Evaluating {} answers of {} against exam {}", answers.size(), rollNumber, examId);

        questionNumbers = new String[answers.size()];
        matchedQuestions = new Question[answers.size()];
        evaluations = new Evaluation[answers.size()];

        for (int i = 0; i < answers.size(); i++) {
            SubmittedAnswer answer = answers.get(i);
            if (answer == null) {
                questionNumbers[i] = "";
                evaluations[i] = Evaluation.questionNotFound("");
                continue;
            }
            questionNumbers[i] = QuestionMatcher.displayForm(answer.getQuestionNumber());

            Optional<Question> question = QuestionMatcher.match(answer.getQuestionNumber(), exam.getQuestions());
            if (question.isEmpty()) {
                logger.debug("Question {} not found in exam {}", questionNumbers[i], examId);
                evaluations[i] = Evaluation.questionNotFound(questionNumbers[i]);
                continue;
            }

            matchedQuestions[i] = question.get();
            pendingGradings++;
            resources.getGradingWorkers().tell(new EvaluationMessages.GradeAnswer(
                i, question.get(), answer.getAnswerText(), getContext().getSelf()));
        }

        if (pendingGradings == 0) {
            return finish();
        }
        timers.startSingleTimer(EvaluationMessages.EvaluationTimedOut.INSTANCE, resources.getTimeout());
        return this;
    }

    private Behavior<EvaluationMessages.Message> onAnswerGraded(EvaluationMessages.AnswerGraded msg) {
        try {
            int index = msg.getIndex();
            if (evaluations == null || evaluations[index] != null) {
                logger.warn("Ignoring unexpected grade for answer #{}", index);
                return this;
            }
            evaluations[index] = toEvaluation(index, msg.getOutcome());
            pendingGradings--;
            return pendingGradings == 0 ? finish() : this;
        } catch (RuntimeException e) {
            return abort(e);
        }
    }

    private Evaluation toEvaluation(int index, GradingOutcome outcome) {
        double maxMarks = matchedQuestions[index].getMaxMarks();
        if (outcome instanceof GradingOutcome.Graded) {
            GradingOutcome.Graded graded = (GradingOutcome.Graded) outcome;
            return new Evaluation(questionNumbers[index], clamp(graded.marks(), maxMarks), graded.feedback(), false);
        }

        String reason = outcome instanceof GradingOutcome.Failed
            ? ((GradingOutcome.Failed) outcome).detail()
            : "Unrecognized grading outcome";
        logger.warn("Error evaluating question {}: {}", questionNumbers[index], reason);

        FallbackScorer.FallbackScore fallback = resources.getFallbackScorer().fallback(maxMarks);
        return new Evaluation(questionNumbers[index], clamp(fallback.marks(), maxMarks), fallback.feedback(), true);
    }

    private Behavior<EvaluationMessages.Message> finish() {
        timers.cancelAll();

        List<Evaluation> evaluated = Arrays.asList(evaluations);
        ResultAggregator.Aggregate aggregate = ResultAggregator.aggregate(evaluated, exam.getPassMarks());

        submission.setEvaluated(evaluated);
        submission.setTotalMarks(aggregate.totalMarks());
        submission.setResult(aggregate.verdict());
        submission.setExamId(examId);
        submission.setEvaluatedAt(Instant.now());
        resources.getSubmissionStore().save(submission);

        logger.info("Evaluation of {} complete: {} marks ({})",
            submission.getRollNumber(), aggregate.totalMarks(), aggregate.verdict().getLabel());

        request.getReplyTo().tell(new EvaluationMessages.EvaluationComplete(
            new EvaluationResult(evaluated, aggregate.totalMarks(), aggregate.verdict(), warning)));
        resources.getResultWriter().ifPresent(writer ->
            writer.tell(new EvaluationMessages.WriteResults(submission.copy())));
        return Behaviors.stopped();
    }

    private Behavior<EvaluationMessages.Message> onTimedOut() {
        logger.warn("Evaluation of {} timed out with {} answers still pending; scoring them by fallback",
            request.getRollNumber(), pendingGradings);
        try {
            GradingOutcome timedOut = new GradingOutcome.Failed(GradingOutcome.FailureReason.TRANSPORT, TIMED_OUT);
            for (int i = 0; i < evaluations.length; i++) {
                if (evaluations[i] == null) {
                    evaluations[i] = toEvaluation(i, timedOut);
                }
            }
            pendingGradings = 0;
            return finish();
        } catch (RuntimeException e) {
            return abort(e);
        }
    }

    private Behavior<EvaluationMessages.Message> abort(RuntimeException e) {
        logger.error("Evaluation Error", e);
        return fail(EvaluationMessages.ErrorKind.INTERNAL, EVALUATION_FAILED);
    }

    private Behavior<EvaluationMessages.Message> fail(EvaluationMessages.ErrorKind kind, String error) {
        request.getReplyTo().tell(new EvaluationMessages.EvaluationFailed(kind, error));
        return Behaviors.stopped();
    }

    static double clamp(double marks, double maxMarks) {
        return Math.max(0, Math.min(marks, Math.max(0, maxMarks)));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
