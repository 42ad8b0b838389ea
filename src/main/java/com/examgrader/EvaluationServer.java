package com.examgrader;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.model.*;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import akka.http.javadsl.unmarshalling.Unmarshaller;
import com.examgrader.actors.EvaluationMessages;
import com.examgrader.models.Exam;
import com.examgrader.models.Question;
import com.examgrader.models.Submission;
import com.examgrader.store.ExamStore;
import com.examgrader.store.SubmissionStore;
import com.examgrader.utils.ExamKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * HTTP surface: evaluation requests plus minimal exam/submission storage endpoints.
 */
public class EvaluationServer extends AllDirectives {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationServer.class);

    static final String INVALID_BODY = "Invalid request body";
    static final String EVALUATION_FAILED = "Evaluation failed";

    private final ActorSystem<?> system;
    private final ActorRef<EvaluationMessages.Message> evaluationService;
    private final ExamStore examStore;
    private final SubmissionStore submissionStore;
    private final ObjectMapper objectMapper;
    private final Duration askTimeout;

    public EvaluationServer(ActorSystem<?> system,
                            ActorRef<EvaluationMessages.Message> evaluationService,
                            ExamStore examStore,
                            SubmissionStore submissionStore,
                            ObjectMapper objectMapper,
                            Duration askTimeout) {
        this.system = system;
        this.evaluationService = evaluationService;
        this.examStore = examStore;
        this.submissionStore = submissionStore;
        this.objectMapper = objectMapper;
        this.askTimeout = askTimeout;
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system)
                .newServerAt(host, port)
                .bind(createRoute())
                .thenApply(binding -> {
                    logger.info("Server online at http://{}:{}/", host, port);
                    return binding;
                });
    }

    Route createRoute() {
        return pathPrefix("api", () -> concat(
            pathPrefix("evaluate", () -> concat(
                pathEndOrSingleSlash(() ->
                    post(() -> entity(Unmarshaller.entityToString(), body -> evaluate(null, body)))
                ),
                path(PathMatchers.segment(), rollNumber ->
                    post(() -> entity(Unmarshaller.entityToString(), body -> evaluate(rollNumber, body)))
                )
            )),
            pathPrefix("exams", () ->
                path(PathMatchers.segment(), examId -> concat(
                    put(() -> entity(Unmarshaller.entityToString(), body -> complete(saveExam(examId, body)))),
                    get(() -> complete(findExam(examId)))
                ))
            ),
            pathPrefix("submissions", () ->
                path(PathMatchers.segment(), rollNumber -> concat(
                    put(() -> entity(Unmarshaller.entityToString(), body -> complete(saveSubmission(rollNumber, body)))),
                    get(() -> complete(findSubmission(rollNumber)))
                ))
            )
        ));
    }

    private Route evaluate(String pathRollNumber, String body) {
        EvaluateRequest request;
        try {
            request = parseEvaluateRequest(body);
        } catch (JsonProcessingException e) {
            return complete(errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, INVALID_BODY));
        }
        String rollNumber = request.rollNumber != null && !request.rollNumber.isBlank()
            ? request.rollNumber
            : pathRollNumber;

        logger.info("Received evaluation request for {} (exam {})", rollNumber, request.examId);

        CompletionStage<EvaluationMessages.EvaluationReply> reply = AskPattern.ask(
            evaluationService,
            (ActorRef<EvaluationMessages.EvaluationReply> replyTo) ->
                new EvaluationMessages.EvaluateSubmission(rollNumber, request.examId, replyTo),
            askTimeout,
            system.scheduler());

        CompletionStage<HttpResponse> response = reply
            .thenApply(this::toHttpResponse)
            .exceptionally(e -> {
                logger.error("Evaluation Error for {}", rollNumber, e);
                return errorResponse(EvaluationMessages.ErrorKind.INTERNAL, EVALUATION_FAILED);
            });
        return completeWithFuture(response);
    }

    EvaluateRequest parseEvaluateRequest(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return new EvaluateRequest();
        }
        EvaluateRequest request = objectMapper.readValue(body, EvaluateRequest.class);
        return request != null ? request : new EvaluateRequest();
    }

    HttpResponse toHttpResponse(EvaluationMessages.EvaluationReply reply) {
        if (reply instanceof EvaluationMessages.EvaluationComplete) {
            return jsonResponse(StatusCodes.OK, ((EvaluationMessages.EvaluationComplete) reply).getResult());
        }
        if (reply instanceof EvaluationMessages.EvaluationFailed) {
            EvaluationMessages.EvaluationFailed failed = (EvaluationMessages.EvaluationFailed) reply;
            return errorResponse(failed.getKind(), failed.getError());
        }
        logger.error("Unexpected evaluation reply: {}", reply);
        return errorResponse(EvaluationMessages.ErrorKind.INTERNAL, EVALUATION_FAILED);
    }

    HttpResponse saveExam(String examId, String body) {
        if (!ExamKeys.isWellFormed(examId)) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, "Invalid examId");
        }
        Exam exam;
        try {
            exam = objectMapper.readValue(body, Exam.class);
        } catch (JsonProcessingException e) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, INVALID_BODY);
        }
        if (exam == null || exam.getQuestions().isEmpty() || exam.getPassMarks() < 0) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, "Exam needs questions and a non-negative passMarks");
        }
        for (Question question : exam.getQuestions()) {
            if (question == null || question.getQuestionNumber() == null || question.getQuestionNumber().isBlank()
                    || !(question.getMaxMarks() > 0)) {
                return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST,
                    "Every question needs a questionNumber and positive maxMarks");
            }
        }
        exam.setId(examId);
        examStore.save(exam);
        logger.info("Stored exam {} with {} questions", examId, exam.getQuestions().size());
        return jsonResponse(StatusCodes.OK, exam);
    }

    HttpResponse findExam(String examId) {
        return examStore.findById(examId)
            .map(exam -> jsonResponse(StatusCodes.OK, exam))
            .orElseGet(() -> errorResponse(EvaluationMessages.ErrorKind.NOT_FOUND, "Exam not found"));
    }

    HttpResponse saveSubmission(String rollNumber, String body) {
        Submission submission;
        try {
            submission = objectMapper.readValue(body, Submission.class);
        } catch (JsonProcessingException e) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, INVALID_BODY);
        }
        if (submission == null) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, INVALID_BODY);
        }
        if (submission.getAnswers().contains(null)) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, "Answers must not contain null entries");
        }
        if (submission.getExamId() != null && !ExamKeys.isWellFormed(submission.getExamId())) {
            return errorResponse(EvaluationMessages.ErrorKind.BAD_REQUEST, "Invalid examId");
        }
        Submission fresh = new Submission(rollNumber, submission.getAnswers());
        fresh.setExamId(submission.getExamId());
        submissionStore.save(fresh);
        logger.info("Stored {} answers for {}", fresh.getAnswers().size(), rollNumber);
        return jsonResponse(StatusCodes.OK, fresh);
    }

    HttpResponse findSubmission(String rollNumber) {
        return submissionStore.findByRollNumber(rollNumber)
            .map(submission -> jsonResponse(StatusCodes.OK, submission))
            .orElseGet(() -> errorResponse(EvaluationMessages.ErrorKind.NOT_FOUND, "Student not found"));
    }

    HttpResponse errorResponse(EvaluationMessages.ErrorKind kind, String error) {
        return jsonResponse(StatusCodes.get(kind.getStatus()), Map.of(kind.getPayloadField(), error));
    }

    private HttpResponse jsonResponse(StatusCode status, Object body) {
        try {
            return HttpResponse.create()
                .withStatus(status)
                .withEntity(ContentTypes.APPLICATION_JSON, objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            logger.error("Error serializing response", e);
            return HttpResponse.create()
                .withStatus(StatusCodes.INTERNAL_SERVER_ERROR)
                .withEntity(ContentTypes.APPLICATION_JSON, "{\"error\":\"" + EVALUATION_FAILED + "\"}");
        }
    }

    public static class EvaluateRequest {
        public String rollNumber;
        public String examId;

        public EvaluateRequest() {}
    }
}
