package com.examgrader;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.http.javadsl.model.HttpEntity;
import akka.http.javadsl.model.HttpResponse;
import com.examgrader.actors.EvaluationMessages;
import com.examgrader.models.Evaluation;
import com.examgrader.models.EvaluationResult;
import com.examgrader.models.Submission;
import com.examgrader.models.Verdict;
import com.examgrader.store.InMemoryExamStore;
import com.examgrader.store.InMemorySubmissionStore;
import com.examgrader.utils.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationServerTest {

    static final ActorTestKit testKit = ActorTestKit.create();

    private static final String EXAM_ID = "64f1c2a9b3e4d5f6a7b8c9d0";

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private InMemoryExamStore examStore;
    private InMemorySubmissionStore submissionStore;
    private EvaluationServer server;

    @AfterAll
    static void cleanup() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        examStore = new InMemoryExamStore();
        submissionStore = new InMemorySubmissionStore();
        TestProbe<EvaluationMessages.Message> service = testKit.createTestProbe();
        server = new EvaluationServer(testKit.system(), service.getRef(), examStore, submissionStore,
            objectMapper, Duration.ofSeconds(5));
    }

    private JsonNode body(HttpResponse response) throws JsonProcessingException {
        HttpEntity.Strict entity = (HttpEntity.Strict) response.entity();
        return objectMapper.readTree(entity.getData().utf8String());
    }

    @Test
    void testCompletedEvaluationIsOkWithResultBody() throws JsonProcessingException {
        EvaluationResult result = new EvaluationResult(
            List.of(new Evaluation("1", 7, "Good", false)), 7, Verdict.FAIL, null);

        HttpResponse response = server.toHttpResponse(new EvaluationMessages.EvaluationComplete(result));

        assertEquals(200, response.status().intValue());
        JsonNode json = body(response);
        assertEquals("Evaluation complete", json.get("message").asText());
        assertEquals(7, json.get("totalMarks").asDouble());
        assertEquals("Fail", json.get("result").asText());
        assertEquals("1", json.get("evaluations").get(0).get("questionNumber").asText());
        assertFalse(json.get("evaluations").get(0).get("usedFallback").asBoolean());
        assertFalse(json.has("warning"));
    }

    @Test
    void testFailuresMapToStatusAndField() throws JsonProcessingException {
        HttpResponse badRequest = server.toHttpResponse(new EvaluationMessages.EvaluationFailed(
            EvaluationMessages.ErrorKind.BAD_REQUEST, "Invalid examId"));
        assertEquals(400, badRequest.status().intValue());
        assertEquals("Invalid examId", body(badRequest).get("error").asText());

        HttpResponse notFound = server.toHttpResponse(new EvaluationMessages.EvaluationFailed(
            EvaluationMessages.ErrorKind.NOT_FOUND, "Student not found"));
        assertEquals(404, notFound.status().intValue());
        assertEquals("Student not found", body(notFound).get("message").asText());

        HttpResponse internal = server.toHttpResponse(new EvaluationMessages.EvaluationFailed(
            EvaluationMessages.ErrorKind.INTERNAL, "Evaluation failed"));
        assertEquals(500, internal.status().intValue());
        assertEquals("Evaluation failed", body(internal).get("error").asText());
    }

    @Test
    void testParseEvaluateRequest() throws JsonProcessingException {
        EvaluationServer.EvaluateRequest request = server.parseEvaluateRequest(
            "{\"rollNumber\": \"R1\", \"examId\": \"" + EXAM_ID + "\", \"extra\": true}");
        assertEquals("R1", request.rollNumber);
        assertEquals(EXAM_ID, request.examId);

        EvaluationServer.EvaluateRequest empty = server.parseEvaluateRequest("  ");
        assertNull(empty.rollNumber);
        assertNull(empty.examId);

        assertThrows(JsonProcessingException.class, () -> server.parseEvaluateRequest("{not json"));
    }

    @Test
    void testSaveExamValidatesAndStores() throws JsonProcessingException {
        String exam = "{\"title\": \"Biology\", \"passMarks\": 5, \"questions\": ["
            + "{\"questionNumber\": \"1\", \"question\": \"What is photosynthesis?\", \"marks\": 10}]}";

        HttpResponse saved = server.saveExam(EXAM_ID, exam);

        assertEquals(200, saved.status().intValue());
        assertEquals(EXAM_ID, body(saved).get("id").asText());
        assertEquals(10, examStore.findById(EXAM_ID).orElseThrow().getQuestions().get(0).getMaxMarks());
        assertEquals(200, server.findExam(EXAM_ID).status().intValue());

        assertEquals(400, server.saveExam("exam-1", exam).status().intValue());
        assertEquals(400, server.saveExam(EXAM_ID, "{\"passMarks\": 5, \"questions\": []}").status().intValue());
        assertEquals(400, server.saveExam(EXAM_ID,
            "{\"passMarks\": 5, \"questions\": [{\"questionNumber\": \"1\", \"maxMarks\": 0}]}").status().intValue());
        assertEquals(400, server.saveExam(EXAM_ID, "[").status().intValue());
    }

    @Test
    void testNullEntriesAreRejected() throws JsonProcessingException {
        HttpResponse exam = server.saveExam(EXAM_ID, "{\"passMarks\": 5, \"questions\": ["
            + "{\"questionNumber\": \"1\", \"maxMarks\": 10}, null]}");
        assertEquals(400, exam.status().intValue());
        assertTrue(body(exam).has("error"));
        assertTrue(examStore.findById(EXAM_ID).isEmpty());

        HttpResponse submission = server.saveSubmission("R1",
            "{\"answers\": [{\"questionNumber\": \"1\", \"answerText\": \"x\"}, null]}");
        assertEquals(400, submission.status().intValue());
        assertTrue(body(submission).has("error"));
        assertTrue(submissionStore.findByRollNumber("R1").isEmpty());
    }

    @Test
    void testSaveSubmissionResetsEvaluationState() throws JsonProcessingException {
        String submission = "{\"answers\": [{\"questionNumber\": \"Q1\", \"answerText\": \"Light into sugar\"}],"
            + " \"totalMarks\": 99, \"result\": \"Pass\"}";

        HttpResponse saved = server.saveSubmission("R1", submission);

        assertEquals(200, saved.status().intValue());
        assertEquals("R1", body(saved).get("rollNumber").asText());
        Submission stored = submissionStore.findByRollNumber("R1").orElseThrow();
        assertEquals(0, stored.getTotalMarks());
        assertNull(stored.getResult());
        assertEquals("Q1", stored.getAnswers().get(0).getQuestionNumber());

        assertEquals(400, server.saveSubmission("R2", "{\"examId\": \"nope\", \"answers\": []}").status().intValue());
    }

    @Test
    void testLookupsReportNotFound() throws JsonProcessingException {
        HttpResponse exam = server.findExam(EXAM_ID);
        assertEquals(404, exam.status().intValue());
        assertEquals("Exam not found", body(exam).get("message").asText());

        HttpResponse submission = server.findSubmission("ghost");
        assertEquals(404, submission.status().intValue());
        assertEquals("Student not found", body(submission).get("message").asText());
    }
}
