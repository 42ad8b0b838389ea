package com.examgrader.utils;

import com.examgrader.models.Question;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class GradingClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Question QUESTION = new Question("1", "What is photosynthesis?", 10);

    private final AtomicReference<Request> lastRequest = new AtomicReference<>();

    private static GraderSettings.OracleSettings settings(String apiKey) {
        return new GraderSettings.OracleSettings(
            "http://grading.test/v1", apiKey, "test-model", 100, 0.5, "\n",
            Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    private static String envelope(String text) throws IOException {
        return MAPPER.writeValueAsString(Map.of("choices", List.of(Map.of("text", text))));
    }

    private GradingClient clientReplying(int code, String body) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                lastRequest.set(chain.request());
                return new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message(code == 200 ? "OK" : "Error")
                    .body(ResponseBody.create(body, MediaType.get("application/json")))
                    .build();
            })
            .build();
        return new GradingClient(settings("test-key"), httpClient);
    }

    @Test
    void testValidGrade() throws IOException {
        GradingClient client = clientReplying(200, envelope(" {\"marks\": 7, \"feedback\": \"Good\"}"));

        GradingOutcome outcome = client.grade(QUESTION, "Plants make food from light.");

        GradingOutcome.Graded graded = assertInstanceOf(GradingOutcome.Graded.class, outcome);
        assertEquals(7, graded.marks());
        assertEquals("Good", graded.feedback());
    }

    @Test
    void testMarksAboveMaximumAreCapped() throws IOException {
        GradingClient client = clientReplying(200, envelope("{\"marks\": 15, \"feedback\": \"Excellent\"}"));

        GradingOutcome.Graded graded = assertInstanceOf(GradingOutcome.Graded.class,
            client.grade(QUESTION, "answer"));

        assertEquals(10, graded.marks());
    }

    @Test
    void testRequestCarriesModelParametersAndPrompt() throws IOException {
        GradingClient client = clientReplying(200, envelope("{\"marks\": 3, \"feedback\": \"Partial\"}"));

        client.grade(QUESTION, "Plants make food from light.");

        Request request = lastRequest.get();
        assertNotNull(request);
        assertEquals("http://grading.test/v1/completions", request.url().toString());
        assertEquals("POST", request.method());
        assertEquals("Bearer test-key", request.header("Authorization"));

        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        JsonNode body = MAPPER.readTree(buffer.readUtf8());
        assertEquals("test-model", body.get("model").asText());
        assertEquals(100, body.get("max_tokens").asInt());
        assertEquals(0.5, body.get("temperature").asDouble(), 1e-9);
        assertEquals("\n", body.get("stop").get(0).asText());

        String prompt = body.get("prompt").asText();
        assertTrue(prompt.contains("Question (1): What is photosynthesis?"));
        assertTrue(prompt.contains("Student Answer: Plants make food from light."));
        assertTrue(prompt.contains("Maximum Marks: 10"));
        assertTrue(prompt.endsWith("{\"marks\": number, \"feedback\": string}"));
    }

    @Test
    void testMalformedJsonFails() throws IOException {
        GradingClient client = clientReplying(200, envelope("Sure! The student deserves 7 marks."));

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.MALFORMED_JSON, failed.reason());
    }

    @Test
    void testEmptyTextFails() throws IOException {
        GradingClient client = clientReplying(200, envelope("   "));

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.EMPTY_RESPONSE, failed.reason());
    }

    @Test
    void testMissingChoicesCountsAsEmpty() {
        GradingClient client = clientReplying(200, "{\"choices\": []}");

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.EMPTY_RESPONSE, failed.reason());
    }

    @Test
    void testMissingFieldsFail() throws IOException {
        GradingClient client = clientReplying(200, envelope("{\"marks\": 7}"));

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.MISSING_FIELDS, failed.reason());
    }

    @Test
    void testParseGradeRejectsWrongTypes() {
        GradingClient client = clientReplying(200, "{}");

        assertEquals(GradingOutcome.FailureReason.MISSING_FIELDS,
            ((GradingOutcome.Failed) client.parseGrade("{\"marks\": \"seven\", \"feedback\": \"ok\"}", 10)).reason());
        assertEquals(GradingOutcome.FailureReason.MISSING_FIELDS,
            ((GradingOutcome.Failed) client.parseGrade("{\"marks\": 4, \"feedback\": \"\"}", 10)).reason());
        assertEquals(GradingOutcome.FailureReason.MALFORMED_JSON,
            ((GradingOutcome.Failed) client.parseGrade("[4, \"ok\"]", 10)).reason());
        assertEquals(GradingOutcome.FailureReason.MALFORMED_JSON,
            ((GradingOutcome.Failed) client.parseGrade("{\"marks\": 4, \"feedback\": \"ok\"} trailing", 10)).reason());
    }

    @Test
    void testHttpErrorIsTransportFailure() {
        GradingClient client = clientReplying(500, "{\"error\": \"overloaded\"}");

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.TRANSPORT, failed.reason());
        assertTrue(failed.detail().contains("500"));
    }

    @Test
    void testNetworkErrorIsTransportFailure() {
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                throw new IOException("Connection refused");
            })
            .build();
        GradingClient client = new GradingClient(settings("test-key"), httpClient);

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.TRANSPORT, failed.reason());
        assertEquals("Connection refused", failed.detail());
    }

    @Test
    void testMissingApiKeySkipsTheCall() {
        AtomicInteger calls = new AtomicInteger();
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                calls.incrementAndGet();
                return chain.proceed(chain.request());
            })
            .build();
        GradingClient client = new GradingClient(settings(""), httpClient);

        GradingOutcome.Failed failed = assertInstanceOf(GradingOutcome.Failed.class, client.grade(QUESTION, "a"));

        assertEquals(GradingOutcome.FailureReason.TRANSPORT, failed.reason());
        assertEquals(0, calls.get());
    }
}
