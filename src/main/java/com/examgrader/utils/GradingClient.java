package com.examgrader.utils;

import com.examgrader.models.Question;
import com.examgrader.utils.GradingOutcome.FailureReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the completion endpoint that scores a single answer.
 *
 * <p>The client never throws: every problem on the way (network, empty reply, bad JSON,
 * missing fields) comes back as a {@link GradingOutcome.Failed}.
 */
public class GradingClient {
    private static final Logger logger = LoggerFactory.getLogger(GradingClient.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GraderSettings.OracleSettings settings;

    public GradingClient(GraderSettings.OracleSettings settings) {
        this(settings, new OkHttpClient.Builder()
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .writeTimeout(settings.connectTimeout())
                .callTimeout(settings.callTimeout())
                .build());
    }

    public GradingClient(GraderSettings.OracleSettings settings, OkHttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Grade one answer against its question. Marks above the question's maximum are capped.
     */
    public GradingOutcome grade(Question question, String answerText) {
        if (!settings.hasApiKey()) {
            return new GradingOutcome.Failed(FailureReason.TRANSPORT, "No API key configured");
        }
        String rawText;
        try {
            rawText = requestCompletion(buildPrompt(question, answerText));
        } catch (IOException e) {
            logger.warn("Grading request for question {} failed: {}", question.getQuestionNumber(), e.getMessage());
            return new GradingOutcome.Failed(FailureReason.TRANSPORT, e.getMessage());
        }
        return parseGrade(rawText, question.getMaxMarks());
    }

    /**
     * Build the grading prompt for one question/answer pair
     */
    static String buildPrompt(Question question, String answerText) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Evaluate the student's answer for the following question.\n\n");
        prompt.append("Question (").append(question.getQuestionNumber()).append("): ")
              .append(question.getQuestionText() != null ? question.getQuestionText() : "").append("\n");
        prompt.append("Student Answer: ").append(answerText != null ? answerText : "").append("\n");
        prompt.append("Maximum Marks: ").append(formatMarks(question.getMaxMarks())).append("\n\n");
        prompt.append("Rules:\n");
        prompt.append("- If the answer is correct ≥ 50%, assign full marks.\n");
        prompt.append("- If partially correct, assign some marks.\n");
        prompt.append("- If empty or irrelevant, assign 0 marks.\n");
        prompt.append("- Provide a short feedback.\n\n");
        prompt.append("Return JSON only in this format:\n");
        prompt.append("{\"marks\": number, \"feedback\": string}");
        return prompt.toString();
    }

    /**
     * POST the prompt to {@code /completions} and return the first choice's trimmed text, or null
     */
    String requestCompletion(String prompt) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.model());
        body.put("prompt", prompt);
        body.put("max_tokens", settings.maxTokens());
        body.put("temperature", settings.temperature());
        body.put("stop", List.of(settings.stop()));

        Request request = new Request.Builder()
                .url(settings.baseUrl() + "/completions")
                .addHeader("Authorization", "Bearer " + settings.apiKey())
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Grading service returned HTTP " + response.code());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                return null;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(responseBody.string());
            } catch (JsonProcessingException e) {
                logger.warn("Grading service returned a non-JSON envelope: {}", e.getOriginalMessage());
                return null;
            }
            JsonNode text = root == null ? null : root.path("choices").path(0).get("text");
            return text != null && text.isTextual() ? text.asText().trim() : null;
        }
    }

    /**
     * Validate the model's text and turn it into a grade
     */
    GradingOutcome parseGrade(String rawText, double maxMarks) {
        if (rawText == null || rawText.isBlank()) {
            return new GradingOutcome.Failed(FailureReason.EMPTY_RESPONSE);
        }

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(rawText);
        } catch (JsonProcessingException e) {
            logger.warn("JSON parse error on text: {}", rawText);
            return new GradingOutcome.Failed(FailureReason.MALFORMED_JSON);
        }
        if (parsed == null || !parsed.isObject()) {
            logger.warn("JSON parse error on text: {}", rawText);
            return new GradingOutcome.Failed(FailureReason.MALFORMED_JSON);
        }

        JsonNode marks = parsed.get("marks");
        JsonNode feedback = parsed.get("feedback");
        if (marks == null || !marks.isNumber() || !Double.isFinite(marks.asDouble())
                || feedback == null || !feedback.isTextual() || feedback.asText().isBlank()) {
            return new GradingOutcome.Failed(FailureReason.MISSING_FIELDS);
        }

        return new GradingOutcome.Graded(Math.min(marks.asDouble(), maxMarks), feedback.asText());
    }

    private static String formatMarks(double marks) {
        return marks == Math.rint(marks) ? String.valueOf((long) marks) : String.valueOf(marks);
    }
}
