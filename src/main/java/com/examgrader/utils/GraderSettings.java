package com.examgrader.utils;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.time.Duration;

/**
 * Typed view of the {@code exam-grader} configuration block
 */
public class GraderSettings {

    private final String httpHost;
    private final int httpPort;
    private final Duration askTimeout;
    private final OracleSettings oracle;
    private final int gradingWorkers;
    private final Duration evaluationTimeout;
    private final Duration queueTimeout;
    private final String resultsCsv;
    private final String seedFile;

    public GraderSettings(String httpHost, int httpPort, Duration askTimeout, OracleSettings oracle,
                          int gradingWorkers, Duration evaluationTimeout, Duration queueTimeout,
                          String resultsCsv, String seedFile) {
        this.httpHost = httpHost;
        this.httpPort = httpPort;
        this.askTimeout = askTimeout;
        this.oracle = oracle;
        this.gradingWorkers = gradingWorkers;
        this.evaluationTimeout = evaluationTimeout;
        this.queueTimeout = queueTimeout;
        this.resultsCsv = resultsCsv;
        this.seedFile = seedFile;
    }

    public static GraderSettings fromConfig(Config root) {
        Config config = root.getConfig("exam-grader");
        Config oracleConfig = config.getConfig("oracle");
        OracleSettings oracle = new OracleSettings(
            oracleConfig.getString("base-url"),
            ApiKeyLoader.loadApiKey(root),
            oracleConfig.getString("model"),
            oracleConfig.getInt("max-tokens"),
            oracleConfig.getDouble("temperature"),
            oracleConfig.getString("stop"),
            oracleConfig.getDuration("connect-timeout"),
            oracleConfig.getDuration("read-timeout"),
            oracleConfig.getDuration("call-timeout")
        );
        Config evaluation = config.getConfig("evaluation");
        Duration askTimeout = config.getDuration("http.ask-timeout");
        Duration evaluationTimeout = evaluation.getDuration("timeout");
        Duration queueTimeout = evaluation.getDuration("queue-timeout");
        // A request may wait in the queue and then run to its timeout; both must end before the caller gives up
        if (queueTimeout.plus(evaluationTimeout).compareTo(askTimeout) >= 0) {
            throw new ConfigException.BadValue(evaluation.origin(), "exam-grader.evaluation.queue-timeout",
                "queue-timeout (" + queueTimeout + ") plus timeout (" + evaluationTimeout
                    + ") must be shorter than http.ask-timeout (" + askTimeout + ")");
        }
        return new GraderSettings(
            config.getString("http.host"),
            config.getInt("http.port"),
            askTimeout,
            oracle,
            Math.max(1, evaluation.getInt("workers")),
            evaluationTimeout,
            queueTimeout,
            evaluation.getString("results-csv"),
            config.getString("data.seed-file")
        );
    }

    public String getHttpHost() { return httpHost; }
    public int getHttpPort() { return httpPort; }
    public Duration getAskTimeout() { return askTimeout; }
    public OracleSettings getOracle() { return oracle; }
    public int getGradingWorkers() { return gradingWorkers; }
    public Duration getEvaluationTimeout() { return evaluationTimeout; }
    public Duration getQueueTimeout() { return queueTimeout; }
    public String getResultsCsv() { return resultsCsv; }
    public String getSeedFile() { return seedFile; }

    /**
     * Connection and sampling parameters for the grading service
     */
    public record OracleSettings(
            String baseUrl,
            String apiKey,
            String model,
            int maxTokens,
            double temperature,
            String stop,
            Duration connectTimeout,
            Duration readTimeout,
            Duration callTimeout) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
