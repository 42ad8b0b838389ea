package com.examgrader;

import akka.actor.typed.ActorSystem;
import akka.http.javadsl.ServerBinding;
import com.examgrader.actors.EvaluationMessages;
import com.examgrader.actors.EvaluationServiceActor;
import com.examgrader.store.DataLoader;
import com.examgrader.store.InMemoryExamStore;
import com.examgrader.store.InMemorySubmissionStore;
import com.examgrader.utils.GraderSettings;
import com.examgrader.utils.GradingClient;
import com.examgrader.utils.JsonSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.CompletionStage;

/**
 * Main application class: wires the stores, the evaluation service and the HTTP server
 */
public class ExamGraderMain {
    private static final Logger logger = LoggerFactory.getLogger(ExamGraderMain.class);

    public static void main(String[] args) {
        System.out.println("🚀 Starting Exam Grader...");

        Config config = ConfigFactory.load();
        GraderSettings settings = GraderSettings.fromConfig(config);
        ObjectMapper objectMapper = JsonSupport.newObjectMapper();

        InMemoryExamStore examStore = new InMemoryExamStore();
        InMemorySubmissionStore submissionStore = new InMemorySubmissionStore();
        if (!settings.getSeedFile().isBlank()) {
            try {
                new DataLoader(objectMapper).load(Paths.get(settings.getSeedFile()), examStore, submissionStore);
            } catch (IOException e) {
                logger.error("Could not load seed file {}", settings.getSeedFile(), e);
                System.exit(1);
                return;
            }
        }

        GradingClient gradingClient = new GradingClient(settings.getOracle());
        ActorSystem<EvaluationMessages.Message> system = ActorSystem.create(
            EvaluationServiceActor.create(settings, gradingClient, examStore, submissionStore),
            "ExamGrader",
            config);

        try {
            EvaluationServer server = new EvaluationServer(
                system, system, examStore, submissionStore, objectMapper, settings.getAskTimeout());
            CompletionStage<ServerBinding> binding = server.start(settings.getHttpHost(), settings.getHttpPort());

            System.out.println("✅ Exam Grader started on http://" + settings.getHttpHost() + ":" + settings.getHttpPort());
            System.out.println("⏹️  Press Ctrl+C to stop the server...");

            Thread.currentThread().join();

            binding
                .thenCompose(ServerBinding::unbind)
                .thenAccept(unbound -> system.terminate());

        } catch (InterruptedException e) {
            logger.info("Server interrupted, shutting down...");
            Thread.currentThread().interrupt();
            system.terminate();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            system.terminate();
        }
    }
}
