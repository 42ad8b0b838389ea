package com.examgrader.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.*;
import com.examgrader.utils.CsvUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Actor responsible for appending evaluated submissions to the CSV results report
 */
public class ResultWriterActor extends AbstractBehavior<EvaluationMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(ResultWriterActor.class);

    private final String filePath;

    private ResultWriterActor(ActorContext<EvaluationMessages.Message> context, String filePath) {
        super(context);
        this.filePath = filePath;
    }

    public static Behavior<EvaluationMessages.Message> create(String filePath) {
        return Behaviors.setup(context -> new ResultWriterActor(context, filePath));
    }

    @Override
    public Receive<EvaluationMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(EvaluationMessages.WriteResults.class, this::onWriteResults)
                .build();
    }

    private Behavior<EvaluationMessages.Message> onWriteResults(EvaluationMessages.WriteResults msg) {
        try {
            CsvUtils.appendEvaluationsToCsv(filePath, msg.getSubmission());
        } catch (IOException e) {
            logger.error("Failed to write results for {} to {}: {}",
                msg.getSubmission().getRollNumber(), filePath, e.getMessage());
        }
        return this;
    }
}
