package com.examgrader.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.*;
import com.examgrader.utils.GradingClient;
import com.examgrader.utils.GradingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Actor that sends one answer at a time to the grading service.
 * Runs on the blocking I/O dispatcher since the HTTP call is synchronous.
 */
public class GradingWorkerActor extends AbstractBehavior<EvaluationMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(GradingWorkerActor.class);

    private final GradingClient gradingClient;

    private GradingWorkerActor(ActorContext<EvaluationMessages.Message> context, GradingClient gradingClient) {
        super(context);
        this.gradingClient = gradingClient;
    }

    public static Behavior<EvaluationMessages.Message> create(GradingClient gradingClient) {
        return Behaviors.setup(context -> new GradingWorkerActor(context, gradingClient));
    }

    @Override
    public Receive<EvaluationMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(EvaluationMessages.GradeAnswer.class, this::onGradeAnswer)
                .build();
    }

    private Behavior<EvaluationMessages.Message> onGradeAnswer(EvaluationMessages.GradeAnswer msg) {
        GradingOutcome outcome;
        try {
            outcome = gradingClient.grade(msg.getQuestion(), msg.getAnswerText());
        } catch (RuntimeException e) {
            logger.error("Grading client failed for question {}", msg.getQuestion().getQuestionNumber(), e);
            outcome = new GradingOutcome.Failed(GradingOutcome.FailureReason.TRANSPORT, e.getMessage());
        }
        msg.getReplyTo().tell(new EvaluationMessages.AnswerGraded(msg.getIndex(), outcome));
        return this;
    }
}
