package com.examgrader.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.SupervisorStrategy;
import akka.actor.typed.javadsl.*;
import com.examgrader.store.ExamStore;
import com.examgrader.store.SubmissionStore;
import com.examgrader.utils.FallbackScorer;
import com.examgrader.utils.GradingClient;
import com.examgrader.utils.GraderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for evaluation requests.
 *
 * <p>Owns the grading worker pool and the result writer, and spawns one coordinator per
 * request. Evaluations of the same roll number never overlap: a request that arrives while
 * another one for the same student is running waits in a queue until that one finishes.
 * A request that waits longer than the queue timeout is answered with an internal error
 * and never runs.
 */
public class EvaluationServiceActor extends AbstractBehavior<EvaluationMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationServiceActor.class);

    private final EvaluationResources resources;
    private final TimerScheduler<EvaluationMessages.Message> timers;
    private final Duration queueTimeout;
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, Deque<QueuedRequest>> waiting = new HashMap<>();
    private long coordinatorCount;
    private long ticketCount;

    private EvaluationServiceActor(ActorContext<EvaluationMessages.Message> context,
                                  TimerScheduler<EvaluationMessages.Message> timers,
                                  GradingClient gradingClient,
                                  FallbackScorer fallbackScorer,
                                  ExamStore examStore,
                                  SubmissionStore submissionStore,
                                  int workers,
                                  Duration timeout,
                                  Duration queueTimeout,
                                  String resultsCsv) {
        super(context);
        this.timers = timers;
        this.queueTimeout = queueTimeout;

        ActorRef<EvaluationMessages.Message> gradingWorkers = context.spawn(
            Routers.pool(workers,
                    Behaviors.supervise(GradingWorkerActor.create(gradingClient))
                        .onFailure(Exception.class, SupervisorStrategy.restart()))
                .withRouteeProps(DispatcherSelector.blocking()),
            "grading-workers");

        ActorRef<EvaluationMessages.Message> resultWriter = null;
        if (resultsCsv != null && !resultsCsv.isBlank()) {
            resultWriter = context.spawn(ResultWriterActor.create(resultsCsv), "result-writer",
                DispatcherSelector.blocking());
        }

        this.resources = new EvaluationResources(
            examStore, submissionStore, fallbackScorer, gradingWorkers, resultWriter, timeout);
        logger.info("Evaluation service started with {} grading workers", workers);
    }

    public static Behavior<EvaluationMessages.Message> create(GraderSettings settings,
                                                              GradingClient gradingClient,
                                                              ExamStore examStore,
                                                              SubmissionStore submissionStore) {
        return create(gradingClient, new FallbackScorer(), examStore, submissionStore,
            settings.getGradingWorkers(), settings.getEvaluationTimeout(), settings.getQueueTimeout(),
            settings.getResultsCsv());
    }

    public static Behavior<EvaluationMessages.Message> create(GradingClient gradingClient,
                                                              FallbackScorer fallbackScorer,
                                                              ExamStore examStore,
                                                              SubmissionStore submissionStore,
                                                              int workers,
                                                              Duration timeout,
                                                              Duration queueTimeout,
                                                              String resultsCsv) {
        return Behaviors.setup(context -> Behaviors.withTimers(timers -> new EvaluationServiceActor(
            context, timers, gradingClient, fallbackScorer, examStore, submissionStore,
            workers, timeout, queueTimeout, resultsCsv)));
    }

    @Override
    public Receive<EvaluationMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(EvaluationMessages.EvaluateSubmission.class, this::onEvaluateSubmission)
                .onMessage(EvaluationMessages.CoordinatorFinished.class, this::onCoordinatorFinished)
                .onMessage(EvaluationMessages.QueuedRequestExpired.class, this::onQueuedRequestExpired)
                .build();
    }

    private Behavior<EvaluationMessages.Message> onEvaluateSubmission(EvaluationMessages.EvaluateSubmission msg) {
        String key = msg.getRollNumber() == null ? "" : msg.getRollNumber().trim();
        if (inFlight.contains(key)) {
            long ticket = ++ticketCount;
            waiting.computeIfAbsent(key, k -> new ArrayDeque<>()).add(new QueuedRequest(ticket, msg));
            timers.startSingleTimer(ticket, new EvaluationMessages.QueuedRequestExpired(key, ticket), queueTimeout);
            logger.info("Evaluation of {} already running; request queued", key);
            return this;
        }
        startCoordinator(key, msg);
        return this;
    }

    private Behavior<EvaluationMessages.Message> onCoordinatorFinished(EvaluationMessages.CoordinatorFinished msg) {
        String key = msg.getRollNumber();
        Deque<QueuedRequest> queue = waiting.get(key);
        if (queue == null || queue.isEmpty()) {
            waiting.remove(key);
            inFlight.remove(key);
            return this;
        }
        QueuedRequest next = queue.poll();
        if (queue.isEmpty()) {
            waiting.remove(key);
        }
        timers.cancel(next.ticket);
        startCoordinator(key, next.request);
        return this;
    }

    private Behavior<EvaluationMessages.Message> onQueuedRequestExpired(EvaluationMessages.QueuedRequestExpired msg) {
        Deque<QueuedRequest> queue = waiting.get(msg.getRollNumber());
        if (queue == null) {
            return this;
        }
        QueuedRequest expired = null;
        for (QueuedRequest queued : queue) {
            if (queued.ticket == msg.getTicket()) {
                expired = queued;
                break;
            }
        }
        if (expired == null) {
            return this;
        }
        queue.remove(expired);
        if (queue.isEmpty()) {
            waiting.remove(msg.getRollNumber());
        }
        logger.error("Queued evaluation of {} waited longer than {}; rejecting it",
            msg.getRollNumber(), queueTimeout);
        expired.request.getReplyTo().tell(new EvaluationMessages.EvaluationFailed(
            EvaluationMessages.ErrorKind.INTERNAL, EvaluationCoordinatorActor.EVALUATION_FAILED));
        return this;
    }

    private void startCoordinator(String key, EvaluationMessages.EvaluateSubmission msg) {
        inFlight.add(key);
        ActorRef<EvaluationMessages.Message> coordinator = getContext().spawn(
            EvaluationCoordinatorActor.create(resources), "coordinator-" + (++coordinatorCount));
        getContext().watchWith(coordinator, new EvaluationMessages.CoordinatorFinished(key));
        coordinator.tell(msg);
    }

    private static final class QueuedRequest {
        private final long ticket;
        private final EvaluationMessages.EvaluateSubmission request;

        private QueuedRequest(long ticket, EvaluationMessages.EvaluateSubmission request) {
            this.ticket = ticket;
            this.request = request;
        }
    }
}
