package com.examgrader.actors;

import akka.actor.typed.ActorRef;
import com.examgrader.store.ExamStore;
import com.examgrader.store.SubmissionStore;
import com.examgrader.utils.FallbackScorer;

import java.time.Duration;
import java.util.Optional;

/**
 * Everything a coordinator needs to run one evaluation
 */
public class EvaluationResources {
    private final ExamStore examStore;
    private final SubmissionStore submissionStore;
    private final FallbackScorer fallbackScorer;
    private final ActorRef<EvaluationMessages.Message> gradingWorkers;
    private final ActorRef<EvaluationMessages.Message> resultWriter;
    private final Duration timeout;

    public EvaluationResources(ExamStore examStore,
                               SubmissionStore submissionStore,
                               FallbackScorer fallbackScorer,
                               ActorRef<EvaluationMessages.Message> gradingWorkers,
                               ActorRef<EvaluationMessages.Message> resultWriter,
                               Duration timeout) {
        this.examStore = examStore;
        this.submissionStore = submissionStore;
        this.fallbackScorer = fallbackScorer;
        this.gradingWorkers = gradingWorkers;
        this.resultWriter = resultWriter;
        this.timeout = timeout;
    }

    public ExamStore getExamStore() { return examStore; }
    public SubmissionStore getSubmissionStore() { return submissionStore; }
    public FallbackScorer getFallbackScorer() { return fallbackScorer; }
    public ActorRef<EvaluationMessages.Message> getGradingWorkers() { return gradingWorkers; }
    public Optional<ActorRef<EvaluationMessages.Message>> getResultWriter() { return Optional.ofNullable(resultWriter); }
    public Duration getTimeout() { return timeout; }
}
