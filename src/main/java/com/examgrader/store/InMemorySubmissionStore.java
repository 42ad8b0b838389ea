package com.examgrader.store;

import com.examgrader.models.Submission;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe submission store; callers always get their own copy
 */
public class InMemorySubmissionStore implements SubmissionStore {

    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();

    @Override
    public Optional<Submission> findByRollNumber(String rollNumber) {
        if (rollNumber == null) {
            return Optional.empty();
        }
        Submission submission = submissions.get(rollNumber);
        return submission != null ? Optional.of(submission.copy()) : Optional.empty();
    }

    @Override
    public void save(Submission submission) {
        submissions.put(submission.getRollNumber(), submission.copy());
    }
}
