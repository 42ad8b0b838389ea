package com.examgrader.store;

import com.examgrader.models.Submission;

import java.util.Optional;

/**
 * Lookup and storage of student submissions, keyed by roll number
 */
public interface SubmissionStore {

    Optional<Submission> findByRollNumber(String rollNumber);

    /**
     * Replace the stored submission in a single write
     */
    void save(Submission submission);
}
