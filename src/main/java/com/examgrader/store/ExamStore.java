package com.examgrader.store;

import com.examgrader.models.Exam;

import java.util.Optional;

/**
 * Lookup and storage of exam definitions
 */
public interface ExamStore {

    Optional<Exam> findById(String examId);

    void save(Exam exam);
}
