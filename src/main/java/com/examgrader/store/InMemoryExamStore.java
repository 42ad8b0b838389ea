package com.examgrader.store;

import com.examgrader.models.Exam;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe exam store; callers always get their own copy
 */
public class InMemoryExamStore implements ExamStore {

    private final Map<String, Exam> exams = new ConcurrentHashMap<>();

    @Override
    public Optional<Exam> findById(String examId) {
        if (examId == null) {
            return Optional.empty();
        }
        Exam exam = exams.get(examId);
        return exam != null ? Optional.of(exam.copy()) : Optional.empty();
    }

    @Override
    public void save(Exam exam) {
        exams.put(exam.getId(), exam.copy());
    }
}
