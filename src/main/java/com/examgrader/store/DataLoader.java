package com.examgrader.store;

import com.examgrader.models.Exam;
import com.examgrader.models.Submission;
import com.examgrader.utils.ExamKeys;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the stores from a JSON file of the form {@code {"exams": [...], "submissions": [...]}}.
 */
public class DataLoader {
    private static final Logger logger = LoggerFactory.getLogger(DataLoader.class);

    private final ObjectMapper objectMapper;

    public DataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the seed file into the stores. A missing file is not an error; malformed content is.
     *
     * @return number of records loaded
     */
    public int load(Path seedFile, ExamStore examStore, SubmissionStore submissionStore) throws IOException {
        if (!Files.exists(seedFile)) {
            logger.warn("Seed file {} not found; starting with empty stores", seedFile);
            return 0;
        }

        SeedData data = objectMapper.readValue(seedFile.toFile(), SeedData.class);
        int loaded = 0;
        for (Exam exam : data.exams) {
            if (exam == null) {
                continue;
            }
            if (!ExamKeys.isWellFormed(exam.getId())) {
                logger.warn("Skipping exam with malformed id '{}'", exam.getId());
                continue;
            }
            if (exam.getQuestions().contains(null)) {
                logger.warn("Skipping exam {} with null questions", exam.getId());
                continue;
            }
            examStore.save(exam);
            loaded++;
        }
        for (Submission submission : data.submissions) {
            if (submission == null) {
                continue;
            }
            if (submission.getRollNumber() == null || submission.getRollNumber().isBlank()) {
                logger.warn("Skipping submission without roll number");
                continue;
            }
            if (submission.getAnswers().contains(null)) {
                logger.warn("Skipping submission {} with null answers", submission.getRollNumber());
                continue;
            }
            submissionStore.save(submission);
            loaded++;
        }
        logger.info("Loaded {} exams and submissions from {}", loaded, seedFile);
        return loaded;
    }

    public static class SeedData {
        public List<Exam> exams = new ArrayList<>();
        public List<Submission> submissions = new ArrayList<>();

        public SeedData() {}
    }
}
