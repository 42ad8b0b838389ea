package com.examgrader.utils;

import com.examgrader.models.Evaluation;
import com.examgrader.models.Submission;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for the evaluation results report
 */
public class CsvUtils {
    private static final Logger logger = LoggerFactory.getLogger(CsvUtils.class);

    static final String[] RESULT_HEADERS = {
        "RollNumber", "ExamId", "QuestionNumber", "Marks", "UsedFallback", "Feedback",
        "TotalMarks", "Result", "EvaluatedAt"
    };

    private CsvUtils() {}

    /**
     * Append one row per evaluation of the submission; the header is written when the file is new.
     */
    public static void appendEvaluationsToCsv(String filePath, Submission submission) throws IOException {
        File file = new File(filePath);
        boolean writeHeader = !file.exists() || file.length() == 0;
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create directory " + parent);
        }

        CSVFormat format = writeHeader
                ? CSVFormat.DEFAULT.withHeader(RESULT_HEADERS)
                : CSVFormat.DEFAULT;

        try (Writer writer = new FileWriter(file, StandardCharsets.UTF_8, true);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Evaluation evaluation : submission.getEvaluated()) {
                printer.printRecord(
                    submission.getRollNumber(),
                    submission.getExamId(),
                    evaluation.getQuestionNumber(),
                    evaluation.getMarks(),
                    evaluation.isUsedFallback(),
                    evaluation.getFeedback(),
                    submission.getTotalMarks(),
                    submission.getResult() != null ? submission.getResult().getLabel() : "",
                    submission.getEvaluatedAt()
                );
            }
        }
        logger.debug("Appended {} evaluation rows for {} to {}",
            submission.getEvaluated().size(), submission.getRollNumber(), filePath);
    }
}
