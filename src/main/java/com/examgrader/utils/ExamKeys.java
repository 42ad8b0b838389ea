package com.examgrader.utils;

import java.util.regex.Pattern;

/**
 * Exam identifiers are 24-digit hexadecimal references (the document-id format exams are stored under).
 */
public final class ExamKeys {

    private static final Pattern REFERENCE = Pattern.compile("^[0-9a-fA-F]{24}$");

    private ExamKeys() {}

    public static boolean isWellFormed(String examId) {
        return examId != null && REFERENCE.matcher(examId).matches();
    }
}
