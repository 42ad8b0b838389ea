package com.examgrader.utils;

import com.examgrader.models.Question;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a submitted question identifier to the exam's question record.
 *
 * <p>Identifiers are compared by their normalized form: trimmed, uppercased, reduced to the
 * leading run of digits (an optional "Q" / "QUESTION" prefix is skipped first). So "1",
 * " 1 ", "1-A", "1(a)" and "Q1a" all address the same question. Identifiers without digits
 * are compared as trimmed uppercase text.
 */
public final class QuestionMatcher {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(?:Q(?:UESTION)?\\.?\\s*)?(\\d+)");

    private QuestionMatcher() {}

    /**
     * Trimmed, uppercased identifier as reported back in evaluations
     */
    public static String displayForm(String rawIdentifier) {
        return rawIdentifier == null ? "" : rawIdentifier.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalize(String rawIdentifier) {
        String display = displayForm(rawIdentifier);
        Matcher matcher = LEADING_NUMBER.matcher(display);
        return matcher.find() ? matcher.group(1) : display;
    }

    /**
     * First question, in exam order, whose normalized identifier equals the normalized input
     */
    public static Optional<Question> match(String rawIdentifier, List<Question> questions) {
        if (questions == null) {
            return Optional.empty();
        }
        String wanted = normalize(rawIdentifier);
        for (Question question : questions) {
            if (wanted.equals(normalize(question.getQuestionNumber()))) {
                return Optional.of(question);
            }
        }
        return Optional.empty();
    }
}
