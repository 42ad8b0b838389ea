package com.examgrader.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Exam definition: the answer key's questions and the passing threshold
 */
public class Exam {
    private String id;
    private List<Question> questions = new ArrayList<>();
    private double passMarks;

    public Exam() {}

    public Exam(String id, List<Question> questions, double passMarks) {
        this.id = id;
        this.questions = new ArrayList<>(questions);
        this.passMarks = passMarks;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<Question> getQuestions() {
        return questions;
    }

    public void setQuestions(List<Question> questions) {
        this.questions = questions != null ? new ArrayList<>(questions) : new ArrayList<>();
    }

    public double getPassMarks() {
        return passMarks;
    }

    public void setPassMarks(double passMarks) {
        this.passMarks = passMarks;
    }

    public Exam copy() {
        Exam copy = new Exam();
        copy.id = id;
        for (Question q : questions) {
            copy.questions.add(new Question(q.getQuestionNumber(), q.getQuestionText(), q.getMaxMarks()));
        }
        copy.passMarks = passMarks;
        return copy;
    }

    @Override
    public String toString() {
        return "Exam{" +
                "id='" + id + '\'' +
                ", questions=" + questions.size() +
                ", passMarks=" + passMarks +
                '}';
    }
}
