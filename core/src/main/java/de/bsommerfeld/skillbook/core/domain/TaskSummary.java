package de.bsommerfeld.skillbook.core.domain;

/** Completion counts over every task of one plan. */
public record TaskSummary(int total, int completed, int pending) {

    public static TaskSummary empty() {
        return new TaskSummary(0, 0, 0);
    }
}
