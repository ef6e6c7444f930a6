package de.bsommerfeld.skillbook.core.domain;

/**
 * A task listed across a whole plan, tagged with the list it belongs to so
 * callers can group without a second query.
 */
public record PlanTask(Task task, String listName, int listPosition) {
}
