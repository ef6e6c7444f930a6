package de.bsommerfeld.skillbook.core.domain;

/**
 * One full-text match.
 *
 * @param record  the matched source row
 * @param snippet excerpt with matched terms wrapped in the requested markers
 * @param rank    FTS5 relevance; lower is more relevant
 */
public record SearchHit<T>(T record, String snippet, double rank) {
}
