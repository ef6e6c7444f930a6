package de.bsommerfeld.skillbook.core.domain;

/**
 * Result of a content-hash sync: whether the row was created, rewritten, or
 * left alone because its hash had not changed.
 */
public record SyncOutcome<T>(Action action, T record) {

    public enum Action {
        INSERTED,
        UPDATED,
        UNCHANGED
    }

    public boolean changed() {
        return action != Action.UNCHANGED;
    }
}
