package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Ordered pointer from a prompt to another prompt or to a fragment.
 * {@code targetPromptId} is set for {@link ReferenceType#PROMPT},
 * {@code targetFragmentId} for {@link ReferenceType#FRAGMENT}; the other is
 * always {@code null}.
 */
public record PromptReference(
        long id,
        long sourcePromptId,
        Long targetPromptId,
        Long targetFragmentId,
        ReferenceType referenceType,
        int position,
        Instant createdAt) {

    /** Id of whichever target this reference points at. */
    public long targetId() {
        return referenceType == ReferenceType.PROMPT ? targetPromptId : targetFragmentId;
    }
}
