package de.bsommerfeld.skillbook.core.change;

import de.bsommerfeld.skillbook.core.domain.ReferenceType;

/**
 * Input for adding a prompt reference. Exactly one of
 * {@code targetPromptId}/{@code targetFragmentId} must be set, and it must
 * match {@code referenceType}. The factories build well-formed drafts; the
 * canonical constructor is kept open so malformed combinations can still be
 * expressed and rejected by the store.
 *
 * @param position {@code null} appends after the prompt's existing references
 */
public record ReferenceDraft(
        long sourcePromptId,
        ReferenceType referenceType,
        Long targetPromptId,
        Long targetFragmentId,
        Integer position) {

    public static ReferenceDraft toPrompt(long sourcePromptId, long targetPromptId) {
        return new ReferenceDraft(sourcePromptId, ReferenceType.PROMPT, targetPromptId, null, null);
    }

    public static ReferenceDraft toFragment(long sourcePromptId, long targetFragmentId) {
        return new ReferenceDraft(sourcePromptId, ReferenceType.FRAGMENT, null, targetFragmentId, null);
    }

    public ReferenceDraft atPosition(int position) {
        return new ReferenceDraft(sourcePromptId, referenceType, targetPromptId, targetFragmentId, position);
    }
}
