package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.change.FragmentDraft;
import de.bsommerfeld.skillbook.core.change.ReferenceDraft;
import de.bsommerfeld.skillbook.core.domain.FragmentReference;
import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.PromptComposition;
import de.bsommerfeld.skillbook.core.domain.PromptFragment;
import de.bsommerfeld.skillbook.core.domain.PromptReference;
import de.bsommerfeld.skillbook.core.domain.ReferenceType;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptReferenceStoreTest {

    @TempDir
    Path tempDir;

    private PromptStore prompts;
    private FragmentStore fragments;
    private PromptReferenceStore references;

    private Prompt source;
    private Prompt other;
    private PromptFragment fragment;

    @BeforeEach
    void setUp() {
        Database db = TestDatabases.migrated(tempDir);
        PositionManager positions = new PositionManager(db);
        prompts = new PromptStore(db, positions);
        fragments = new FragmentStore(db, positions);
        references = new PromptReferenceStore(db, positions);

        source = prompts.create(Fixtures.prompt("source", "body"));
        other = prompts.create(Fixtures.prompt("other", "other body"));
        fragment = fragments.create(FragmentDraft.of("testing", "Testing basics"));
    }

    // -- Add --

    @Test
    void add_shouldAppendReferencesInOrder() {
        PromptReference first = references.add(ReferenceDraft.toFragment(source.id(), fragment.id()));
        PromptReference second = references.add(ReferenceDraft.toPrompt(source.id(), other.id()));

        assertEquals(0, first.position());
        assertEquals(1, second.position());
        assertEquals(ReferenceType.FRAGMENT, first.referenceType());
        assertEquals(fragment.id(), first.targetId());
        assertNull(first.targetPromptId());
        assertEquals(other.id(), second.targetPromptId());
        assertNull(second.targetFragmentId());
        assertEquals(List.of(first, second), references.listForPrompt(source.id()));
    }

    @Test
    void add_shouldHonorExplicitPosition() {
        PromptReference ref = references.add(ReferenceDraft.toPrompt(source.id(), other.id()).atPosition(7));

        assertEquals(7, ref.position());
    }

    @Test
    void add_shouldRejectBothTargets() {
        ReferenceDraft draft = new ReferenceDraft(source.id(), ReferenceType.PROMPT, other.id(), fragment.id(), null);

        ValidationException e = assertThrows(ValidationException.class, () -> references.add(draft));
        assertTrue(e.hasErrorFor("targetFragmentId"));
    }

    @Test
    void add_shouldRejectTargetNotMatchingType() {
        ReferenceDraft draft = new ReferenceDraft(source.id(), ReferenceType.FRAGMENT, other.id(), null, null);

        ValidationException e = assertThrows(ValidationException.class, () -> references.add(draft));
        assertTrue(e.hasErrorFor("targetFragmentId"));
        assertTrue(e.hasErrorFor("targetPromptId"));
        assertTrue(references.listForPrompt(source.id()).isEmpty());
    }

    @Test
    void add_shouldRejectMissingType() {
        ReferenceDraft draft = new ReferenceDraft(source.id(), null, other.id(), null, null);

        ValidationException e = assertThrows(ValidationException.class, () -> references.add(draft));
        assertTrue(e.hasErrorFor("referenceType"));
    }

    @Test
    void add_shouldThrowNotFoundForUnknownTarget() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> references.add(ReferenceDraft.toFragment(source.id(), 999)));
        assertEquals("fragment", e.getEntity());
    }

    // -- Remove / Reorder --

    @Test
    void remove_shouldReturnDeletedReference() {
        PromptReference ref = references.add(ReferenceDraft.toPrompt(source.id(), other.id()));

        assertEquals(ref, references.remove(ref.id()));
        assertTrue(references.listForPrompt(source.id()).isEmpty());
        assertThrows(NotFoundException.class, () -> references.remove(ref.id()));
    }

    @Test
    void reorder_shouldSwapPositions() {
        PromptReference a = references.add(ReferenceDraft.toFragment(source.id(), fragment.id()));
        PromptReference b = references.add(ReferenceDraft.toPrompt(source.id(), other.id()));

        references.reorder(source.id(), Map.of(a.id(), 1, b.id(), 0));

        assertEquals(List.of(b.id(), a.id()), references.listForPrompt(source.id()).stream()
                .map(PromptReference::id).toList());
    }

    @Test
    void deletingTargetPrompt_shouldDropReference() {
        references.add(ReferenceDraft.toPrompt(source.id(), other.id()));

        prompts.delete(other.id());

        assertTrue(references.listForPrompt(source.id()).isEmpty());
    }

    // -- Composition --

    @Test
    void composition_shouldResolveFragmentReferencesOnly() {
        PromptFragment second = fragments.create(FragmentDraft.of("logging", "Logging setup"));
        references.add(ReferenceDraft.toFragment(source.id(), second.id()).atPosition(2));
        references.add(ReferenceDraft.toPrompt(source.id(), other.id()).atPosition(0));
        references.add(ReferenceDraft.toFragment(source.id(), fragment.id()).atPosition(1));

        PromptComposition composition = references.composition(source.id());

        assertEquals(source, composition.prompt());
        List<FragmentReference> resolved = composition.fragmentReferences();
        assertEquals(List.of("testing", "logging"), resolved.stream().map(FragmentReference::name).toList());
        assertEquals("Testing basics", resolved.get(0).title());
        assertEquals(fragment.id(), resolved.get(0).reference().targetFragmentId());
    }

    @Test
    void composition_shouldThrowNotFoundForUnknownPrompt() {
        assertThrows(NotFoundException.class, () -> references.composition(12345));
    }
}
