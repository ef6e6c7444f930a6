package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.ReferenceDraft;
import de.bsommerfeld.skillbook.core.domain.FragmentReference;
import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.PromptComposition;
import de.bsommerfeld.skillbook.core.domain.PromptReference;
import de.bsommerfeld.skillbook.core.domain.ReferenceType;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Ordered references from a prompt to other prompts or to fragments.
 *
 * <p>
 * A reference has exactly one target, and the populated target column must
 * match its {@link ReferenceType}. Drafts that break this are rejected
 * before the database is touched; the table's CHECK constraint enforces the
 * same rule for raw SQL.
 */
@Singleton
public class PromptReferenceStore {

    private static final Logger LOG = LoggerFactory.getLogger(PromptReferenceStore.class);

    private final Database database;
    private final PositionManager positions;

    @Inject
    public PromptReferenceStore(Database database, PositionManager positions) {
        this.database = database;
        this.positions = positions;
    }

    /**
     * @throws NotFoundException if the source prompt or the target does not
     *                           exist
     */
    public PromptReference add(ReferenceDraft draft) {
        Validator validator = Validator.of("prompt reference")
                .id("sourcePromptId", draft.sourcePromptId())
                .required("referenceType", draft.referenceType())
                .min("position", draft.position(), 0);
        if (draft.referenceType() == ReferenceType.PROMPT) {
            validator.id("targetPromptId", draft.targetPromptId())
                    .check(draft.targetFragmentId() == null, "targetFragmentId",
                            "must be empty for a prompt reference");
        } else if (draft.referenceType() == ReferenceType.FRAGMENT) {
            validator.id("targetFragmentId", draft.targetFragmentId())
                    .check(draft.targetPromptId() == null, "targetPromptId",
                            "must be empty for a fragment reference");
        }
        validator.validate();

        PromptReference reference = database.write("add prompt reference",
                Jdbc.context("sourcePromptId", draft.sourcePromptId(), "referenceType", draft.referenceType(),
                        "targetPromptId", draft.targetPromptId(), "targetFragmentId", draft.targetFragmentId(),
                        "position", draft.position()),
                conn -> {
                    Jdbc.requireRow(conn, "prompts", "prompt", draft.sourcePromptId());
                    if (draft.referenceType() == ReferenceType.PROMPT) {
                        Jdbc.requireRow(conn, "prompts", "prompt", draft.targetPromptId());
                    } else {
                        Jdbc.requireRow(conn, "prompt_fragments", "fragment", draft.targetFragmentId());
                    }
                    int position = positions.positionOrNext(conn, PositionManager.Scope.PROMPT_REFERENCES,
                            draft.sourcePromptId(), draft.position());
                    long id = Jdbc.insert(conn, SqlLoader.load("insert-prompt-reference"),
                            draft.sourcePromptId(), draft.targetPromptId(), draft.targetFragmentId(),
                            draft.referenceType(), position);
                    return fetch(conn, id);
                });
        LOG.debug("[DB] Prompt {} references {} {} at position {}", reference.sourcePromptId(),
                reference.referenceType(), reference.targetId(), reference.position());
        return reference;
    }

    /** References of a prompt in position order. */
    public List<PromptReference> listForPrompt(long promptId) {
        Validator.of("prompt reference").id("promptId", promptId).validate();
        return database.read("list prompt references", Jdbc.context("promptId", promptId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-prompt-references"), Rows::reference, promptId));
    }

    public PromptReference remove(long id) {
        Validator.of("prompt reference").id("id", id).validate();
        return database.write("remove prompt reference", Jdbc.context("id", id), conn -> {
            PromptReference existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-prompt-reference"), id);
            return existing;
        });
    }

    public void reorder(long promptId, Map<Long, Integer> referencePositions) {
        positions.reorder(PositionManager.Scope.PROMPT_REFERENCES, promptId, referencePositions);
    }

    /**
     * The prompt together with its fragment references, each resolved to the
     * fragment's name and title. Both reads share one transaction.
     *
     * @throws NotFoundException if the prompt does not exist
     */
    public PromptComposition composition(long promptId) {
        Validator.of("prompt reference").id("promptId", promptId).validate();
        return database.snapshot("compose prompt", Jdbc.context("promptId", promptId), conn -> {
            Prompt prompt = Jdbc.queryOne(conn, SqlLoader.load("select-prompt-by-id"), Rows::prompt, promptId)
                    .orElseThrow(() -> new NotFoundException("prompt", promptId));
            List<FragmentReference> fragments = Jdbc.queryList(conn,
                    SqlLoader.load("select-fragment-references-for-prompt"), Rows::fragmentReference, promptId);
            return new PromptComposition(prompt, fragments);
        });
    }

    private static PromptReference fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-prompt-reference-by-id"), Rows::reference, id)
                .orElseThrow(() -> new NotFoundException("prompt reference", id));
    }
}
