/**
 * SQLite persistence for implementation plans and the skill/prompt catalog.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [caller]
 *        │
 *        ▼
 *   PlanStore, TaskListStore, TaskStore,      ← validated CRUD, one entry
 *   SkillStore, PromptStore, FragmentStore,     point per record kind
 *   PromptReferenceStore, PlanSkillStore
 *        │             │
 *        │             ▼
 *        │        PositionManager  ← max+1 append, batch reorder
 *        ▼
 *   Database  ← connection per call, transaction boundary, error wrapping
 *        │
 *        ▼
 *   SQLite file  ← FK cascades, CHECKs, FTS5 sync triggers
 * </pre>
 *
 * {@link de.bsommerfeld.skillbook.db.migration.SchemaMigrator} runs once at
 * startup through {@link SchemaInitializer};
 * {@link de.bsommerfeld.skillbook.db.search.FullTextSearch} reads the FTS5
 * tables the triggers maintain.
 *
 * <h2>Ownership</h2>
 *
 * <pre>
 * implementation_plans 1──N task_lists 1──N tasks        (ON DELETE CASCADE)
 * implementation_plans N──M skills      via plan_skills
 * prompts              N──M skills      via prompt_skills
 * prompt_fragments     N──M skills      via prompt_fragment_skills
 * prompts              1──N prompt_references ──▶ prompts | prompt_fragments
 * </pre>
 *
 * Every junction and reference row carries a {@code position}. Positions are
 * not unique; siblings are read back in position order with ties broken by
 * name or id.
 *
 * <h2>Search index sync</h2>
 * {@code skills_fts}, {@code prompts_fts} and {@code implementation_plans_fts}
 * are external-content FTS5 tables keyed by the source row id. Each source
 * table has three triggers:
 * <ul>
 * <li>{@code *_ai} inserts the new row's projection</li>
 * <li>{@code *_ad} issues the FTS5 {@code 'delete'} command with the old
 * values</li>
 * <li>{@code *_au} does both, delete then insert</li>
 * </ul>
 * They fire inside the writing statement's transaction, so raw SQL that
 * bypasses the stores keeps the index consistent too.
 *
 * <h2>SQL File Inventory</h2>
 * Fixed statements live in {@code sql/*.sql} and are loaded via
 * {@link SqlLoader}, named {@code <verb>-<entity>[-qualifier]}:
 * {@code insert-plan}, {@code select-tasks-for-plan},
 * {@code select-prompt-skills}, {@code search-skills} and so on. Partial
 * updates are the only generated SQL; their column names come from the
 * constants of the {@code *Update} classes.
 */
package de.bsommerfeld.skillbook.db;
