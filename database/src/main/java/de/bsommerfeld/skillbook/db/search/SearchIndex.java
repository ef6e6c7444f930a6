package de.bsommerfeld.skillbook.db.search;

/**
 * The FTS5 tables kept in sync with their source tables by triggers.
 */
public enum SearchIndex {
    SKILLS("skills_fts", "skills"),
    PROMPTS("prompts_fts", "prompts"),
    PLANS("implementation_plans_fts", "implementation_plans");

    private final String table;
    private final String sourceTable;

    SearchIndex(String table, String sourceTable) {
        this.table = table;
        this.sourceTable = sourceTable;
    }

    public String table() {
        return table;
    }

    public String sourceTable() {
        return sourceTable;
    }
}
