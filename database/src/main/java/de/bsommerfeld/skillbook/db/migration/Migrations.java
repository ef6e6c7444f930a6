package de.bsommerfeld.skillbook.db.migration;

import java.util.List;

/** The schema history of the skillbook database, oldest first. */
public final class Migrations {

    private Migrations() {
    }

    public static List<Migration> defaults() {
        return List.of(
                Migration.fromResources(1, "initial_schema"),
                Migration.fromResources(2, "implementation_plans"),
                Migration.fromResources(3, "prompt_fragments"),
                Migration.fromResources(4, "plan_skills"));
    }
}
