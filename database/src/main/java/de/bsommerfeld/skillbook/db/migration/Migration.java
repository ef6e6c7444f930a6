package de.bsommerfeld.skillbook.db.migration;

import de.bsommerfeld.skillbook.db.SqlLoader;

import java.util.List;

/**
 * One versioned schema change: the statements that apply it and the
 * statements that undo it, each executed in order.
 */
public record Migration(int version, String description, List<String> up, List<String> down) {

    public Migration {
        up = List.copyOf(up);
        down = List.copyOf(down);
    }

    /**
     * Loads a unit from {@code db/migration/V<version>__<name>.sql} and its
     * counterpart under {@code db/rollback/}. A missing rollback script yields
     * an empty down list.
     */
    public static Migration fromResources(int version, String name) {
        String file = "V" + version + "__" + name + ".sql";
        String rollback = "db/rollback/" + file;
        List<String> down = SqlLoader.exists(rollback) ? SqlLoader.statements(rollback) : List.of();
        return new Migration(version, name.replace('_', ' '), SqlLoader.statements("db/migration/" + file), down);
    }
}
