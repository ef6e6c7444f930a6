package de.bsommerfeld.skillbook.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Query statements live one per file under {@code sql/}, named
 * {@code <operation>-<entity>.sql}, e.g. {@code insert-plan.sql},
 * {@code select-tasks-for-list.sql}. Migration scripts hold several
 * statements separated by a line containing only {@code --;;}; a plain
 * semicolon split would cut trigger bodies apart.
 *
 * <p>
 * Each resource is read exactly once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    /** Line that separates statements inside a multi-statement script. */
    public static final String STATEMENT_SEPARATOR = "--;;";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return resource("sql/" + name + ".sql");
    }

    /**
     * Reads a multi-statement script and splits it on
     * {@link #STATEMENT_SEPARATOR} lines. Chunks that contain nothing but
     * whitespace and {@code --} comments are dropped, and comment lines leading
     * a statement are stripped from it.
     *
     * @param path full classpath location, e.g.
     *             {@code db/migration/V1__initial_schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> statements(String path) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : resource(path).split("\\r?\\n")) {
            if (line.trim().equals(STATEMENT_SEPARATOR)) {
                addIfExecutable(statements, current);
                current.setLength(0);
            } else {
                current.append(line).append('\n');
            }
        }
        addIfExecutable(statements, current);
        return List.copyOf(statements);
    }

    /** Whether a resource exists at the given classpath location. */
    public static boolean exists(String path) {
        return SqlLoader.class.getClassLoader().getResource(path) != null;
    }

    /** Adds the chunk without its leading comment lines, unless nothing else is left. */
    private static void addIfExecutable(List<String> statements, StringBuilder chunk) {
        String[] lines = chunk.toString().split("\\n");
        int first = 0;
        while (first < lines.length && (lines[first].isBlank() || lines[first].trim().startsWith("--"))) {
            first++;
        }
        if (first == lines.length) {
            return;
        }
        StringBuilder sql = new StringBuilder();
        for (int i = first; i < lines.length; i++) {
            sql.append(lines[i]).append('\n');
        }
        statements.add(sql.toString().trim());
    }

    private static String resource(String path) {
        return CACHE.computeIfAbsent(path, SqlLoader::readResource);
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
