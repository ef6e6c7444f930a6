package de.bsommerfeld.skillbook.db.search;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.config.StoreConfig;
import de.bsommerfeld.skillbook.core.domain.Plan;
import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.SearchHit;
import de.bsommerfeld.skillbook.core.domain.Skill;
import de.bsommerfeld.skillbook.core.validation.Validator;
import de.bsommerfeld.skillbook.db.Database;
import de.bsommerfeld.skillbook.db.Jdbc;
import de.bsommerfeld.skillbook.db.Rows;
import de.bsommerfeld.skillbook.db.SqlLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Ranked full-text queries against the FTS5 indexes.
 *
 * <p>
 * A {@code null}, empty or whitespace-only query, or one longer than 1000
 * characters, is rejected with a
 * {@link de.bsommerfeld.skillbook.core.error.ValidationException} on the
 * {@code query} field before anything runs. Any other query string goes to
 * {@code MATCH} unchanged, so FTS5 syntax works as is: implicit AND,
 * {@code OR}, {@code "quoted phrases"}, {@code prefix*} and column filters
 * such as {@code title:setup}. A malformed query fails
 * with the engine's parse error wrapped in a
 * {@link de.bsommerfeld.skillbook.core.error.DatabaseException}. Results are
 * ordered by FTS5 rank, most relevant first. Searching never writes.
 */
@Singleton
public class FullTextSearch {

    private static final Logger LOG = LoggerFactory.getLogger(FullTextSearch.class);

    static final int MAX_QUERY = 1000;

    private final Database database;
    private final int defaultMaxResults;

    @Inject
    public FullTextSearch(Database database, StoreConfig config) {
        this.database = database;
        this.defaultMaxResults = config.getSearchMaxResults();
    }

    /** Options with the configured result limit and default snippet markers. */
    public SearchOptions defaultOptions() {
        return SearchOptions.limit(defaultMaxResults);
    }

    public List<SearchHit<Skill>> searchSkills(String query) {
        return searchSkills(query, defaultOptions());
    }

    public List<SearchHit<Skill>> searchSkills(String query, SearchOptions options) {
        validate(query, options);
        return database.read("search skills", input(query, options), conn -> skills(conn, query, options));
    }

    public List<SearchHit<Prompt>> searchPrompts(String query) {
        return searchPrompts(query, defaultOptions());
    }

    public List<SearchHit<Prompt>> searchPrompts(String query, SearchOptions options) {
        validate(query, options);
        return database.read("search prompts", input(query, options), conn -> prompts(conn, query, options));
    }

    public List<SearchHit<Plan>> searchPlans(String query) {
        return searchPlans(query, defaultOptions());
    }

    /** Snippets for plans are taken from whichever column matched best. */
    public List<SearchHit<Plan>> searchPlans(String query, SearchOptions options) {
        validate(query, options);
        SnippetStyle s = options.snippet();
        return database.read("search plans", input(query, options),
                conn -> Jdbc.queryList(conn, SqlLoader.load("search-plans"),
                        rs -> new SearchHit<>(Rows.plan(rs), rs.getString("snippet"), rs.getDouble("search_rank")),
                        s.open(), s.close(), s.ellipsis(), s.tokens(), query, options.maxResults()));
    }

    /**
     * Searches skills and prompts with the same query in one read
     * transaction. {@code maxResults} applies to each kind separately.
     */
    public CatalogSearchResult searchAll(String query, SearchOptions options) {
        validate(query, options);
        CatalogSearchResult result = database.snapshot("search catalog", input(query, options),
                conn -> new CatalogSearchResult(skills(conn, query, options), prompts(conn, query, options)));
        LOG.debug("[DB] Catalog search '{}' matched {} skill(s), {} prompt(s)", query,
                result.skills().size(), result.prompts().size());
        return result;
    }

    public CatalogSearchResult searchAll(String query) {
        return searchAll(query, defaultOptions());
    }

    private static List<SearchHit<Skill>> skills(Connection conn, String query, SearchOptions options)
            throws SQLException {
        SnippetStyle s = options.snippet();
        return Jdbc.queryList(conn, SqlLoader.load("search-skills"),
                rs -> new SearchHit<>(Rows.skill(rs), rs.getString("snippet"), rs.getDouble("search_rank")),
                s.open(), s.close(), s.ellipsis(), s.tokens(), query,
                options.category(), options.category(), options.maxResults());
    }

    private static List<SearchHit<Prompt>> prompts(Connection conn, String query, SearchOptions options)
            throws SQLException {
        SnippetStyle s = options.snippet();
        return Jdbc.queryList(conn, SqlLoader.load("search-prompts"),
                rs -> new SearchHit<>(Rows.prompt(rs), rs.getString("snippet"), rs.getDouble("search_rank")),
                s.open(), s.close(), s.ellipsis(), s.tokens(), query, options.maxResults());
    }

    private static void validate(String query, SearchOptions options) {
        Validator validator = Validator.of("search")
                .requiredText("query", query, MAX_QUERY)
                .required("options", options);
        if (options != null) {
            validator
                    .range("maxResults", options.maxResults(), 1, SearchOptions.MAX_RESULTS_LIMIT)
                    .optionalText("category", options.category(), 255)
                    .required("snippet", options.snippet());
            SnippetStyle s = options.snippet();
            if (s != null) {
                validator
                        .required("snippet.open", s.open())
                        .required("snippet.close", s.close())
                        .required("snippet.ellipsis", s.ellipsis())
                        .range("snippet.tokens", s.tokens(), 1, SnippetStyle.MAX_TOKENS);
            }
        }
        validator.validate();
    }

    private static Map<String, Object> input(String query, SearchOptions options) {
        return Jdbc.context("query", query, "maxResults", options.maxResults(), "category", options.category());
    }
}
