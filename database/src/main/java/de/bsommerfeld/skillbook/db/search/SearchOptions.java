package de.bsommerfeld.skillbook.db.search;

/**
 * Per-query limits and presentation.
 *
 * @param category restricts skill searches to one category; ignored for
 *                 prompts and plans
 */
public record SearchOptions(int maxResults, String category, SnippetStyle snippet) {

    public static final int DEFAULT_MAX_RESULTS = 50;
    public static final int MAX_RESULTS_LIMIT = 1000;

    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_MAX_RESULTS, null, SnippetStyle.defaults());
    }

    public static SearchOptions limit(int maxResults) {
        return new SearchOptions(maxResults, null, SnippetStyle.defaults());
    }

    public SearchOptions withCategory(String category) {
        return new SearchOptions(maxResults, category, snippet);
    }

    public SearchOptions withSnippet(SnippetStyle snippet) {
        return new SearchOptions(maxResults, category, snippet);
    }
}
