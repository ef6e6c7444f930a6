package de.bsommerfeld.skillbook.db.search;

/**
 * How FTS5 marks up a result snippet.
 *
 * @param open     inserted before each matched term
 * @param close    inserted after each matched term
 * @param ellipsis marks text cut from either end
 * @param tokens   maximum snippet length in tokens, 1 to 64
 */
public record SnippetStyle(String open, String close, String ellipsis, int tokens) {

    public static final int MAX_TOKENS = 64;

    public static SnippetStyle defaults() {
        return new SnippetStyle("[", "]", "...", 30);
    }

    public static SnippetStyle markers(String open, String close) {
        return new SnippetStyle(open, close, "...", 30);
    }
}
