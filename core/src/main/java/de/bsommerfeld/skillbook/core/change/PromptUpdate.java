package de.bsommerfeld.skillbook.core.change;

public final class PromptUpdate extends ColumnChanges {

    public static final String PATH = "path";
    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String DESCRIPTION = "description";
    public static final String CONTENT = "content";
    public static final String FILE_HASH = "file_hash";
    public static final String SIZE_BYTES = "size_bytes";
    public static final String TOKEN_COUNT = "token_count";

    private PromptUpdate(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Update that rewrites every column except the name from {@code draft}. */
    public static PromptUpdate replacing(PromptDraft draft) {
        return builder()
                .path(draft.path())
                .title(draft.title())
                .author(draft.author())
                .description(draft.description())
                .content(draft.content())
                .fileHash(draft.fileHash())
                .sizeBytes(draft.sizeBytes())
                .tokenCount(draft.tokenCount())
                .build();
    }

    public static final class Builder extends ColumnChanges.Builder<Builder> {

        private Builder() {
        }

        public Builder path(String path) {
            return set(PATH, path);
        }

        public Builder name(String name) {
            return set(NAME, name);
        }

        public Builder title(String title) {
            return set(TITLE, title);
        }

        public Builder author(String author) {
            return set(AUTHOR, author);
        }

        public Builder description(String description) {
            return set(DESCRIPTION, description);
        }

        public Builder content(String content) {
            return set(CONTENT, content);
        }

        public Builder fileHash(String fileHash) {
            return set(FILE_HASH, fileHash);
        }

        public Builder sizeBytes(long sizeBytes) {
            return set(SIZE_BYTES, sizeBytes);
        }

        public Builder tokenCount(Integer tokenCount) {
            return set(TOKEN_COUNT, tokenCount);
        }

        public PromptUpdate build() {
            return new PromptUpdate(this);
        }
    }
}
