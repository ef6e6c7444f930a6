package de.bsommerfeld.skillbook.core.change;

/** Partial update of a skill. The path is its identity and cannot change. */
public final class SkillUpdate extends ColumnChanges {

    public static final String CATEGORY = "category";
    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String CONTENT = "content";
    public static final String FILE_HASH = "file_hash";
    public static final String SIZE_BYTES = "size_bytes";
    public static final String TOKEN_COUNT = "token_count";

    private SkillUpdate(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Update that rewrites every mutable column from {@code draft}. */
    public static SkillUpdate replacing(SkillDraft draft) {
        return builder()
                .category(draft.category())
                .name(draft.name())
                .title(draft.title())
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

        public Builder category(String category) {
            return set(CATEGORY, category);
        }

        public Builder name(String name) {
            return set(NAME, name);
        }

        public Builder title(String title) {
            return set(TITLE, title);
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

        public SkillUpdate build() {
            return new SkillUpdate(this);
        }
    }
}
