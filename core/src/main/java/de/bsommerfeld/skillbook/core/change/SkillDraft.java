package de.bsommerfeld.skillbook.core.change;

/**
 * Input for creating or syncing a skill. {@code path}, {@code category},
 * {@code name}, {@code content} and {@code fileHash} are required.
 */
public record SkillDraft(
        String path,
        String category,
        String name,
        String title,
        String description,
        String content,
        String fileHash,
        long sizeBytes,
        Integer tokenCount) {

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public static final class Builder {

        private final String path;
        private String category;
        private String name;
        private String title;
        private String description;
        private String content;
        private String fileHash;
        private long sizeBytes;
        private Integer tokenCount;

        private Builder(String path) {
            this.path = path;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder fileHash(String fileHash) {
            this.fileHash = fileHash;
            return this;
        }

        public Builder sizeBytes(long sizeBytes) {
            this.sizeBytes = sizeBytes;
            return this;
        }

        public Builder tokenCount(Integer tokenCount) {
            this.tokenCount = tokenCount;
            return this;
        }

        public SkillDraft build() {
            return new SkillDraft(path, category, name, title, description, content,
                    fileHash, sizeBytes, tokenCount);
        }
    }
}
