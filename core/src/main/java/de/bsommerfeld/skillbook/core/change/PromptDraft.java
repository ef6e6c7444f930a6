package de.bsommerfeld.skillbook.core.change;

/**
 * Input for creating or syncing a prompt. {@code path}, {@code name},
 * {@code content} and {@code fileHash} are required.
 */
public record PromptDraft(
        String path,
        String name,
        String title,
        String author,
        String description,
        String content,
        String fileHash,
        long sizeBytes,
        Integer tokenCount) {

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private String path;
        private String title;
        private String author;
        private String description;
        private String content;
        private String fileHash;
        private long sizeBytes;
        private Integer tokenCount;

        private Builder(String name) {
            this.name = name;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
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

        public PromptDraft build() {
            return new PromptDraft(path, name, title, author, description, content,
                    fileHash, sizeBytes, tokenCount);
        }
    }
}
