package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.change.PromptDraft;
import de.bsommerfeld.skillbook.core.change.SkillDraft;

/** Catalog drafts with plausible defaults for tests. */
public final class Fixtures {

    private Fixtures() {
    }

    public static SkillDraft skill(String category, String name, String content) {
        return SkillDraft.builder("skills/" + category + "/" + name + ".md")
                .category(category)
                .name(name)
                .title(name + " guide")
                .description("About " + name)
                .content(content)
                .fileHash("hash-" + content.hashCode())
                .sizeBytes(content.length())
                .tokenCount(content.length() / 4)
                .build();
    }

    public static PromptDraft prompt(String name, String content) {
        return PromptDraft.builder(name)
                .path("prompts/" + name + ".md")
                .title(name + " prompt")
                .author("tester")
                .content(content)
                .fileHash("hash-" + content.hashCode())
                .sizeBytes(content.length())
                .tokenCount(content.length() / 4)
                .build();
    }
}
