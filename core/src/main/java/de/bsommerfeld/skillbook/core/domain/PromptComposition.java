package de.bsommerfeld.skillbook.core.domain;

import java.util.List;

/** A prompt together with its fragment references in position order. */
public record PromptComposition(Prompt prompt, List<FragmentReference> fragmentReferences) {

    public PromptComposition {
        fragmentReferences = List.copyOf(fragmentReferences);
    }
}
