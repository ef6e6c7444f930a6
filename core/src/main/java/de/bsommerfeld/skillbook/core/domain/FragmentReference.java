package de.bsommerfeld.skillbook.core.domain;

/** A fragment reference of a prompt, resolved against the fragment it targets. */
public record FragmentReference(PromptReference reference, String name, String title) {
}
