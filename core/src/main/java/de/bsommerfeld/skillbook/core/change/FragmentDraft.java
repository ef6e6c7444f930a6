package de.bsommerfeld.skillbook.core.change;

/** Input for creating a prompt fragment; {@code name} and {@code title} are required. */
public record FragmentDraft(String name, String title, String description) {

    public static FragmentDraft of(String name, String title) {
        return new FragmentDraft(name, title, null);
    }
}
