package de.bsommerfeld.skillbook.core.change;

public final class FragmentUpdate extends ColumnChanges {

    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";

    private FragmentUpdate(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends ColumnChanges.Builder<Builder> {

        private Builder() {
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

        public FragmentUpdate build() {
            return new FragmentUpdate(this);
        }
    }
}
