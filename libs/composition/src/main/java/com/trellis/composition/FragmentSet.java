package com.trellis.composition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What one fragment response is made of: an optional primary block, explicit secondary blocks in
 * declaration order, and the switches for the blocks the composer adds on its own.
 *
 * <p>Without a primary block the response body starts directly with the out-of-band blocks; that
 * is how an action that only raises a toast or moves the navigation marker answers.
 */
public final class FragmentSet {

    private final FragmentDescriptor primary;
    private final List<FragmentDescriptor> secondaries;
    private final String pushUrl;
    private final String activeSection;
    private final boolean foldNotifications;
    private final boolean includeModals;

    private FragmentSet(Builder builder) {
        this.primary = builder.primary;
        this.secondaries = List.copyOf(builder.secondaries);
        this.pushUrl = builder.pushUrl;
        this.activeSection = builder.activeSection;
        this.foldNotifications = builder.foldNotifications;
        this.includeModals = builder.includeModals;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a response consisting of one primary block. */
    public static FragmentSet of(TemplateRef primary) {
        return builder().primary(primary).build();
    }

    public Optional<FragmentDescriptor> primary() {
        return Optional.ofNullable(primary);
    }

    public List<FragmentDescriptor> secondaries() {
        return secondaries;
    }

    public Optional<String> pushUrl() {
        return Optional.ofNullable(pushUrl).filter(value -> !value.isBlank());
    }

    public Optional<String> activeSection() {
        return Optional.ofNullable(activeSection).filter(value -> !value.isBlank());
    }

    public boolean foldNotifications() {
        return foldNotifications;
    }

    public boolean includeModals() {
        return includeModals;
    }

    public static final class Builder {

        private FragmentDescriptor primary;
        private final List<FragmentDescriptor> secondaries = new ArrayList<>();
        private String pushUrl;
        private String activeSection;
        private boolean foldNotifications = true;
        private boolean includeModals;

        private Builder() {
        }

        public Builder primary(TemplateRef templateRef) {
            return primary(FragmentDescriptor.primary(templateRef));
        }

        public Builder primary(FragmentDescriptor descriptor) {
            if (!descriptor.primary()) {
                throw new IllegalArgumentException("'%s' is not a primary fragment".formatted(descriptor.targetId()));
            }
            this.primary = descriptor;
            return this;
        }

        public Builder secondary(String targetId, TemplateRef templateRef) {
            secondaries.add(FragmentDescriptor.secondary(targetId, templateRef));
            return this;
        }

        public Builder pushUrl(String pushUrl) {
            this.pushUrl = pushUrl;
            return this;
        }

        /** Highlights this navigation section through the {@code nav-active-marker} block. */
        public Builder activeSection(String activeSection) {
            this.activeSection = activeSection;
            return this;
        }

        /** Turns off the automatic toast block for this response. */
        public Builder withoutNotifications() {
            this.foldNotifications = false;
            return this;
        }

        /** Adds the {@code modal-container} block. */
        public Builder includeModals() {
            this.includeModals = true;
            return this;
        }

        public FragmentSet build() {
            return new FragmentSet(this);
        }
    }
}
