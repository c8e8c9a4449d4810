package com.architecture.memory.vuegraph.model;

/**
 * Kinds of {@code child} elements in a VUE map, as given by their {@code xsi:type} discriminator.
 */
public enum ElementKind {
    NODE("node"),
    LINK("link"),
    OTHER(null);

    private final String discriminator;

    ElementKind(String discriminator) {
        this.discriminator = discriminator;
    }

    public String getDiscriminator() {
        return discriminator;
    }

    /**
     * Map an {@code xsi:type} value to a kind. Anything other than "node" or "link"
     * (groups, text, images, a missing attribute) is {@link #OTHER}.
     */
    public static ElementKind fromDiscriminator(String value) {
        if (value == null) return OTHER;
        for (ElementKind kind : values()) {
            if (value.equals(kind.discriminator)) {
                return kind;
            }
        }
        return OTHER;
    }
}
