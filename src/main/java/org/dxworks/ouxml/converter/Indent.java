package org.dxworks.ouxml.converter;

import java.util.Objects;

/**
 * Leading whitespace for block-level output. Immutable; each nesting step derives a new value.
 */
public final class Indent {

    public static final Indent NONE = new Indent("");

    private static final String STEP = "    ";

    private final String prefix;

    private Indent(String prefix) {
        this.prefix = prefix;
    }

    /** One directive-body level deeper. */
    public Indent nested() {
        return new Indent(prefix + STEP);
    }

    /** Blank padding aligned with the text that follows {@code marker}. */
    public Indent continuation(String marker) {
        return new Indent(prefix + " ".repeat(marker.length()));
    }

    public String prefix() {
        return prefix;
    }

    public String apply(String line) {
        return prefix + line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Indent)) return false;
        return prefix.equals(((Indent) o).prefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix);
    }

    @Override
    public String toString() {
        return "Indent[" + prefix.length() + "]";
    }
}
