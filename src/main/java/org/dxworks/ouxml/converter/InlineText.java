package org.dxworks.ouxml.converter;

import org.dxworks.ouxml.model.ContentNode;

/**
 * Text and tail of an inline element with the surrounding whitespace of the text moved outside
 * the markup: leading whitespace goes before the opening delimiter, trailing whitespace to the
 * front of the tail. Markup delimiters then never sit next to a space.
 */
final class InlineText {

    private final String lead;
    private final String text;
    private final String tail;

    private InlineText(String lead, String text, String tail) {
        this.lead = lead;
        this.text = text;
        this.tail = tail;
    }

    static InlineText of(ContentNode node) {
        String text = node.getChildren().isEmpty() ? node.getText() : node.getTextContent();
        String tail = node.getTail();
        if (text == null || text.isBlank()) {
            return new InlineText("", text, tail);
        }
        String stripped = text.strip();
        String lead = text.substring(0, text.indexOf(stripped));
        String trailing = text.substring(lead.length() + stripped.length());
        if (!trailing.isEmpty()) {
            tail = tail == null ? trailing : trailing + tail;
        }
        return new InlineText(lead, stripped, tail);
    }

    /** A text is absent when it is empty after trimming. */
    boolean hasText() {
        return text != null && !text.isBlank();
    }

    /** Whitespace to write before the opening delimiter. */
    String lead() {
        return lead;
    }

    String text() {
        return text;
    }

    String tail() {
        return tail;
    }

    /** Plain whitespace left over when there is no text to wrap. */
    String bareText() {
        return text == null ? "" : text;
    }

    String tailOrEmpty() {
        return tail == null ? "" : tail;
    }
}
