package org.dxworks.ouxml.converter;

import org.dxworks.ouxml.converter.math.MathTranslator;
import org.dxworks.ouxml.model.ContentNode;
import org.dxworks.ouxml.model.NodeKind;
import org.dxworks.ouxml.report.Diagnostic;
import org.dxworks.ouxml.report.DiagnosticSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts OU-XML content elements into reStructuredText lines.
 * <p>
 * Every block-level rule ends its output with one blank line; inline rules return at most one
 * string holding the node's markup followed by its tail text; a line break inside that string is
 * turned into separate output lines by the enclosing block. Unrecognized elements are reported to
 * the {@link DiagnosticSink} and produce nothing, wherever they occur.
 */
public class NodeConverter {

    private static final String BULLET = "* ";
    private static final String NUMBER = "#. ";
    private static final String ROW_BULLET = "* - ";
    private static final String CELL_BULLET = "  - ";
    private static final String YOUTUBE_SCHEME = "youtube:";
    private static final char FALLBACK_UNDERLINE = '^';

    private final MathTranslator mathTranslator;
    private final DiagnosticSink diagnostics;
    private final CrossReferenceResolver crossReferences;

    public NodeConverter(ConversionSettings settings, MathTranslator mathTranslator, DiagnosticSink diagnostics) {
        this.mathTranslator = mathTranslator;
        this.diagnostics = diagnostics;
        this.crossReferences = new CrossReferenceResolver(settings);
    }

    public List<String> convert(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        return switch (node.getKind()) {
            case TITLE, HEADING -> heading(node, deferred);
            case PARAGRAPH, CAPTION, TABLE_HEAD, QUESTION, SUB_SECTION, SUB_SUB_SECTION, INTERNAL_SECTION ->
                    body(node, indent, "", null, deferred);
            case SOURCE_REFERENCE -> body(node, indent, "-- ", null, deferred);
            case QUOTE, READING -> body(node, indent.nested(), "", null, deferred);
            case REFERENCE -> reference(node, indent, deferred);
            case BOX -> box(node, indent, deferred);
            case ACTIVITY -> activity(node, indent, deferred);
            case STUDY_NOTE, NOTE -> directive(".. note::", node, indent, null, deferred);
            case ANSWER -> directive(".. activity-answer::", node, indent, null, deferred);
            case DESCRIPTION -> directive(".. description::", node, indent, null, deferred);
            case TRANSCRIPT -> directive(".. transcript::", node, indent, null, deferred);
            case BULLETED_LIST, BULLETED_SUBSIDIARY_LIST, UNNUMBERED_LIST, NUMBERED_LIST, NUMBERED_SUBSIDIARY_LIST ->
                    list(node, indent, deferred);
            case LIST_ITEM, SUB_LIST_ITEM -> looseItem(node, indent, deferred);
            case IMAGE -> image(node, indent);
            case FIGURE -> figure(node, indent, deferred);
            case MEDIA_CONTENT -> media(node, indent, deferred);
            case INLINE_FIGURE -> inlineFigure(node, deferred);
            case TABLE -> table(node, indent, deferred);
            case ITALIC -> inline(node, "*", "*");
            case BOLD -> inline(node, "**", "**");
            case UNDERLINE, FONT -> inline(node, "", "");
            case SUPERSCRIPT -> inline(node, ":sup:`", "`");
            case SUBSCRIPT -> inline(node, ":sub:`", "`");
            case GLOSSARY_TERM -> inline(node, ":term:`", "`");
            case LINK -> hyperlink(node);
            case OLINK -> crossReference(node);
            case LINE_BREAK -> lineBreak(node);
            case COMPUTER_CODE -> computerCode(node, indent);
            case EQUATION -> equation(node, indent);
            // walked by the hierarchy emitter or by their enclosing rule
            case UNIT, SESSION, SECTION, MATHML, THEAD, TBODY, TFOOT, ROW, HEADER_CELL, CELL -> List.of();
            case UNKNOWN -> unrecognized(node);
        };
    }

    /*
     * ===================== Headings ===========================
     */

    private List<String> heading(ContentNode node, DeferredOutputQueue deferred) {
        String title = title(node, deferred);
        if (title.isEmpty()) {
            return List.of();
        }
        String underline = String.valueOf(underlineFor(node)).repeat(title.length());
        return List.of(title, underline, "");
    }

    private char underlineFor(ContentNode node) {
        NodeKind parentKind = node.getParentKind();
        if (parentKind != null) {
            switch (parentKind) {
                case SESSION:
                    return '=';
                case SECTION:
                    return '-';
                case SUB_SECTION:
                    return '~';
                case SUB_SUB_SECTION:
                    return '^';
                default:
                    break;
            }
        }
        diagnostics.report(Diagnostic.unrecognizedHeadingContext(node.getTag(), node.getParentTag()));
        return FALLBACK_UNDERLINE;
    }

    /*
     * ===================== Block containers ===========================
     */

    private List<String> body(ContentNode node, Indent indent, String lead, ContentNode skip,
                              DeferredOutputQueue deferred) {
        List<String> lines = new ArrayList<>();
        boolean first = true;
        for (Part part : flow(node, indent, skip, deferred)) {
            if (part.isBlock()) {
                lines.addAll(part.lines);
            } else {
                addText(lines, indent, (first ? lead : "") + part.text);
                lines.add("");
            }
            first = false;
        }
        return lines;
    }

    private List<String> directive(String header, ContentNode node, Indent indent, ContentNode skip,
                                   DeferredOutputQueue deferred) {
        List<String> lines = new ArrayList<>();
        lines.add(indent.apply(header));
        lines.add("");
        lines.addAll(body(node, indent.nested(), "", skip, deferred));
        return lines;
    }

    private List<String> box(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        ContentNode heading = node.findFirstChild(NodeKind.HEADING);
        String title = heading == null ? "" : title(heading, deferred);
        String header = title.isEmpty() ? ".. note::" : ".. admonition:: " + title;
        return directive(header, node, indent, heading, deferred);
    }

    private List<String> activity(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        ContentNode heading = node.findFirstChild(NodeKind.HEADING);
        String title = heading == null ? "" : title(heading, deferred);
        String header = title.isEmpty() ? ".. activity::" : ".. activity:: " + title;
        return directive(header, node, indent, heading, deferred);
    }

    private List<String> reference(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        if (node.getText() == null || node.getText().isBlank()) {
            return List.of();
        }
        String label = node.getText().strip();
        String content = singleLine(inlineContent(node, deferred));
        return List.of(indent.apply(".. [" + label + "] " + content), "");
    }

    /*
     * ===================== Lists ===========================
     */

    private List<String> list(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        List<String> lines = new ArrayList<>();
        boolean endsWithBlank = true;
        for (ContentNode child : node.getChildren()) {
            if (child.getKind() == NodeKind.LIST_ITEM || child.getKind() == NodeKind.SUB_LIST_ITEM) {
                ItemLines item = item(child, indent, markerFor(child), deferred);
                lines.addAll(item.lines);
                endsWithBlank = item.endsWithBlock;
            } else if (child.getKind() == NodeKind.UNKNOWN) {
                unrecognized(child);
            } else if (!NodeKind.isInline(child)) {
                List<String> block = convert(child, indent, deferred);
                if (!block.isEmpty()) {
                    lines.addAll(block);
                    endsWithBlank = true;
                }
            }
        }
        if (!endsWithBlank) {
            lines.add("");
        }
        return lines;
    }

    /** An item met outside a list still ends with a blank line like any other block. */
    private List<String> looseItem(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        ItemLines item = item(node, indent, markerFor(node), deferred);
        if (item.endsWithBlock) {
            return item.lines;
        }
        List<String> lines = new ArrayList<>(item.lines);
        lines.add("");
        return lines;
    }

    private static String markerFor(ContentNode item) {
        NodeKind parentKind = item.getParentKind();
        return parentKind != null && parentKind.isOrderedList() ? NUMBER : BULLET;
    }

    /**
     * Renders one marked entry (list item or table cell). Leading inline content goes on the marker
     * line; block children follow at the continuation indent. Without leading text the marker
     * replaces the padding of the first block's first line.
     */
    private ItemLines item(ContentNode node, Indent indent, String marker, DeferredOutputQueue deferred) {
        Indent body = indent.continuation(marker);
        List<Part> parts = flow(node, body, null, deferred);
        if (parts.isEmpty()) {
            return new ItemLines(List.of(indent.apply(marker.stripTrailing())), false);
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            Part part = parts.get(i);
            if (part.isBlock()) {
                lines.addAll(part.lines);
            } else {
                addText(lines, body, part.text);
                if (i < parts.size() - 1) {
                    lines.add("");
                }
            }
        }
        String first = lines.get(0);
        String content = first.startsWith(body.prefix()) ? first.substring(body.prefix().length()) : first.stripLeading();
        lines.set(0, indent.apply(marker + content));
        return new ItemLines(lines, parts.get(parts.size() - 1).isBlock());
    }

    /*
     * ===================== Media ===========================
     */

    private List<String> image(ContentNode node, Indent indent) {
        String src = node.getAttribute("src");
        if (src == null || src.isBlank()) {
            return List.of();
        }
        return List.of(indent.apply(".. image:: " + MediaSources.fileName(src)), "");
    }

    private List<String> figure(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        ContentNode image = node.findFirstChild(NodeKind.IMAGE);
        String src = image == null ? null : image.getAttribute("src");
        if (src == null || src.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        lines.add(indent.apply(".. figure:: " + MediaSources.fileName(src)));
        lines.add("");
        addCaption(node, indent.nested(), lines, deferred);
        return lines;
    }

    private List<String> media(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        String src = node.getAttribute("src");
        if (src == null || src.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        if (src.startsWith(YOUTUBE_SCHEME)) {
            lines.add(indent.apply(".. youtube:: " + src.substring(YOUTUBE_SCHEME.length())));
            lines.add("");
            ContentNode description = node.findFirstChild(NodeKind.DESCRIPTION);
            if (description != null) {
                lines.addAll(convert(description, indent.nested(), deferred));
            }
            ContentNode transcript = node.findFirstChild(NodeKind.TRANSCRIPT);
            if (transcript != null) {
                lines.addAll(convert(transcript, indent.nested(), deferred));
            }
            return lines;
        }

        Indent options = indent.nested();
        lines.add(indent.apply(".. iframe:: " + MediaSources.reference(src)));
        String width = node.getAttribute("width");
        if (width != null) {
            lines.add(options.apply(":width: " + width));
        }
        String height = node.getAttribute("height");
        if (height != null) {
            lines.add(options.apply(":height: " + height));
        }
        lines.add("");
        addCaption(node, options, lines, deferred);
        return lines;
    }

    private void addCaption(ContentNode node, Indent indent, List<String> lines, DeferredOutputQueue deferred) {
        ContentNode caption = node.findFirstChild(NodeKind.CAPTION);
        if (caption == null) {
            return;
        }
        String text = inlineContent(caption, deferred).strip();
        if (!text.isEmpty()) {
            addText(lines, indent, text);
            lines.add("");
        }
    }

    private List<String> inlineFigure(ContentNode node, DeferredOutputQueue deferred) {
        StringBuilder sb = new StringBuilder();
        ContentNode image = node.findFirstChild(NodeKind.IMAGE);
        List<String> definition = image == null ? List.of() : image(image, Indent.NONE);
        if (!definition.isEmpty()) {
            String id = MediaSources.fileName(image.getAttribute("src"));
            sb.append('|').append(id).append('|');
            List<String> block = new ArrayList<>(definition);
            block.set(0, ".. |" + id + "| image:: " + id);
            deferred.defer(id, block);
        }
        if (node.getTail() != null) {
            sb.append(node.getTail());
        }
        return single(sb);
    }

    /*
     * ===================== Tables ===========================
     */

    private List<String> table(ContentNode node, Indent indent, DeferredOutputQueue deferred) {
        List<ContentNode> rows = rowsOf(node);
        List<String> lines = new ArrayList<>();
        if (!rows.isEmpty()) {
            ContentNode head = node.findFirstChild(NodeKind.TABLE_HEAD);
            String caption = head == null ? "" : title(head, deferred);
            Indent body = indent.nested();
            lines.add(indent.apply(caption.isEmpty() ? ".. list-table::" : ".. list-table:: " + caption));
            lines.add(body.apply(":header-rows: " + countHeaderRows(rows)));
            lines.add("");

            boolean endsWithBlank = true;
            for (ContentNode row : rows) {
                boolean firstCell = true;
                for (ContentNode cell : row.getChildren()) {
                    if (cell.getKind() != NodeKind.HEADER_CELL && cell.getKind() != NodeKind.CELL) {
                        if (cell.getKind() == NodeKind.UNKNOWN) {
                            unrecognized(cell);
                        }
                        continue;
                    }
                    ItemLines cellLines = item(cell, body, firstCell ? ROW_BULLET : CELL_BULLET, deferred);
                    lines.addAll(cellLines.lines);
                    endsWithBlank = cellLines.endsWithBlock;
                    firstCell = false;
                }
            }
            if (!endsWithBlank) {
                lines.add("");
            }
        }

        for (ContentNode child : node.getChildren()) {
            switch (child.getKind()) {
                case TABLE_HEAD, ROW -> {
                    // rendered above
                }
                case THEAD, TBODY, TFOOT -> {
                    for (ContentNode grandChild : child.getChildren()) {
                        if (grandChild.getKind() == NodeKind.UNKNOWN) {
                            unrecognized(grandChild);
                        }
                    }
                }
                case UNKNOWN -> unrecognized(child);
                default -> {
                    if (!NodeKind.isInline(child)) {
                        lines.addAll(convert(child, indent, deferred));
                    }
                }
            }
        }
        return lines;
    }

    private static List<ContentNode> rowsOf(ContentNode table) {
        List<ContentNode> rows = new ArrayList<>();
        for (ContentNode child : table.getChildren()) {
            switch (child.getKind()) {
                case ROW -> rows.add(child);
                case THEAD, TBODY, TFOOT -> rows.addAll(child.findAllChildren(NodeKind.ROW));
                default -> {
                    // captions and footnotes are not rows
                }
            }
        }
        return rows;
    }

    static int countHeaderRows(List<ContentNode> rows) {
        int count = 0;
        for (ContentNode row : rows) {
            if (row.findFirstChild(NodeKind.HEADER_CELL) != null) {
                count++;
            }
        }
        return count;
    }

    /*
     * ===================== Inline ===========================
     */

    private static List<String> inline(ContentNode node, String open, String close) {
        InlineText inline = InlineText.of(node);
        StringBuilder sb = new StringBuilder();
        if (inline.hasText()) {
            sb.append(inline.lead()).append(open).append(inline.text()).append(close);
        } else {
            sb.append(inline.bareText());
        }
        sb.append(inline.tailOrEmpty());
        return single(sb);
    }

    private static List<String> hyperlink(ContentNode node) {
        InlineText inline = InlineText.of(node);
        String href = node.getAttribute("href");
        StringBuilder sb = new StringBuilder();
        if (inline.hasText() && href != null) {
            sb.append(inline.lead()).append('`').append(inline.text()).append(" <").append(href).append(">`_");
        }
        sb.append(inline.tailOrEmpty());
        return single(sb);
    }

    private List<String> crossReference(ContentNode node) {
        InlineText inline = InlineText.of(node);
        String target = node.getAttribute("targetdoc");
        StringBuilder sb = new StringBuilder();
        if (inline.hasText() && target != null) {
            sb.append(inline.lead()).append(":doc:`").append(inline.text())
                    .append(" </").append(crossReferences.toDocumentPath(target)).append("/index>`");
        }
        sb.append(inline.tailOrEmpty());
        return single(sb);
    }

    private static List<String> lineBreak(ContentNode node) {
        String tail = node.getTail() == null ? "" : node.getTail().stripLeading();
        return List.of("\n" + tail);
    }

    private static List<String> computerCode(ContentNode node, Indent indent) {
        if (NodeKind.isInline(node)) {
            return inline(node, "``", "``");
        }
        List<String> lines = new ArrayList<>();
        lines.add(indent.apply(".. sourcecode::"));
        lines.add("");
        Indent code = indent.nested();
        for (String line : node.getText().strip().split("\n", -1)) {
            lines.add(line.isBlank() ? "" : code.apply(line.stripTrailing()));
        }
        lines.add("");
        return lines;
    }

    /*
     * ===================== Equations ===========================
     */

    private List<String> equation(ContentNode node, Indent indent) {
        ContentNode mathml = node.findFirstChild(NodeKind.MATHML);
        if (mathml == null) {
            return List.of();
        }
        Optional<String> tex = mathTranslator.translate(mathml);
        return tex.map(NodeConverter::toMathBlock)
                .filter(line -> !line.isBlank())
                .map(line -> List.of(indent.apply(line), ""))
                .orElse(List.of());
    }

    static String toMathBlock(String tex) {
        return tex.replace("\n", "")
                .replace("\\[", "$$")
                .replace("\\]", "$$")
                .replace("\\", "\\\\");
    }

    /*
     * ===================== Traversal ===========================
     */

    private List<String> unrecognized(ContentNode node) {
        diagnostics.report(Diagnostic.unrecognizedElement(node.getTag(), node.getParentTag()));
        return List.of();
    }

    /** Own text followed by the rendered inline children; block children are left out. */
    private String inlineContent(ContentNode node, DeferredOutputQueue deferred) {
        StringBuilder sb = new StringBuilder();
        if (node.getText() != null) {
            sb.append(node.getText());
        }
        for (ContentNode child : node.getChildren()) {
            if (NodeKind.isInline(child)) {
                convert(child, Indent.NONE, deferred).forEach(sb::append);
            }
        }
        return sb.toString();
    }

    /** Inline content of a heading-like element on a single line. */
    private String title(ContentNode node, DeferredOutputQueue deferred) {
        return singleLine(inlineContent(node, deferred));
    }

    private static String singleLine(String text) {
        return text.strip().replaceAll("\\s*\n\\s*", " ");
    }

    /**
     * Adds inline text as output lines, one per line break, each at {@code indent}.
     * Source indentation of continuation lines is dropped so it cannot start a new block.
     */
    private static void addText(List<String> lines, Indent indent, String text) {
        for (String line : text.split("\n")) {
            String content = line.strip();
            if (!content.isEmpty()) {
                lines.add(indent.apply(content));
            }
        }
    }

    /**
     * Splits the content of {@code node} into runs of inline text and converted block children,
     * in document order. The tail of a block child starts the next run.
     */
    private List<Part> flow(ContentNode node, Indent blockIndent, ContentNode skip, DeferredOutputQueue deferred) {
        List<Part> parts = new ArrayList<>();
        StringBuilder run = new StringBuilder();
        if (node.getText() != null) {
            run.append(node.getText());
        }
        for (ContentNode child : node.getChildren()) {
            if (child == skip) {
                continue;
            }
            if (NodeKind.isInline(child)) {
                convert(child, Indent.NONE, deferred).forEach(run::append);
                continue;
            }
            flushRun(run, parts);
            List<String> block = convert(child, blockIndent, deferred);
            if (!block.isEmpty()) {
                parts.add(Part.block(block));
            }
            if (child.getTail() != null) {
                run.append(child.getTail());
            }
        }
        flushRun(run, parts);
        return parts;
    }

    private static void flushRun(StringBuilder run, List<Part> parts) {
        String text = run.toString().strip();
        if (!text.isEmpty()) {
            parts.add(Part.run(text));
        }
        run.setLength(0);
    }

    private static List<String> single(StringBuilder sb) {
        return sb.length() == 0 ? List.of() : List.of(sb.toString());
    }

    private static final class Part {
        final String text;
        final List<String> lines;

        private Part(String text, List<String> lines) {
            this.text = text;
            this.lines = lines;
        }

        static Part run(String text) {
            return new Part(text, null);
        }

        static Part block(List<String> lines) {
            return new Part(null, lines);
        }

        boolean isBlock() {
            return lines != null;
        }
    }

    private static final class ItemLines {
        final List<String> lines;
        final boolean endsWithBlock;

        ItemLines(List<String> lines, boolean endsWithBlock) {
            this.lines = lines;
            this.endsWithBlock = endsWithBlock;
        }
    }
}
