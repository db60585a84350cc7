package org.dxworks.ouxml.model;

import java.util.HashMap;
import java.util.Map;

/**
 * The OU-XML element vocabulary understood by the converter.
 * Tags outside this vocabulary map to {@link #UNKNOWN}.
 */
public enum NodeKind {
    // structure
    UNIT("Unit"),
    SESSION("Session"),
    SECTION("Section"),
    SUB_SECTION("SubSection"),
    SUB_SUB_SECTION("SubSubSection"),
    INTERNAL_SECTION("InternalSection"),

    // headings
    TITLE("Title"),
    HEADING("Heading"),

    // block containers
    PARAGRAPH("Paragraph"),
    BOX("Box"),
    STUDY_NOTE("StudyNote"),
    NOTE("Note"),
    QUOTE("Quote"),
    READING("Reading"),
    ACTIVITY("Activity"),
    QUESTION("Question"),
    ANSWER("Answer"),
    DESCRIPTION("Description"),
    TRANSCRIPT("Transcript"),
    SOURCE_REFERENCE("SourceReference"),
    REFERENCE("Reference"),
    CAPTION("Caption"),

    // lists
    BULLETED_LIST("BulletedList"),
    BULLETED_SUBSIDIARY_LIST("BulletedSubsidiaryList"),
    UNNUMBERED_LIST("UnNumberedList"),
    NUMBERED_LIST("NumberedList"),
    NUMBERED_SUBSIDIARY_LIST("NumberedSubsidiaryList"),
    LIST_ITEM("ListItem"),
    SUB_LIST_ITEM("SubListItem"),

    // media
    IMAGE("Image"),
    FIGURE("Figure"),
    MEDIA_CONTENT("MediaContent"),
    INLINE_FIGURE("InlineFigure"),

    // tables
    TABLE("Table"),
    TABLE_HEAD("TableHead"),
    THEAD("thead"),
    TBODY("tbody"),
    TFOOT("tfoot"),
    ROW("tr"),
    HEADER_CELL("th"),
    CELL("td"),

    // inline formatting
    ITALIC("i"),
    BOLD("b"),
    UNDERLINE("u"),
    LINK("a"),
    OLINK("olink"),
    SUPERSCRIPT("sup"),
    SUBSCRIPT("sub"),
    GLOSSARY_TERM("GlossaryTerm"),
    LINE_BREAK("br"),
    FONT("font"),
    COMPUTER_CODE("ComputerCode"),

    // math
    EQUATION("Equation"),
    MATHML("MathML"),

    UNKNOWN(null);

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind.tag != null) {
                BY_TAG.put(kind.tag, kind);
            }
        }
    }

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static NodeKind fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        return BY_TAG.getOrDefault(tag, UNKNOWN);
    }

    public boolean isOrderedList() {
        return this == NUMBERED_LIST || this == NUMBERED_SUBSIDIARY_LIST;
    }

    /**
     * Whether the node flows inside the text of its parent rather than starting a block.
     * Computer code is inline unless its text spans several lines; unknown elements are
     * treated as inline so they never split the surrounding paragraph.
     */
    public static boolean isInline(ContentNode node) {
        return switch (node.getKind()) {
            case ITALIC, BOLD, UNDERLINE, LINK, OLINK, SUPERSCRIPT, SUBSCRIPT, GLOSSARY_TERM,
                 LINE_BREAK, FONT, INLINE_FIGURE, UNKNOWN -> true;
            case COMPUTER_CODE -> node.getText() == null || !node.getText().contains("\n");
            default -> false;
        };
    }
}
