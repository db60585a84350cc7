package org.dxworks.ouxml.report;

/**
 * One problem found while converting; conversion continues after it is reported.
 */
public class Diagnostic {
    public String kind = "diagnostic";
    public DiagnosticType type;
    public String element; // tag of the offending element
    public String parent; // tag of its parent, null at the root

    public static Diagnostic unrecognizedElement(String element, String parent) {
        return of(DiagnosticType.UNRECOGNIZED_ELEMENT, element, parent);
    }

    public static Diagnostic unrecognizedHeadingContext(String element, String parent) {
        return of(DiagnosticType.UNRECOGNIZED_HEADING_CONTEXT, element, parent);
    }

    private static Diagnostic of(DiagnosticType type, String element, String parent) {
        Diagnostic diagnostic = new Diagnostic();
        diagnostic.type = type;
        diagnostic.element = element;
        diagnostic.parent = parent;
        return diagnostic;
    }

    @Override
    public String toString() {
        String where = parent == null ? "" : " in <" + parent + ">";
        return switch (type) {
            case UNRECOGNIZED_ELEMENT -> "Unrecognized element <" + element + ">" + where;
            case UNRECOGNIZED_HEADING_CONTEXT -> "No heading level for <" + element + ">" + where;
        };
    }
}
