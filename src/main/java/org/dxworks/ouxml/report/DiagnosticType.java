package org.dxworks.ouxml.report;

public enum DiagnosticType {
    UNRECOGNIZED_ELEMENT,
    UNRECOGNIZED_HEADING_CONTEXT
}
