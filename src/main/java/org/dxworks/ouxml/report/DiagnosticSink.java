package org.dxworks.ouxml.report;

/**
 * Receives diagnostics from the converter without coupling it to the CLI or the report file.
 */
public interface DiagnosticSink {

    static DiagnosticSink none() {
        return diagnostic -> {
        };
    }

    void report(Diagnostic diagnostic);
}
