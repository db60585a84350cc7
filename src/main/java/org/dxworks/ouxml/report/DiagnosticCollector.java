package org.dxworks.ouxml.report;

import java.util.ArrayList;
import java.util.List;

public class DiagnosticCollector implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public long count(DiagnosticType type) {
        return diagnostics.stream().filter(d -> d.type == type).count();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
