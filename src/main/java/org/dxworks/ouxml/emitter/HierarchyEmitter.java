package org.dxworks.ouxml.emitter;

import org.dxworks.ouxml.converter.DeferredOutputQueue;
import org.dxworks.ouxml.converter.Indent;
import org.dxworks.ouxml.converter.NodeConverter;
import org.dxworks.ouxml.model.ContentNode;
import org.dxworks.ouxml.model.NodeKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the Unit / Session / Section hierarchy and writes one output unit per level.
 * Each unit owns its own {@link DeferredOutputQueue}, flushed after the unit's content and
 * navigation index.
 */
public class HierarchyEmitter {

    public static final String INDEX_FILE = "index.rst";

    private final NodeConverter converter;
    private final OutputSink sink;

    public HierarchyEmitter(NodeConverter converter, OutputSink sink) {
        this.converter = converter;
        this.sink = sink;
    }

    /**
     * Writes the root index with a navigation entry per Session, and every Session below it.
     *
     * @return number of sessions emitted
     */
    public int emitUnit(ContentNode root, String title) throws IOException {
        List<ContentNode> sessions = sessionsOf(root);
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < sessions.size(); i++) {
            String name = "session" + (i + 1);
            emit(sessions.get(i), Path.of(name));
            entries.add(name + "/index");
        }

        List<String> lines = new ArrayList<>();
        lines.add(title);
        lines.add("#".repeat(title.length()));
        lines.add("");
        lines.addAll(navigationIndex(entries));
        sink.write(Path.of(INDEX_FILE), lines);
        return sessions.size();
    }

    /**
     * Writes {@code level} (a Session or Section) into {@code destination}, recursing into its
     * child Sections.
     */
    public void emit(ContentNode level, Path destination) throws IOException {
        DeferredOutputQueue deferred = new DeferredOutputQueue();
        List<String> lines = new ArrayList<>();
        for (ContentNode child : level.getChildren()) {
            lines.addAll(converter.convert(child, Indent.NONE, deferred));
        }

        List<ContentNode> sections = level.findAllChildren(NodeKind.SECTION);
        if (!sections.isEmpty()) {
            List<String> entries = new ArrayList<>();
            for (int i = 0; i < sections.size(); i++) {
                String name = "section" + (i + 1);
                emit(sections.get(i), destination.resolve(name));
                entries.add(name + "/index");
            }
            lines.addAll(navigationIndex(entries));
        }

        lines.addAll(deferred.lines());
        sink.write(destination.resolve(INDEX_FILE), lines);
    }

    static List<String> navigationIndex(List<String> entries) {
        List<String> lines = new ArrayList<>();
        lines.add(".. toctree::");
        lines.add("    :maxdepth: 1");
        lines.add("    :hidden:");
        lines.add("");
        for (String entry : entries) {
            lines.add("    " + entry);
        }
        lines.add("");
        return lines;
    }

    static List<ContentNode> sessionsOf(ContentNode root) {
        if (root.getKind() == NodeKind.UNIT) {
            return root.findAllChildren(NodeKind.SESSION);
        }
        List<ContentNode> sessions = new ArrayList<>();
        for (ContentNode unit : root.findAllChildren(NodeKind.UNIT)) {
            sessions.addAll(unit.findAllChildren(NodeKind.SESSION));
        }
        return sessions;
    }
}
