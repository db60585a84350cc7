package org.dxworks.ouxml.emitter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes each output unit as a UTF-8 file below a root directory, one line per entry.
 */
public class FileSystemOutputSink implements OutputSink {

    private final Path root;
    private final List<Path> written = new ArrayList<>();

    public FileSystemOutputSink(Path root) {
        this.root = root;
    }

    /** Removes a previous conversion so stale session folders do not survive. */
    public void clean() throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> paths = stream.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        }
    }

    @Override
    public void write(Path relativeFile, List<String> lines) throws IOException {
        Path target = root.resolve(relativeFile);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
        }
        written.add(target);
    }

    public Path getRoot() {
        return root;
    }

    public List<Path> getWrittenFiles() {
        return List.copyOf(written);
    }
}
