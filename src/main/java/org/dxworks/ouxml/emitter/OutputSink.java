package org.dxworks.ouxml.emitter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Materializes output units. Paths are relative to the destination root.
 */
public interface OutputSink {
    void write(Path relativeFile, List<String> lines) throws IOException;
}
