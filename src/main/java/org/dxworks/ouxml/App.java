package org.dxworks.ouxml;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.ouxml.converter.ConversionSettings;
import org.dxworks.ouxml.converter.NodeConverter;
import org.dxworks.ouxml.converter.math.MathTranslator;
import org.dxworks.ouxml.converter.math.XsltMathTranslator;
import org.dxworks.ouxml.emitter.FileSystemOutputSink;
import org.dxworks.ouxml.emitter.HierarchyEmitter;
import org.dxworks.ouxml.model.ContentNode;
import org.dxworks.ouxml.reader.OuXmlReadException;
import org.dxworks.ouxml.reader.OuXmlReader;
import org.dxworks.ouxml.report.Diagnostic;
import org.dxworks.ouxml.report.DiagnosticCollector;
import org.dxworks.ouxml.report.DiagnosticSink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        OuXmlConfig config = OuXmlConfig.load();

        Options options;
        try {
            options = Options.parse(args, config);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        if (!Files.isRegularFile(options.source)) {
            System.err.println("Error: Input file does not exist: " + options.source);
            System.exit(1);
        }

        System.out.println("Starting OU-XML conversion...");
        System.out.println("Input: " + options.source.toAbsolutePath());
        System.out.println("Output: " + options.destination.toAbsolutePath());

        Instant startTime = Instant.now();
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        int sessions;
        try {
            MathTranslator math = config.getMathStylesheet() != null
                    ? XsltMathTranslator.fromStylesheet(config.getMathStylesheet())
                    : XsltMathTranslator.bundled();
            sessions = convert(options.source, options.destination, options.settings, math, diagnostics);
        } catch (OuXmlReadException | IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            System.err.println("  Warning: " + diagnostic);
        }

        if (options.report != null) {
            writeReport(options, diagnostics, startTime, sessions);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Sessions written: " + sessions);
        if (!diagnostics.isEmpty()) {
            System.out.println("Diagnostics: " + diagnostics.getDiagnostics().size());
        }
        System.out.println("Output written to: " + options.destination.toAbsolutePath());
        if (options.report != null) {
            System.out.println("Report written to: " + options.report.toAbsolutePath());
        }
        System.out.println("=".repeat(60));
    }

    /**
     * Converts one OU-XML file into a tree of reStructuredText files under {@code destination},
     * replacing whatever the destination held before. The root index is titled after the
     * destination directory.
     *
     * @return number of sessions written
     */
    public static int convert(Path source, Path destination, ConversionSettings settings,
                              MathTranslator math, DiagnosticSink diagnostics) throws IOException {
        ContentNode root = OuXmlReader.read(source);

        FileSystemOutputSink sink = new FileSystemOutputSink(destination);
        sink.clean();

        NodeConverter converter = new NodeConverter(settings, math, diagnostics);
        HierarchyEmitter emitter = new HierarchyEmitter(converter, sink);
        return emitter.emitUnit(root, titleOf(destination));
    }

    static String titleOf(Path destination) {
        Path name = destination.toAbsolutePath().normalize().getFileName();
        return name == null ? destination.toString() : name.toString();
    }

    private static void writeReport(Options options, DiagnosticCollector diagnostics,
                                    Instant startTime, int sessions) throws IOException {
        Path report = options.report;
        if (report.getParent() != null) {
            Files.createDirectories(report.getParent());
        }

        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("source", options.source.toString());
            runInfo.put("destination", options.destination.toString());
            runInfo.put("default_block", options.settings.getDefaultBlock());
            runInfo.put("default_part", options.settings.getDefaultPart());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
                writer.write(MAPPER.writeValueAsString(diagnostic));
                writer.newLine();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("sessions", sessions);
            doneInfo.put("diagnostics", diagnostics.getDiagnostics().size());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar ou-xml-to-rst.jar <source.xml> <destination-dir> [-b N] [-p N] [-r file]");
        System.err.println("  <source.xml>:       OU-XML document to convert");
        System.err.println("  <destination-dir>:  Directory for the reStructuredText output (replaced)");
        System.err.println("  -b, --block N:      Block number for cross-references without one");
        System.err.println("  -p, --part N:       Part number for cross-references without one");
        System.err.println("  -r, --report file:  Write a JSONL report of the run");
        System.err.println("Block and part may also come from ou-xml-to-rst.yml (defaultBlock, defaultPart).");
    }

    static final class Options {
        final Path source;
        final Path destination;
        final ConversionSettings settings;
        final Path report;

        private Options(Path source, Path destination, ConversionSettings settings, Path report) {
            this.source = source;
            this.destination = destination;
            this.settings = settings;
            this.report = report;
        }

        static Options parse(String[] args, OuXmlConfig config) {
            Path source = null;
            Path destination = null;
            Integer block = config.getDefaultBlock();
            Integer part = config.getDefaultPart();
            Path report = config.getReportFile();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-b", "--block" -> block = number(arg, valueAfter(args, i++));
                    case "-p", "--part" -> part = number(arg, valueAfter(args, i++));
                    case "-r", "--report" -> report = Paths.get(valueAfter(args, i++));
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        } else if (source == null) {
                            source = Paths.get(arg);
                        } else if (destination == null) {
                            destination = Paths.get(arg);
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                    }
                }
            }

            if (source == null || destination == null) {
                throw new IllegalArgumentException("Both <source.xml> and <destination-dir> are required");
            }
            if (block == null) {
                throw new IllegalArgumentException("No block number given (-b) and none configured");
            }
            if (part == null) {
                throw new IllegalArgumentException("No part number given (-p) and none configured");
            }
            return new Options(source, destination, ConversionSettings.of(block, part), report);
        }

        private static String valueAfter(String[] args, int i) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i]);
            }
            return args[i + 1];
        }

        private static int number(String option, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects an integer, got: " + value);
            }
        }
    }
}
