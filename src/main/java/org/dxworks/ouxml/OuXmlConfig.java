package org.dxworks.ouxml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class OuXmlConfig {

    private static final String CONFIG_FILE_NAME = "ou-xml-to-rst.yml";

    private final Integer defaultBlock;
    private final Integer defaultPart;
    private final Path mathStylesheet;
    private final Path reportFile;

    private OuXmlConfig(Integer defaultBlock, Integer defaultPart, Path mathStylesheet, Path reportFile) {
        this.defaultBlock = defaultBlock;
        this.defaultPart = defaultPart;
        this.mathStylesheet = mathStylesheet;
        this.reportFile = reportFile;
    }

    /** Block number used when a cross-reference names none; null when not configured. */
    public Integer getDefaultBlock() {
        return defaultBlock;
    }

    public Integer getDefaultPart() {
        return defaultPart;
    }

    /** XSLT used for equations instead of the bundled one; null for the bundled stylesheet. */
    public Path getMathStylesheet() {
        return mathStylesheet;
    }

    public Path getReportFile() {
        return reportFile;
    }

    public static OuXmlConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static OuXmlConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new OuXmlConfig(
                        positiveOrNull(yamlConfig.defaultBlock),
                        positiveOrNull(yamlConfig.defaultPart),
                        pathOrNull(yamlConfig.mathStylesheet),
                        pathOrNull(yamlConfig.reportFile));
            }
        } catch (IOException e) {
            System.err.println("Warning: Ignoring unreadable config " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static OuXmlConfig defaults() {
        return new OuXmlConfig(null, null, null, null);
    }

    public static OuXmlConfig with(Integer defaultBlock, Integer defaultPart, Path mathStylesheet, Path reportFile) {
        return new OuXmlConfig(positiveOrNull(defaultBlock), positiveOrNull(defaultPart), mathStylesheet, reportFile);
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }

    private static Path pathOrNull(String value) {
        return value == null || value.isBlank() ? null : Paths.get(value);
    }

    private static class YamlConfig {
        public Integer defaultBlock;
        public Integer defaultPart;
        public String mathStylesheet;
        public String reportFile;
    }
}
