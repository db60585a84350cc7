package org.dxworks.ouxml.converter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an {@code olink} target such as {@code "Block 2, Part 3, Unit 1"} into the document path
 * {@code block2/part3/unit1}. Missing block or part segments are filled from the settings.
 */
public class CrossReferenceResolver {

    private static final Pattern BLOCK = Pattern.compile("block(\\d*)");
    private static final Pattern PART = Pattern.compile("part(\\d*)");

    private final ConversionSettings settings;

    public CrossReferenceResolver(ConversionSettings settings) {
        this.settings = settings;
    }

    public List<String> resolve(String targetDoc) {
        String block = null;
        String part = null;
        List<String> rest = new ArrayList<>();

        for (String raw : targetDoc.split(",")) {
            String segment = raw.strip().toLowerCase(Locale.ROOT).replace(" ", "");
            if (segment.isEmpty()) {
                continue;
            }
            // block and part only count while they lead the path
            if (block == null && part == null && rest.isEmpty()) {
                Matcher m = BLOCK.matcher(segment);
                if (m.find()) {
                    block = m.group(1).isEmpty() ? settings.getDefaultBlock() : "block" + m.group(1);
                    continue;
                }
            }
            if (part == null && rest.isEmpty()) {
                Matcher m = PART.matcher(segment);
                if (m.find()) {
                    part = m.group(1).isEmpty() ? settings.getDefaultPart() : "part" + m.group(1);
                    continue;
                }
            }
            rest.add(segment);
        }

        List<String> path = new ArrayList<>();
        path.add(block != null ? block : settings.getDefaultBlock());
        path.add(part != null ? part : settings.getDefaultPart());
        path.addAll(rest);
        return path;
    }

    public String toDocumentPath(String targetDoc) {
        return String.join("/", resolve(targetDoc));
    }
}
