package org.dxworks.ouxml.converter;

/**
 * Per-run values used when a cross-reference omits its block or part segment.
 */
public final class ConversionSettings {

    private final String defaultBlock;
    private final String defaultPart;

    private ConversionSettings(String defaultBlock, String defaultPart) {
        this.defaultBlock = defaultBlock;
        this.defaultPart = defaultPart;
    }

    public static ConversionSettings of(int block, int part) {
        return new ConversionSettings("block" + block, "part" + part);
    }

    public static ConversionSettings withIds(String defaultBlock, String defaultPart) {
        return new ConversionSettings(defaultBlock, defaultPart);
    }

    public String getDefaultBlock() {
        return defaultBlock;
    }

    public String getDefaultPart() {
        return defaultPart;
    }
}
