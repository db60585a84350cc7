package org.dxworks.ouxml.converter;

/**
 * Resolves media source attributes to the file names used in the generated documents.
 */
public final class MediaSources {

    private MediaSources() {}

    /** Final path segment, splitting on both {@code /} and {@code \}. */
    public static String fileName(String src) {
        int pos = Math.max(src.lastIndexOf('/'), src.lastIndexOf('\\'));
        return src.substring(pos + 1);
    }

    /** URLs are referenced as they are; anything else by its file name. */
    public static String reference(String src) {
        return isUrl(src) ? src : fileName(src);
    }

    public static boolean isUrl(String src) {
        return src.contains("://");
    }
}
