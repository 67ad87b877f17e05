package com.phillippitts.docingest.service.dedup;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the normalized identity key {@code normalizedName::byteSize} used to detect duplicate
 * submissions.
 *
 * <p>Normalization, in order:
 * <ol>
 *   <li>decode percent-encoding when present (malformed escapes leave the name as is)</li>
 *   <li>strip one copy suffix appended by a browser or OS right before the extension:
 *       {@code " (1)"}, {@code "_(2)"}, {@code " 2"}, {@code "_copy"}, {@code " - Copy"}.
 *       Bare digits only count after whitespace, so {@code "report-2024.csv"} keeps its year</li>
 *   <li>collapse runs of whitespace into one space and trim</li>
 *   <li>lowercase</li>
 * </ol>
 * Files without a usable name or size get no key and are never flagged as duplicates.
 */
public final class DedupKeyBuilder {

    private static final Pattern COPY_SUFFIX =
            Pattern.compile("(?:\\s*[-_]?\\s*(?:\\(\\d+\\)|copy)|\\s+\\d+)\\s*(?=\\.[^.]+$)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DedupKeyBuilder() {
    }

    /**
     * @param fileName raw file name as selected or as stored by the backend
     * @param byteSize size in bytes; null or negative means unknown
     * @return the dedup key, or {@code null} when the file bypasses dedup
     */
    public static String keyFor(String fileName, Long byteSize) {
        if (fileName == null || fileName.isBlank() || byteSize == null || byteSize < 0) {
            return null;
        }
        String normalized = normalizeName(fileName);
        if (normalized.isEmpty()) {
            return null;
        }
        return normalized + "::" + byteSize;
    }

    public static String keyFor(String fileName, long byteSize) {
        return keyFor(fileName, Long.valueOf(byteSize));
    }

    /**
     * Applies the name normalization without the size component.
     */
    public static String normalizeName(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = decodePercentEncoding(fileName);
        name = COPY_SUFFIX.matcher(name).replaceFirst("");
        name = WHITESPACE.matcher(name).replaceAll(" ").trim();
        return name.toLowerCase(Locale.ROOT);
    }

    private static String decodePercentEncoding(String name) {
        if (name.indexOf('%') < 0) {
            return name;
        }
        try {
            // '+' is a literal in file names, not an encoded space
            return URLDecoder.decode(name.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformed) {
            return name;
        }
    }
}
