package dev.clarityhub.budget;

import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Coarse file category used to estimate processing cost when a file's size is unknown.
 */
public enum FileType {

    TEXT(512L * 1024),
    DOCUMENT(3L * 1024 * 1024),
    SPREADSHEET(3L * 1024 * 1024),
    IMAGE(4L * 1024 * 1024),
    PDF(6L * 1024 * 1024),
    AUDIO(12L * 1024 * 1024),
    VIDEO(25L * 1024 * 1024),
    /** Unknown type: 5 MiB. */
    OTHER(5L * 1024 * 1024);

    private static final Map<String, FileType> BY_EXTENSION = Map.ofEntries(
            Map.entry("pdf", PDF),
            Map.entry("png", IMAGE), Map.entry("jpg", IMAGE), Map.entry("jpeg", IMAGE),
            Map.entry("gif", IMAGE), Map.entry("webp", IMAGE), Map.entry("svg", IMAGE),
            Map.entry("bmp", IMAGE), Map.entry("tiff", IMAGE),
            Map.entry("mp3", AUDIO), Map.entry("wav", AUDIO), Map.entry("m4a", AUDIO),
            Map.entry("ogg", AUDIO), Map.entry("flac", AUDIO), Map.entry("aac", AUDIO),
            Map.entry("mp4", VIDEO), Map.entry("mov", VIDEO), Map.entry("webm", VIDEO),
            Map.entry("avi", VIDEO), Map.entry("mkv", VIDEO),
            Map.entry("doc", DOCUMENT), Map.entry("docx", DOCUMENT), Map.entry("rtf", DOCUMENT),
            Map.entry("xls", SPREADSHEET), Map.entry("xlsx", SPREADSHEET), Map.entry("ods", SPREADSHEET),
            Map.entry("txt", TEXT), Map.entry("md", TEXT), Map.entry("csv", TEXT),
            Map.entry("json", TEXT), Map.entry("xml", TEXT), Map.entry("html", TEXT));

    private final long estimatedBytes;

    FileType(long estimatedBytes) {
        this.estimatedBytes = estimatedBytes;
    }

    /**
     * Conservative size assumed for a file of this type whose real size is unknown.
     */
    public long estimatedBytes() {
        return estimatedBytes;
    }

    /**
     * Detects the type from a file name's extension, case-insensitively.
     *
     * @param fileName the file name, may be null
     * @return the detected type, or {@link #OTHER} for unknown or missing extensions
     */
    public static FileType fromFileName(@Nullable String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return OTHER;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, OTHER);
    }

    /**
     * Parses a lowercase or uppercase type name such as {@code "pdf"}.
     *
     * @return the matching type, or {@link #OTHER} when unrecognised or null
     */
    public static FileType parse(@Nullable String value) {
        if (value == null) {
            return OTHER;
        }
        for (FileType type : values()) {
            if (type.name().equalsIgnoreCase(value.strip())) {
                return type;
            }
        }
        return OTHER;
    }

    /**
     * Returns the real size when known, otherwise this type's estimate.
     *
     * @param sizeBytes the reported size; null or non-positive means unknown
     */
    public long billableBytes(@Nullable Long sizeBytes) {
        return sizeBytes != null && sizeBytes > 0 ? sizeBytes : estimatedBytes;
    }
}
