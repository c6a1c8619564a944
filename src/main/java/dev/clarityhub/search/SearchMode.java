package dev.clarityhub.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Which retrieval branches a search runs.
 */
public enum SearchMode {

    /** Full-text search only. */
    LEXICAL("lexical"),
    /** Embedding similarity search only. */
    VECTOR("vector"),
    /** Both branches, merged. */
    HYBRID("hybrid");

    private final String value;

    SearchMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a mode case-insensitively. Accepts {@code text} and {@code semantic} as aliases for
     * {@link #LEXICAL} and {@link #VECTOR}.
     *
     * @param value the mode name; null or blank yields {@link #HYBRID}
     * @throws IllegalArgumentException if the value is not a known mode
     */
    @JsonCreator
    public static SearchMode fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "lexical", "text" -> LEXICAL;
            case "vector", "semantic" -> VECTOR;
            case "hybrid" -> HYBRID;
            default -> throw new IllegalArgumentException(
                    "Unknown search mode: '" + value + "'. Valid values: lexical, vector, hybrid");
        };
    }
}
