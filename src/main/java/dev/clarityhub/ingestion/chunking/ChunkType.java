package dev.clarityhub.ingestion.chunking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resolution of a chunk: broad-context parent or precise child span.
 */
public enum ChunkType {
    PARENT("parent"),
    CHILD("child");

    private final String value;

    ChunkType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChunkType fromValue(String value) {
        for (ChunkType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid chunk type: " + value);
    }
}
