package by.greenmobile.ewjam.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Position of a radar in the detection/engagement pipeline.
 */
public enum RadarStage {
    SEARCH("search"),
    ACQUISITION("acquisition"),
    TRACKING("tracking"),
    GUIDANCE("guidance");

    private final String code;

    RadarStage(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RadarStage fromCode(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (RadarStage s : values()) {
            if (s.code.equals(v)) return s;
        }
        throw new IllegalArgumentException("Unknown radar stage: " + value);
    }
}
