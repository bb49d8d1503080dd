package by.greenmobile.ewjam.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Jammer bandwidth mode. The capacity is the max number of jammers with this mode
 * that one radar can usefully absorb at the same time.
 */
public enum BandwidthMode {
    NARROW("N", 1),
    MEDIUM("M", 3),
    WIDE("W", 5);

    private final String code;
    private final int capacity;

    BandwidthMode(String code, int capacity) {
        this.code = code;
        this.capacity = capacity;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getCapacity() {
        return capacity;
    }

    @JsonCreator
    public static BandwidthMode fromCode(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (BandwidthMode m : values()) {
            if (m.code.equals(v) || m.name().equals(v)) return m;
        }
        throw new IllegalArgumentException("Unknown bandwidth mode: " + value);
    }
}
