package by.greenmobile.ewjam.support;

import by.greenmobile.ewjam.entity.GeoPosition;
import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.Radar;
import by.greenmobile.ewjam.entity.RadarStage;
import by.greenmobile.ewjam.entity.Scenario;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Fixture scenarios from src/test/resources/scenarios, plus small hand-built entities.
 */
public final class TestScenarios {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private TestScenarios() {
    }

    /** 5 radars (one per stage, two in search) against 4 jammers. */
    public static Scenario fourVsFive() {
        return load("four-vs-five");
    }

    /** R1 in search, R2 in tracking, 3 jammers. */
    public static Scenario twoVsThree() {
        return load("two-vs-three");
    }

    public static Scenario load(String name) {
        String path = "/scenarios/" + name + ".json";
        try (InputStream in = TestScenarios.class.getResourceAsStream(path)) {
            if (in == null) throw new IllegalStateException("Missing fixture " + path);
            return MAPPER.readValue(in, Scenario.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Radar radar(String id, RadarStage stage, double lat, double lon, double power) {
        return Radar.builder()
                .id(id)
                .name("Radar " + id)
                .position(new GeoPosition(lat, lon, 0.0))
                .frequency(3.0)
                .power(power)
                .currentStage(stage)
                .build();
    }

    public static Jammer jammer(String id, double lat, double lon, double power) {
        return Jammer.builder()
                .id(id)
                .name("Jammer " + id)
                .position(new GeoPosition(lat, lon, 10_000.0))
                .power(power)
                .build();
    }
}
