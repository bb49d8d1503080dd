package by.greenmobile.ewjam.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Geographic position. Degrees for lat/lon, metres for alt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoPosition {
    private Double lat;
    private Double lon;
    private Double alt;
}
