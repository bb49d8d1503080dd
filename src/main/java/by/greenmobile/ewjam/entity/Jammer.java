package by.greenmobile.ewjam.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Jammer {

    private String id;

    private String name;

    private GeoPosition position;

    /** Radiated power, same unit as Radar.power. */
    private Double power;
}
