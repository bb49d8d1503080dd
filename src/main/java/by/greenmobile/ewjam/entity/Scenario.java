package by.greenmobile.ewjam.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scenario {

    private String name;

    private List<Radar> radars;

    private List<Jammer> jammers;

    public List<Radar> radarsOrEmpty() {
        return radars != null ? radars : Collections.emptyList();
    }

    public List<Jammer> jammersOrEmpty() {
        return jammers != null ? jammers : Collections.emptyList();
    }
}
