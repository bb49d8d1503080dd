package by.greenmobile.ewjam.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Genome: exactly one {@link Assignment} per jammer, in scenario jammer order.
 *
 * Immutable. Genes are stored by jammer index; the jammer order and its id lookup are shared
 * between all matrices derived from the same one, so deriving a matrix copies only the gene array.
 */
public final class AssignmentMatrix {

    private final List<String> jammerIds;
    private final Map<String, Integer> positions;
    private final Assignment[] genes;

    private AssignmentMatrix(List<String> jammerIds, Map<String, Integer> positions, Assignment[] genes) {
        this.jammerIds = jammerIds;
        this.positions = positions;
        this.genes = genes;
    }

    /**
     * @throws IllegalArgumentException on duplicate jammer ids, size mismatch or a null gene
     */
    public static AssignmentMatrix of(List<String> jammerIds, Assignment[] genes) {
        Objects.requireNonNull(jammerIds, "jammerIds");
        Objects.requireNonNull(genes, "genes");
        if (jammerIds.size() != genes.length) {
            throw new IllegalArgumentException("Expected " + jammerIds.size() + " genes, got " + genes.length);
        }
        Map<String, Integer> positions = new HashMap<>(jammerIds.size() * 2);
        for (int i = 0; i < jammerIds.size(); i++) {
            String id = jammerIds.get(i);
            if (id == null) throw new IllegalArgumentException("Jammer id at " + i + " is null");
            if (positions.put(id, i) != null) {
                throw new IllegalArgumentException("Duplicate jammer id: " + id);
            }
        }
        return new AssignmentMatrix(
                Collections.unmodifiableList(List.copyOf(jammerIds)),
                Collections.unmodifiableMap(positions),
                checkedCopy(genes));
    }

    /**
     * New matrix over the same jammer order.
     */
    public AssignmentMatrix withGenes(Assignment[] newGenes) {
        if (newGenes.length != genes.length) {
            throw new IllegalArgumentException("Expected " + genes.length + " genes, got " + newGenes.length);
        }
        return new AssignmentMatrix(jammerIds, positions, checkedCopy(newGenes));
    }

    public int size() {
        return genes.length;
    }

    public List<String> getJammerIds() {
        return jammerIds;
    }

    public String jammerIdAt(int index) {
        return jammerIds.get(index);
    }

    public Assignment gene(int index) {
        return genes[index];
    }

    /** Mutable copy of the genes; callers build a new matrix from it with {@link #withGenes}. */
    public Assignment[] genesCopy() {
        return genes.clone();
    }

    public Optional<Assignment> get(String jammerId) {
        Integer idx = positions.get(jammerId);
        return idx == null ? Optional.empty() : Optional.of(genes[idx]);
    }

    public long assignedCount() {
        return Arrays.stream(genes).filter(Assignment::isAssigned).count();
    }

    public Map<String, Assignment> asMap() {
        Map<String, Assignment> m = new LinkedHashMap<>();
        for (int i = 0; i < genes.length; i++) {
            m.put(jammerIds.get(i), genes[i]);
        }
        return Collections.unmodifiableMap(m);
    }

    private static Assignment[] checkedCopy(Assignment[] src) {
        Assignment[] copy = src.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] == null) throw new IllegalArgumentException("Gene at " + i + " is null");
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignmentMatrix)) return false;
        AssignmentMatrix other = (AssignmentMatrix) o;
        return jammerIds.equals(other.jammerIds) && Arrays.equals(genes, other.genes);
    }

    @Override
    public int hashCode() {
        return 31 * jammerIds.hashCode() + Arrays.hashCode(genes);
    }

    @Override
    public String toString() {
        return "AssignmentMatrix" + asMap();
    }
}
