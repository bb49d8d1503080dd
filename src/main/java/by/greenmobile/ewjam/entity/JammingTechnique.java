package by.greenmobile.ewjam.entity;

/**
 * Jamming techniques a jammer can apply to one radar.
 */
public enum JammingTechnique {
    /** Noise jamming. */
    NJ,
    /** Cover pulse. */
    CP,
    /** Multiple false targets. */
    MFT,
    /** Range gate pull-off. */
    RGPO,
    /** Velocity gate pull-off. */
    VGPO
}
