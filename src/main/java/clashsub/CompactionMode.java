package clashsub;

/**
 * How the repeated load-balance probe settings are written.
 */
public enum CompactionMode {
    /** Literal {@code url}/{@code interval}/{@code strategy} in every group. */
    NONE,
    /** Shared anchor and merge keys emitted by the YAML generator. */
    NATIVE,
    /** Plain output rewritten line by line by {@link AnchorCompactor}. */
    TEXT
}
