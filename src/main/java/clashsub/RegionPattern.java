package clashsub;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A labelled region of the fixed-pattern table. The filter is also what the
 * emitted load-balance group uses as its {@code filter}, so it is kept verbatim.
 *
 * @param label  group name of the region
 * @param filter regular expression matched against node names
 */
public record RegionPattern(String label, String filter) {

    /** Filter of the catch-all region. */
    public static final String UNIVERSAL = ".*";

    public RegionPattern {
        if (label == null || label.isEmpty()) throw new IllegalArgumentException("Region label is required");
        if (filter == null) throw new IllegalArgumentException("Region '" + label + "' must define a filter");
    }

    public boolean isUniversal() {
        return UNIVERSAL.equals(filter);
    }

    /**
     * Compiles the filter, or returns null if it is not a valid expression.
     */
    Pattern compile() {
        try {
            return Pattern.compile(filter);
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
}
