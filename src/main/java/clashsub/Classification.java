package clashsub;

/**
 * Where a named node ends up.
 *
 * @param kind the kind of classification
 * @param tag  the region tag for {@link Kind#REGION}, null otherwise
 */
public record Classification(Kind kind, String tag) {

    public enum Kind {
        /** An informational placeholder (traffic left, expiry date, ...), not a real proxy. */
        INFO,
        /** A proxy assigned to a region. */
        REGION,
        /** A proxy no region could be derived for. */
        UNCLASSIFIED
    }

    private static final Classification INFO = new Classification(Kind.INFO, null);
    private static final Classification UNCLASSIFIED = new Classification(Kind.UNCLASSIFIED, null);

    public Classification {
        if (kind == null) throw new IllegalArgumentException("kind is required");
        if ((kind == Kind.REGION) != (tag != null)) {
            throw new IllegalArgumentException("Only REGION carries a tag");
        }
    }

    public static Classification info() {
        return INFO;
    }

    public static Classification region(String tag) {
        return new Classification(Kind.REGION, tag);
    }

    public static Classification unclassified() {
        return UNCLASSIFIED;
    }
}
