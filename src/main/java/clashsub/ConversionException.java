package clashsub;

/**
 * Raised when a subscription cannot be converted. A conversion either completes
 * or fails with exactly one of these; no partial output is produced.
 */
public class ConversionException extends Exception {

    /**
     * What went wrong.
     */
    public enum Failure {
        /** The input text is not a YAML document with a {@code proxies} sequence. */
        PARSE,
        /** The assembled configuration could not be rendered. */
        SERIALIZE
    }

    private final Failure failure;

    public ConversionException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ConversionException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}
