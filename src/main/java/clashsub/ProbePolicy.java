package clashsub;

/**
 * Health-check and hashing settings shared by every load-balance group.
 *
 * @param url      URL probed to test a member
 * @param interval probe interval in seconds
 * @param strategy load-balance strategy, e.g. {@code consistent-hashing}
 */
public record ProbePolicy(String url, int interval, String strategy) {

    public static final ProbePolicy DEFAULT =
        new ProbePolicy("http://www.gstatic.com/generate_204", 180, "consistent-hashing");

    public ProbePolicy {
        if (url == null || url.isEmpty()) throw new IllegalArgumentException("Probe url is required");
        if (interval <= 0) throw new IllegalArgumentException("Probe interval must be positive: " + interval);
        if (strategy == null || strategy.isEmpty()) throw new IllegalArgumentException("Probe strategy is required");
    }
}
