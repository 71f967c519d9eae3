package clashsub;

import java.util.List;

/**
 * Builds the ordered {@code proxy-groups} section from classified nodes.
 */
public interface GroupSynthesizer {

    List<ProxyGroup> synthesize(List<ClassifiedNode> nodes);

    /**
     * Group the terminal {@code MATCH} rule routes to.
     */
    String defaultGroup();

    /**
     * Target of the direct-routing rules.
     */
    String directTarget();
}
