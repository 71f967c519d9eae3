package clashsub;

import java.util.List;

/**
 * Routing rules: LAN and mainland China go direct, everything else to the default group.
 */
public final class RuleListBuilder {

    private RuleListBuilder() {
    }

    public static List<String> build(String directTarget, String defaultGroup) {
        return List.of(
            "GEOIP,LAN," + directTarget,
            "GEOIP,CN," + directTarget,
            "MATCH," + defaultGroup
        );
    }
}
