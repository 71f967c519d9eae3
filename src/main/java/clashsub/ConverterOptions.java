package clashsub;

import java.util.List;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Options of a {@link SubscriptionConverter}.
 *
 * @param policy           classifier and group layout
 * @param compaction       how shared probe settings are written
 * @param probe            probe settings of every load-balance group
 * @param settingsOverride entries replacing or extending the fixed client settings (heuristic policy)
 * @param regions          region table (pattern policy)
 */
public record ConverterOptions(
        GroupingPolicy policy,
        CompactionMode compaction,
        ProbePolicy probe,
        ObjectNode settingsOverride,
        List<RegionPattern> regions
) {

    public ConverterOptions {
        if (policy == null) throw new IllegalArgumentException("policy is required");
        if (compaction == null) throw new IllegalArgumentException("compaction is required");
        if (probe == null) throw new IllegalArgumentException("probe is required");
        settingsOverride = settingsOverride != null
            ? settingsOverride.deepCopy()
            : JsonNodeFactory.instance.objectNode();
        regions = regions != null ? List.copyOf(regions) : PatternClassifier.DEFAULT_REGIONS;
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(GroupingPolicy.HEURISTIC, CompactionMode.NATIVE, ProbePolicy.DEFAULT, null, null);
    }

    public static ConverterOptions of(GroupingPolicy policy, CompactionMode compaction) {
        return new ConverterOptions(policy, compaction, ProbePolicy.DEFAULT, null, null);
    }

    @Override
    public ObjectNode settingsOverride() {
        return settingsOverride.deepCopy();
    }
}
