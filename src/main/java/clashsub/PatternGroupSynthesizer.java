package clashsub;

import java.util.ArrayList;
import java.util.List;

/**
 * Group layout for the fixed region table:
 * {@code [默认流量, 节点选择, 全部节点负载组, <active regions>, 直接连接]}.
 * Region groups select their members through the region filter.
 */
public class PatternGroupSynthesizer implements GroupSynthesizer {

    public static final String DEFAULT_GROUP = "默认流量";
    public static final String NODE_SELECT_GROUP = "节点选择";
    public static final String ALL_NODES_GROUP = "全部节点负载组";
    public static final String DIRECT_GROUP = "直接连接";

    private final PatternClassifier classifier;
    private final ProbePolicy probe;

    public PatternGroupSynthesizer(PatternClassifier classifier, ProbePolicy probe) {
        this.classifier = classifier;
        this.probe = probe;
    }

    @Override
    public List<ProxyGroup> synthesize(List<ClassifiedNode> nodes) {
        List<String> names = new ArrayList<>(nodes.size());
        for (ClassifiedNode node : nodes) {
            names.add(node.name());
        }
        List<RegionPattern> active = classifier.activeRegions(names);

        List<String> defaultMembers = new ArrayList<>(List.of(NODE_SELECT_GROUP, DIRECT_GROUP, ALL_NODES_GROUP));
        for (RegionPattern region : active) {
            defaultMembers.add(region.label());
        }

        List<ProxyGroup> groups = new ArrayList<>();
        groups.add(ProxyGroup.select(DEFAULT_GROUP, defaultMembers));
        groups.add(ProxyGroup.select(NODE_SELECT_GROUP, names));
        groups.add(ProxyGroup.loadBalanceAll(ALL_NODES_GROUP, null, probe));
        for (RegionPattern region : active) {
            groups.add(ProxyGroup.loadBalanceAll(region.label(), region.filter(), probe));
        }
        groups.add(ProxyGroup.select(DIRECT_GROUP, List.of(HeuristicGroupSynthesizer.DIRECT)));
        return groups;
    }

    @Override
    public String defaultGroup() {
        return DEFAULT_GROUP;
    }

    @Override
    public String directTarget() {
        return DIRECT_GROUP;
    }
}
