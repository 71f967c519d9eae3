package clashsub;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An entry of the emitted {@code proxy-groups} section. Unset optional fields
 * are left out of the output entirely.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "proxies", "include-all", "filter", "url", "interval", "strategy"})
public record ProxyGroup(
        String name,
        Type type,
        List<String> proxies,
        @JsonProperty("include-all") Boolean includeAll,
        String filter,
        String url,
        Integer interval,
        String strategy
) {

    public enum Type {
        SELECT("select"),
        LOAD_BALANCE("load-balance");

        private final String yamlName;

        Type(String yamlName) {
            this.yamlName = yamlName;
        }

        @JsonValue
        public String yamlName() {
            return yamlName;
        }
    }

    public ProxyGroup {
        if (name == null) throw new IllegalArgumentException("Group name is required");
        if (type == null) throw new IllegalArgumentException("Group '" + name + "' must have a type");
        boolean includesAll = Boolean.TRUE.equals(includeAll);
        if (type == Type.SELECT && (proxies == null || includesAll)) {
            throw new IllegalArgumentException("Select group '" + name + "' needs an explicit member list");
        }
        if (type == Type.LOAD_BALANCE && (proxies == null) == !includesAll) {
            throw new IllegalArgumentException(
                "Load-balance group '" + name + "' needs either members or include-all, not both");
        }
        if (filter != null && !includesAll) {
            throw new IllegalArgumentException("Group '" + name + "' can only filter together with include-all");
        }
        proxies = proxies != null ? List.copyOf(proxies) : null;
    }

    public static ProxyGroup select(String name, List<String> members) {
        return new ProxyGroup(name, Type.SELECT, members, null, null, null, null, null);
    }

    public static ProxyGroup loadBalance(String name, List<String> members, ProbePolicy probe) {
        return new ProxyGroup(name, Type.LOAD_BALANCE, members, null, null,
            probe.url(), probe.interval(), probe.strategy());
    }

    /**
     * A load-balance group over every proxy, optionally narrowed by a name filter.
     */
    public static ProxyGroup loadBalanceAll(String name, String filter, ProbePolicy probe) {
        return new ProxyGroup(name, Type.LOAD_BALANCE, null, Boolean.TRUE, filter,
            probe.url(), probe.interval(), probe.strategy());
    }

    /**
     * The probe settings of this group, or null when it has none.
     */
    public ProbePolicy probe() {
        if (url == null || interval == null || strategy == null) return null;
        return new ProbePolicy(url, interval, strategy);
    }
}
