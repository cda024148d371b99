package com.example.hostwatch.remediation;

import com.example.hostwatch.config.InvalidConfigurationException;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry mapping metric kinds to remediation issue types.
 *
 * The mapping is fixed; which issue types are enabled comes from configuration and is
 * validated at startup, so a misspelt issue type fails fast instead of silently never
 * remediating.
 */
@Slf4j
@Component
public class IssueTypeRegistry {

    private static final Map<MetricKind, IssueType> MAPPING;

    static {
        Map<MetricKind, IssueType> mapping = new EnumMap<>(MetricKind.class);
        mapping.put(MetricKind.CPU, IssueType.HIGH_CPU);
        mapping.put(MetricKind.MEMORY, IssueType.HIGH_MEMORY);
        mapping.put(MetricKind.DISK, IssueType.HIGH_DISK);
        mapping.put(MetricKind.SERVICE_HEALTH, IssueType.SERVICE_RESTART);
        MAPPING = Collections.unmodifiableMap(mapping);
    }

    private final Set<IssueType> enabled;

    public IssueTypeRegistry(MonitorProperties properties) {
        this.enabled = Collections.unmodifiableSet(parse(properties.getRemediation().getEnabledIssueTypes()));
        log.info("Remediation enabled for issue types: {}", enabled.stream().map(IssueType::id).toList());
    }

    /**
     * The issue type for a kind, regardless of whether it is enabled.
     */
    public IssueType issueTypeFor(MetricKind kind) {
        IssueType type = MAPPING.get(kind);
        if (type == null) {
            throw new IllegalArgumentException("No issue type mapped for " + kind);
        }
        return type;
    }

    public boolean isRemediable(MetricKind kind) {
        return enabled.contains(issueTypeFor(kind));
    }

    public Set<IssueType> getEnabled() {
        return enabled;
    }

    /**
     * Enabled issue types missing from the given list of supported action ids.
     */
    public List<IssueType> unsupportedBy(Collection<String> supportedIds) {
        Set<String> supported = new HashSet<>();
        for (String id : supportedIds) {
            supported.add(id.trim().toLowerCase());
        }
        return enabled.stream()
                .filter(type -> !supported.contains(type.id()))
                .toList();
    }

    static Set<IssueType> parse(List<String> ids) {
        Set<IssueType> result = EnumSet.noneOf(IssueType.class);
        if (ids == null) {
            return result;
        }
        List<String> unknown = new ArrayList<>();
        for (String id : ids) {
            IssueType.fromId(id).ifPresentOrElse(result::add, () -> unknown.add(id));
        }
        if (!unknown.isEmpty()) {
            throw new InvalidConfigurationException("Unknown remediation issue types " + unknown
                    + "; known types are " + Arrays.stream(IssueType.values()).map(IssueType::id).toList());
        }
        return result;
    }
}
