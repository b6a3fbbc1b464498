package io.dispatch4j.assignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of one robot, supplied fresh by the caller on every assignment call.
 * Implement this over whatever fleet-metrics source the embedding application has;
 * {@link RobotSnapshot} is a ready-made value implementation.
 *
 * <p>The capabilities map is keyed by capability type name ({@code "browser"}, {@code "ocr"}, ...)
 * or custom keys. Values may be:
 * <ul>
 *   <li>a map with optional {@code name} and {@code version} entries</li>
 *   <li>{@code true} (capability present, named after its key)</li>
 *   <li>a string (capability present, value is its version)</li>
 *   <li>a number, used for resources such as {@code memory_total_gb} and {@code cpu_count}</li>
 * </ul>
 */
public interface RobotInfo {

    String STATUS_ONLINE = "online";
    String DEFAULT_ENVIRONMENT = "default";
    String DEFAULT_ZONE = "default";

    String robotId();

    String name();

    String status();

    double cpuPercent();

    double memoryPercent();

    int currentJobs();

    int maxConcurrentJobs();

    List<String> tags();

    String environment();

    Map<String, Object> capabilities();

    String networkZone();

    /**
     * Online and below its concurrency cap.
     */
    default boolean isAvailable() {
        return STATUS_ONLINE.equals(status()) && currentJobs() < maxConcurrentJobs();
    }

    /**
     * Highest of job-slot, CPU and memory utilization, in percent.
     */
    default double utilization() {
        if (maxConcurrentJobs() == 0) {
            return 100.0;
        }
        double jobUtil = (double) currentJobs() / maxConcurrentJobs() * 100.0;
        return Math.max(jobUtil, Math.max(cpuPercent(), memoryPercent()));
    }

    default boolean hasCapability(RobotCapability required) {
        for (RobotCapability offered : offeredCapabilities()) {
            if (offered.matches(required)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Numeric resource from the capabilities map, or 0 when missing or not a number.
     */
    default double resource(String key) {
        Object v = capabilities().get(key);
        return v instanceof Number n ? n.doubleValue() : 0.0;
    }

    default List<RobotCapability> offeredCapabilities() {
        List<RobotCapability> result = new ArrayList<>();
        for (var e : capabilities().entrySet()) {
            String key = e.getKey();
            CapabilityType type = CapabilityType.fromKey(key);
            Object value = e.getValue();
            if (value instanceof Map<?, ?> m) {
                Object name = m.get("name");
                Object version = m.get("version");
                @SuppressWarnings("unchecked")
                Map<String, Object> meta = (Map<String, Object>) m;
                result.add(new RobotCapability(type, name != null ? name.toString() : key,
                        version != null ? version.toString() : null, meta));
            } else if (Boolean.TRUE.equals(value)) {
                result.add(RobotCapability.of(type, key));
            } else if (value instanceof String version) {
                result.add(RobotCapability.of(type, key, version));
            }
        }
        return result;
    }
}
