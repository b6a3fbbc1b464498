package io.dispatch4j.assignment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A capability a robot offers or a job requires.
 * <p>
 * A required version may carry an operator: {@code ">=1.2"}, {@code ">1.2"}, {@code "<=2"},
 * {@code "<2"}. A bare version means "at least". Versions that are not dotted integers are
 * compared for exact equality.
 */
public record RobotCapability(CapabilityType type, String name, String version, Map<String, Object> metadata) {

    private static final Pattern DOTTED = Pattern.compile("\\d{1,9}(\\.\\d{1,9})*");

    public RobotCapability {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RobotCapability of(CapabilityType type, String name) {
        return new RobotCapability(type, name, null, Map.of());
    }

    public static RobotCapability of(CapabilityType type, String name, String version) {
        return new RobotCapability(type, name, version, Map.of());
    }

    /**
     * Returns true if this (offered) capability satisfies {@code required}.
     */
    public boolean matches(RobotCapability required) {
        if (type != required.type() || !name.equalsIgnoreCase(required.name())) {
            return false;
        }
        if (required.version() != null && version != null) {
            return versionSatisfies(version, required.version());
        }
        return true;
    }

    static boolean versionSatisfies(String have, String need) {
        String op;
        if (need.startsWith(">=") || need.startsWith("<=")) {
            op = need.substring(0, 2);
        } else if (need.startsWith(">") || need.startsWith("<")) {
            op = need.substring(0, 1);
        } else {
            op = ">=";
        }
        String needVersion = need.substring(need.startsWith(op) ? op.length() : 0).trim();

        String haveVersion = have.trim();
        if (!DOTTED.matcher(haveVersion).matches() || !DOTTED.matcher(needVersion).matches()) {
            return have.equals(need);
        }
        int cmp = compareVersions(haveVersion, needVersion);
        return switch (op) {
            case ">" -> cmp > 0;
            case "<=" -> cmp <= 0;
            case "<" -> cmp < 0;
            default -> cmp >= 0;
        };
    }

    // Lexicographic over integer parts; a shorter prefix sorts first (1.2 < 1.2.0).
    private static int compareVersions(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        int n = Math.min(pa.length, pb.length);
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(Integer.parseInt(pa[i]), Integer.parseInt(pb[i]));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(pa.length, pb.length);
    }
}
