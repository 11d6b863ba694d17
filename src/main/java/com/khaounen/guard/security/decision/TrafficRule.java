package com.khaounen.guard.security.decision;

import com.khaounen.guard.security.intake.TrafficEvent;
import org.springframework.util.AntPathMatcher;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One rule variant: which traffic it covers and the limit that applies to it.
 *
 * @param path      Ant-style path pattern, blank to match any path
 * @param methods   HTTP methods, empty to match any
 * @param tags      tags that must all be present with the given values
 * @param threshold weighted requests per window before the traffic counts as violating
 * @param cost      multiplier applied to the event weight
 */
public record TrafficRule(
        String name,
        String path,
        List<String> methods,
        Map<String, String> tags,
        int priority,
        long threshold,
        long cost
) {

    public TrafficRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must not be empty");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("rule " + name + " threshold must be > 0");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("rule " + name + " cost must be >= 0");
        }
        methods = methods == null ? List.of() : List.copyOf(methods);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static TrafficRule catchAll(String name, long threshold) {
        return new TrafficRule(name, "", List.of(), Map.of(), Integer.MIN_VALUE, threshold, 1L);
    }

    boolean matches(TrafficEvent event, AntPathMatcher matcher) {
        if (path != null && !path.isBlank() && !matcher.match(path, event.path())) {
            return false;
        }
        if (!allowsMethod(event.method())) {
            return false;
        }
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (!tag.getValue().equals(event.tags().get(tag.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private boolean allowsMethod(String method) {
        if (methods.isEmpty()) {
            return true;
        }
        String normalized = method == null ? "" : method.toUpperCase(Locale.ROOT);
        return methods.stream().anyMatch(m -> m.equalsIgnoreCase(normalized));
    }

    /**
     * Event weight times the rule cost, saturating at {@link Long#MAX_VALUE}.
     */
    public long weigh(long weight) {
        if (cost != 0 && weight > Long.MAX_VALUE / cost) {
            return Long.MAX_VALUE;
        }
        return weight * cost;
    }
}
