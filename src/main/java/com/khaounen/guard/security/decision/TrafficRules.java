package com.khaounen.guard.security.decision;

import com.khaounen.guard.security.intake.TrafficEvent;
import org.springframework.util.AntPathMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rule variants evaluated highest priority first; ties keep declaration order.
 */
public class TrafficRules {

    private final List<TrafficRule> rules;
    private final TrafficRule defaultRule;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public TrafficRules(List<TrafficRule> rules, TrafficRule defaultRule) {
        if (defaultRule == null) {
            throw new IllegalArgumentException("default rule cannot be null");
        }
        List<TrafficRule> sorted = new ArrayList<>(rules == null ? List.of() : rules);
        sorted.sort(Comparator.comparingInt(TrafficRule::priority).reversed());
        this.rules = List.copyOf(sorted);
        this.defaultRule = defaultRule;
    }

    public static TrafficRules single(long threshold) {
        return new TrafficRules(List.of(), TrafficRule.catchAll("default", threshold));
    }

    public TrafficRule match(TrafficEvent event) {
        for (TrafficRule rule : rules) {
            if (rule.matches(event, matcher)) {
                return rule;
            }
        }
        return defaultRule;
    }

    public TrafficRule defaultRule() {
        return defaultRule;
    }

    public List<TrafficRule> rules() {
        return rules;
    }
}
