package com.khaounen.guard.security.intake;

import com.khaounen.guard.security.identity.ClientIdentity;
import com.khaounen.guard.security.identity.InvalidIdentityException;

import java.util.Map;

/**
 * One observed request. Transient: never persisted past processing.
 *
 * @param timestamp epoch millis of the request
 * @param weight    cost units, {@code 1} for an ordinary request
 * @param tags      opaque metadata such as path and method
 */
public record TrafficEvent(ClientIdentity identity, long timestamp, long weight, Map<String, String> tags) {

    public static final String TAG_PATH = "path";
    public static final String TAG_METHOD = "method";

    public TrafficEvent {
        if (identity == null) {
            throw new InvalidIdentityException("identity must not be empty");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static TrafficEvent of(ClientIdentity identity, long timestamp) {
        return new TrafficEvent(identity, timestamp, 1L, Map.of());
    }

    public static TrafficEvent of(String identity, long timestamp, long weight) {
        return new TrafficEvent(ClientIdentity.of(identity), timestamp, weight, Map.of());
    }

    public String path() {
        return tags.getOrDefault(TAG_PATH, "");
    }

    public String method() {
        return tags.getOrDefault(TAG_METHOD, "");
    }
}
