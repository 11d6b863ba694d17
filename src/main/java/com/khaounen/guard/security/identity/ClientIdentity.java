package com.khaounen.guard.security.identity;

import com.khaounen.guard.utils.Hashing;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Partition key for all per-client state. Tokens are stored hashed so raw credentials never reach
 * the shared store or the logs.
 */
public record ClientIdentity(String value, Kind kind) {

    static final String TOKEN_PREFIX = "tok:";
    static final String COMPOSITE_PREFIX = "fp:";

    public enum Kind {
        ADDRESS,
        TOKEN,
        COMPOSITE
    }

    public ClientIdentity {
        if (value == null || value.isBlank()) {
            throw new InvalidIdentityException("identity must not be empty");
        }
        if (kind == null) {
            throw new InvalidIdentityException("identity kind must not be null");
        }
        value = value.trim();
    }

    public static ClientIdentity address(String address) {
        return new ClientIdentity(address, Kind.ADDRESS);
    }

    public static ClientIdentity token(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidIdentityException("token must not be empty");
        }
        return new ClientIdentity(TOKEN_PREFIX + Hashing.sha256(token.trim()), Kind.TOKEN);
    }

    public static ClientIdentity composite(String... parts) {
        if (parts == null || parts.length == 0) {
            throw new InvalidIdentityException("composite identity needs at least one part");
        }
        String raw = Arrays.stream(parts)
                .map(part -> part == null ? "" : part)
                .collect(Collectors.joining("|"));
        if (raw.replace("|", "").isBlank()) {
            throw new InvalidIdentityException("composite identity parts must not all be empty");
        }
        return new ClientIdentity(COMPOSITE_PREFIX + Hashing.sha256(raw), Kind.COMPOSITE);
    }

    /**
     * Rebuilds an identity from its stored key.
     */
    public static ClientIdentity of(String key) {
        if (key != null && key.startsWith(TOKEN_PREFIX)) {
            return new ClientIdentity(key, Kind.TOKEN);
        }
        if (key != null && key.startsWith(COMPOSITE_PREFIX)) {
            return new ClientIdentity(key, Kind.COMPOSITE);
        }
        return new ClientIdentity(key, Kind.ADDRESS);
    }

    @Override
    public String toString() {
        return value;
    }
}
