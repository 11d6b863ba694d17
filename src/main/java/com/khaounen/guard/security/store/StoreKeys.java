package com.khaounen.guard.security.store;

public final class StoreKeys {

    public static final String OVERRIDE_INDEX = "ovr:index";

    private StoreKeys() {
    }

    /**
     * Counter bucket key. The identity sits in braces, a cluster hash tag, so every bucket of one
     * identity maps to the same slot.
     */
    public static String counter(long windowSeconds, String identity, long bucket) {
        return "rl:" + windowSeconds + ":{" + identity + "}:" + bucket;
    }

    public static String reputation(String identity) {
        return "rep:" + identity;
    }

    public static String override(String identity) {
        return "ovr:" + identity;
    }

    public static String state(String identity) {
        return "st:" + identity;
    }

    public static String lease(String identity) {
        return "lease:" + identity;
    }

    public static String sync(String identity) {
        return "sync:" + identity;
    }
}
