package com.khaounen.guard.config;

import com.khaounen.guard.security.identity.ClientIdentity;

public final class RequestContext {

    private static final ThreadLocal<String> IP_ADDRESS = new ThreadLocal<>();
    private static final ThreadLocal<String> USER_AGENT = new ThreadLocal<>();
    private static final ThreadLocal<ClientIdentity> IDENTITY = new ThreadLocal<>();

    private RequestContext() {}

    public static void setIp(String ipAddress) {
        IP_ADDRESS.set(ipAddress);
    }

    public static String getIp() {
        return IP_ADDRESS.get();
    }

    public static void setUserAgent(String userAgent) {
        USER_AGENT.set(userAgent);
    }

    public static String getUserAgent() {
        return USER_AGENT.get();
    }

    public static void setIdentity(ClientIdentity identity) {
        IDENTITY.set(identity);
    }

    public static ClientIdentity getIdentity() {
        return IDENTITY.get();
    }

    public static void clear() {
        IP_ADDRESS.remove();
        USER_AGENT.remove();
        IDENTITY.remove();
    }
}
