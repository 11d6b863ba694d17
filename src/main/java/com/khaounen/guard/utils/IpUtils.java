package com.khaounen.guard.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

public class IpUtils {

    private static final Pattern IPV4_PREFIX = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)\\.\\d+$");

    private static final String[] FORWARDING_HEADERS = {
            "X-Forwarded-For",
            "X-Real-IP",
            "CF-Connecting-IP",
            "True-Client-IP"
    };

    private IpUtils() {
    }

    public static String resolveIp(HttpServletRequest request) {
        for (String header : FORWARDING_HEADERS) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                return value.split(",")[0].trim();
            }
        }

        return request.getRemoteAddr();
    }

    /**
     * Collapses an address to its network: /24 for IPv4, first hextet for IPv6.
     */
    public static String networkPrefix(String ip) {
        if (ip == null) return "0";

        if (ip.contains(".")) {
            var m = IPV4_PREFIX.matcher(ip);
            if (m.matches()) return m.group(1) + ".0";
            return ip;
        }

        if (ip.contains(":")) {
            return ip.split(":")[0].toLowerCase(Locale.ROOT) + "::";
        }

        return ip;
    }

    public static boolean isIpLiteral(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        if (value.indexOf(':') >= 0) {
            return value.chars().allMatch(c -> Character.digit(c, 16) >= 0 || c == ':' || c == '.');
        }
        String[] parts = value.split("\\.", -1);
        if (parts.length != 4) {
            return false;
        }
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return false;
            }
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }
}
