package com.khaounen.guard.security.identity;

import com.khaounen.guard.config.RequestContext;
import com.khaounen.guard.utils.IpUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.util.Locale;

public class DefaultIdentityStrategy implements IdentityStrategy {

    private static final String BEARER = "bearer ";
    private static final boolean SECURITY_PRESENT = ClassUtils.isPresent(
            "org.springframework.security.core.context.SecurityContextHolder",
            DefaultIdentityStrategy.class.getClassLoader()
    );

    private final IdentityMode mode;

    public DefaultIdentityStrategy(IdentityMode mode) {
        this.mode = mode == null ? IdentityMode.TOKEN_OR_ADDRESS : mode;
    }

    @Override
    public ClientIdentity resolve(HttpServletRequest request) {
        String ip = RequestContext.getIp();
        if (ip == null) {
            ip = IpUtils.resolveIp(request);
        }
        switch (mode) {
            case ADDRESS:
                return ClientIdentity.address(ip);
            case COMPOSITE:
                return ClientIdentity.composite(IpUtils.networkPrefix(ip), normalizeUa(request.getHeader("User-Agent")));
            case TOKEN_OR_ADDRESS:
            default:
                String token = bearerToken(request);
                if (token != null) {
                    return ClientIdentity.token(token);
                }
                String principal = SECURITY_PRESENT ? SecurityPrincipal.name() : null;
                if (principal != null) {
                    return ClientIdentity.token("principal:" + principal);
                }
                return ClientIdentity.address(ip);
        }
    }

    private static String bearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (!StringUtils.hasText(header)) {
            return null;
        }
        if (header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            String token = header.substring(BEARER.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private static String normalizeUa(String ua) {
        if (ua == null) return "ua-null";
        return ua.toLowerCase(Locale.ROOT)
                .replaceAll("\\d+(\\.\\d+)*", "")
                .replaceAll("\\s+", " ");
    }

    private static final class SecurityPrincipal {
        private SecurityPrincipal() {
        }

        static String name() {
            Authentication auth = SecurityContextHolder.getContext().getAuthentication();
            if (auth == null || !auth.isAuthenticated()) {
                return null;
            }
            Object principal = auth.getPrincipal();
            if (principal == null || "anonymousUser".equals(principal)) {
                return null;
            }
            return auth.getName();
        }
    }
}
