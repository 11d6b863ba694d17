package com.khaounen.guard.config;

import com.khaounen.guard.security.identity.IdentityStrategy;
import com.khaounen.guard.security.identity.InvalidIdentityException;
import com.khaounen.guard.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Slf4j
public class RequestContextFilter extends OncePerRequestFilter {

    private final IdentityStrategy identityStrategy;

    public RequestContextFilter(IdentityStrategy identityStrategy) {
        this.identityStrategy = identityStrategy;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            RequestContext.setIp(IpUtils.resolveIp(request));
            RequestContext.setUserAgent(request.getHeader("User-Agent"));
            try {
                RequestContext.setIdentity(identityStrategy.resolve(request));
            } catch (InvalidIdentityException ex) {
                log.debug("no identity for request {}: {}", request.getRequestURI(), ex.getMessage());
            }
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }
}
