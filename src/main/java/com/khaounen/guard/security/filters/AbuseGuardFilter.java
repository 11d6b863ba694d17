package com.khaounen.guard.security.filters;

import com.khaounen.guard.config.RequestContext;
import com.khaounen.guard.security.AbuseGuardProperties;
import com.khaounen.guard.security.decision.Verdict;
import com.khaounen.guard.security.identity.ClientIdentity;
import com.khaounen.guard.security.intake.TrafficEvent;
import com.khaounen.guard.security.intake.TrafficIntake;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Applies verdicts to servlet requests. Relies on {@link com.khaounen.guard.config.RequestContextFilter}
 * having resolved the client identity.
 */
public class AbuseGuardFilter extends OncePerRequestFilter {

    static final String VERDICT_HEADER = "X-Guard-Verdict";
    static final String REASON_HEADER = "X-Guard-Reason";

    private final AbuseGuardProperties properties;
    private final TrafficIntake intake;
    private final ChallengeHandler challengeHandler;
    private final Clock clock;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public AbuseGuardFilter(
            AbuseGuardProperties properties,
            TrafficIntake intake,
            ChallengeHandler challengeHandler,
            Clock clock
    ) {
        this.properties = properties;
        this.intake = intake;
        this.challengeHandler = challengeHandler;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = request.getRequestURI();
        return properties.getExcludedPaths().stream().anyMatch(pattern -> matcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        ClientIdentity identity = RequestContext.getIdentity();
        if (identity == null) {
            response.setStatus(400);
            response.setContentType("text/plain");
            response.getWriter().write("Unidentifiable client.");
            return;
        }

        TrafficEvent event = new TrafficEvent(
                identity,
                clock.millis(),
                1L,
                Map.of(TrafficEvent.TAG_PATH, request.getRequestURI(), TrafficEvent.TAG_METHOD, request.getMethod())
        );
        Verdict verdict = intake.decide(event);
        response.setHeader(VERDICT_HEADER, verdict.kind().name());
        response.setHeader(REASON_HEADER, verdict.reason().name());

        switch (verdict.kind()) {
            case THROTTLE:
                response.setStatus(429);
                response.setHeader("Retry-After", String.valueOf(verdict.retryAfterSeconds()));
                response.setContentType("text/plain");
                long retryAfterMinutes = Math.max(1, (verdict.retryAfterSeconds() + 59) / 60);
                response.getWriter().write("Too Many Requests. Try again in " + retryAfterMinutes + " minute(s).");
                return;
            case CHALLENGE:
                challengeHandler.handle(request, response, verdict);
                return;
            case BLOCK:
                response.setStatus(403);
                response.setHeader("Retry-After", String.valueOf(verdict.retryAfterSeconds()));
                response.setContentType("text/plain");
                response.getWriter().write("Access blocked.");
                return;
            default:
                filterChain.doFilter(request, response);
        }
    }
}
