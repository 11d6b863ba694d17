package com.khaounen.guard.security;

import com.khaounen.guard.security.identity.InvalidIdentityException;
import com.khaounen.guard.security.reputation.IdentityOverride;
import com.khaounen.guard.security.reputation.OverrideKind;
import com.khaounen.guard.security.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/abuse-guard")
public class GuardAdminController {

    private final GuardAdminService service;

    public GuardAdminController(GuardAdminService service) {
        this.service = service;
    }

    @GetMapping("/identities/{identity}")
    public GuardStatus status(@PathVariable String identity) {
        return service.status(identity);
    }

    @PutMapping("/identities/{identity}/override")
    public IdentityOverride setOverride(@PathVariable String identity, @RequestBody OverrideRequest request) {
        if (request == null || request.kind() == null) {
            throw new IllegalArgumentException("override kind is required");
        }
        Duration ttl = request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
        return service.setOverride(identity, request.kind(), ttl, request.reason());
    }

    @DeleteMapping("/identities/{identity}/override")
    public ResponseEntity<Void> clearOverride(@PathVariable String identity) {
        return service.clearOverride(identity)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/overrides")
    public List<IdentityOverride> overrides() {
        return service.listOverrides();
    }

    @DeleteMapping("/identities/{identity}/counters")
    public ResponseEntity<Void> resetCounters(@PathVariable String identity) {
        service.resetCounters(identity);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        String error = ex instanceof InvalidIdentityException ? "invalid_identity" : "invalid_request";
        return ResponseEntity.badRequest().body(Map.of("error", error, "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> unavailable(StoreUnavailableException ex) {
        log.warn("admin request failed, {} store unavailable: {}", ex.getComponent(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "store_unavailable", "component", ex.getComponent()));
    }

    public record OverrideRequest(OverrideKind kind, Long ttlSeconds, String reason) {
    }
}
