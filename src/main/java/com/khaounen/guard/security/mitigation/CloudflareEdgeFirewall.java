package com.khaounen.guard.security.mitigation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.utils.IpUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mirrors blocks as Cloudflare zone firewall rules ({@code ip.src eq <address>}, action
 * {@code block}).
 *
 * <p>Rule ids are cached per identity, so a repeated upsert is a no-op and a removal knows which
 * rule to delete. The description carries the identity, which lets {@link #initialize} rebuild the
 * cache from the rules already present in the zone. Cloudflare rules have no TTL; expiry is driven
 * by the sync worker's sweep.
 */
@Slf4j
public class CloudflareEdgeFirewall implements EdgeFirewall {

    static final String DESCRIPTION_PREFIX = "abuse-guard:";
    static final int PAGE_SIZE = 100;

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final String rulesUrl;
    private final String apiToken;
    private final Duration requestTimeout;
    private final Map<String, String> ruleIds = new ConcurrentHashMap<>();

    public CloudflareEdgeFirewall(
            String baseUrl,
            String zoneId,
            String apiToken,
            Duration connectTimeout,
            Duration requestTimeout,
            ObjectMapper objectMapper
    ) {
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("cloudflare zone id is required");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("cloudflare api token is required");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rulesUrl = base + "/zones/" + zoneId + "/firewall/rules";
        this.apiToken = apiToken;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void initialize() throws EdgeFirewallException {
        int loaded = 0;
        int page = 1;
        int totalPages = 1;
        while (page <= totalPages) {
            JsonNode body = send(request(rulesUrl + "?page=" + page + "&per_page=" + PAGE_SIZE).GET().build(),
                    "list rules");
            JsonNode result = body.path("result");
            for (JsonNode rule : result) {
                String description = rule.path("description").asText("");
                String id = rule.path("id").asText(null);
                if (id != null && description.startsWith(DESCRIPTION_PREFIX)) {
                    ruleIds.put(description.substring(DESCRIPTION_PREFIX.length()), id);
                    loaded++;
                }
            }
            if (result.size() == 0) {
                break;
            }
            totalPages = body.path("result_info").path("total_pages").asInt(page);
            page++;
        }
        log.info("loaded {} existing cloudflare block rules from {} page(s)", loaded, page - 1);
    }

    @Override
    public void upsertBlockRule(String identity, Duration ttl) throws EdgeFirewallException {
        if (!IpUtils.isIpLiteral(identity)) {
            log.warn("cannot express {} as a cloudflare ip rule, skipping", identity);
            return;
        }
        if (ruleIds.containsKey(identity)) {
            log.debug("cloudflare rule for {} already present", identity);
            return;
        }
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("description", DESCRIPTION_PREFIX + identity);
        rule.put("action", "block");
        rule.put("filter", Map.of("expression", "ip.src eq " + identity));
        String payload;
        try {
            payload = objectMapper.writeValueAsString(List.of(rule));
        } catch (IOException ex) {
            throw new EdgeFirewallException("cannot serialize rule for " + identity, ex, false);
        }
        HttpRequest request = request(rulesUrl)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        JsonNode body = send(request, "create rule");
        JsonNode result = body.path("result");
        JsonNode created = result.isArray() ? result.path(0) : result;
        String id = created.path("id").asText(null);
        if (id == null) {
            throw new EdgeFirewallException("cloudflare returned no rule id for " + identity, false);
        }
        ruleIds.put(identity, id);
        log.info("cloudflare rule {} blocks {}", id, identity);
    }

    @Override
    public void removeBlockRule(String identity) throws EdgeFirewallException {
        String id = ruleIds.get(identity);
        if (id == null) {
            log.debug("no cloudflare rule known for {}", identity);
            return;
        }
        HttpRequest request = request(rulesUrl + "/" + id).DELETE().build();
        HttpResponse<String> response = exchange(request, "delete rule");
        if (response.statusCode() != 404) {
            checkStatus(response, "delete rule");
        }
        ruleIds.remove(identity, id);
        log.info("cloudflare rule {} for {} removed", id, identity);
    }

    boolean hasRule(String identity) {
        return ruleIds.containsKey(identity);
    }

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiToken);
    }

    private JsonNode send(HttpRequest request, String operation) throws EdgeFirewallException {
        return checkStatus(exchange(request, operation), operation);
    }

    private HttpResponse<String> exchange(HttpRequest request, String operation) throws EdgeFirewallException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new EdgeFirewallException("cloudflare " + operation + " failed: " + ex.getMessage(), ex, true);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EdgeFirewallException("cloudflare " + operation + " interrupted", ex, false);
        }
    }

    private JsonNode checkStatus(HttpResponse<String> response, String operation) throws EdgeFirewallException {
        int status = response.statusCode();
        JsonNode body;
        try {
            body = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (IOException ex) {
            throw new EdgeFirewallException("cloudflare " + operation + " returned unreadable body (" + status + ")",
                    ex, status >= 500);
        }
        if (status >= 200 && status < 300 && body.path("success").asBoolean(false)) {
            return body;
        }
        boolean retryable = status == 429 || status >= 500;
        throw new EdgeFirewallException("cloudflare " + operation + " failed with " + status + ": "
                + body.path("errors"), retryable);
    }
}
