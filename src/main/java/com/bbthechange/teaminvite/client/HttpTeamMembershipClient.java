package com.bbthechange.teaminvite.client;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.MembershipResult;
import com.bbthechange.teaminvite.exception.TerminalExternalFailureException;
import com.bbthechange.teaminvite.exception.TransientExternalFailureException;
import com.bbthechange.teaminvite.model.Team;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the team membership service.
 *
 * <p>Invites are sent as one POST per team carrying every identity of the batch. The response
 * may list identities the service refused; those come back as terminal per-identity results
 * while the rest count as invited. Rate limiting, server errors, timeouts and I/O errors are
 * transient for the whole call.</p>
 */
@Component
public class HttpTeamMembershipClient implements TeamMembershipClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpTeamMembershipClient.class);
    private static final String USER_AGENT = "TeamInviteCore/1.0";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    @Autowired
    public HttpTeamMembershipClient(ObjectMapper objectMapper, TeamInviteProperties properties) {
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getMembership().getBaseUrl();
        this.requestTimeout = properties.getMembership().getRequestTimeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getMembership().getConnectTimeout())
                .build();
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    HttpTeamMembershipClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<MembershipResult> invite(Team team, List<String> identities) {
        if (identities.isEmpty()) {
            return List.of();
        }
        logger.info("Inviting {} identities to team {}", identities.size(), team.getTeamId());

        Map<String, Object> body = new HashMap<>();
        body.put("email_addresses", identities);
        body.put("role", "standard-user");
        body.put("resend_emails", true);

        HttpRequest request = authorized(team, "/accounts/" + encode(team.getAccountId()) + "/invites")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        HttpResponse<String> response = send(request, team);
        Map<String, String> refused = parseRefused(response.body());

        List<MembershipResult> results = new ArrayList<>(identities.size());
        for (String identity : identities) {
            String reason = refused.get(identity.toLowerCase());
            results.add(reason == null
                    ? MembershipResult.invited(identity)
                    : MembershipResult.terminalFailure(identity, reason));
        }
        logger.info("Team {} accepted {}/{} invites", team.getTeamId(), identities.size() - refused.size(),
                identities.size());
        return results;
    }

    @Override
    public boolean remove(Team team, String identity) {
        HttpRequest request = authorized(team,
                "/accounts/" + encode(team.getAccountId()) + "/users/" + encode(identity))
                .DELETE()
                .build();
        try {
            send(request, team);
            logger.info("Removed {} from team {}", identity, team.getTeamId());
            return true;
        } catch (TerminalExternalFailureException e) {
            logger.warn("Team {} refused removal of {}: {}", team.getTeamId(), identity, e.getMessage());
            return false;
        }
    }

    private HttpRequest.Builder authorized(Team team, String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("User-Agent", USER_AGENT)
                .header("Authorization", "Bearer " + team.getAccessToken())
                .timeout(requestTimeout);
    }

    private HttpResponse<String> send(HttpRequest request, Team team) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientExternalFailureException("Membership service timed out for team " + team.getTeamId(), e);
        } catch (IOException e) {
            throw new TransientExternalFailureException("Membership service unreachable for team " + team.getTeamId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExternalFailureException("Interrupted calling membership service", e);
        }

        int statusCode = response.statusCode();
        logger.debug("Membership service {} {} -> {}", request.method(), request.uri().getPath(), statusCode);

        if (statusCode == 429 || statusCode >= 500) {
            throw new TransientExternalFailureException(
                    "Membership service returned " + statusCode + " for team " + team.getTeamId());
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new TerminalExternalFailureException(
                    "Membership service returned " + statusCode + " for team " + team.getTeamId() + ": " + response.body());
        }
        return response;
    }

    /**
     * Response shape: {"errored_emails": [{"email": "...", "error": "..."}]}. Anything else means no refusals.
     */
    private Map<String, String> parseRefused(String body) {
        Map<String, String> refused = new HashMap<>();
        if (body == null || body.isBlank()) {
            return refused;
        }
        try {
            JsonNode errored = objectMapper.readTree(body).path("errored_emails");
            for (JsonNode entry : errored) {
                String email = entry.path("email").asText(null);
                if (email != null) {
                    refused.put(email.toLowerCase(), entry.path("error").asText("refused"));
                }
            }
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable membership response, assuming all invites accepted: {}", e.getMessage());
        }
        return refused;
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize invite request", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
