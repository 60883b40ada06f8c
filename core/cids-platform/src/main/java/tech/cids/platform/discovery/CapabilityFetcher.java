package tech.cids.platform.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.discovery.model.CapabilityDescriptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/**
 * Fetches capability documents over HTTP.
 *
 * <h2>Request headers</h2>
 * <ul>
 *   <li>{@code Authorization: Bearer <service token>}</li>
 *   <li>{@code Accept: application/json}</li>
 *   <li>{@code User-Agent: CIDS-Discovery/2.0}</li>
 *   <li>{@code X-Discovery-Version: 2.0}</li>
 * </ul>
 * Versioned fetches also append {@code version=2.0} to the query string.
 *
 * <h2>Failure classification</h2>
 * <ul>
 *   <li>connect failure or other I/O error - NETWORK_ERROR</li>
 *   <li>request or connect timeout - TIMEOUT_ERROR</li>
 *   <li>non-2xx status - see {@link DiscoveryErrorType#fromHttpStatus(int)}</li>
 *   <li>body that is not JSON - VALIDATION_ERROR</li>
 * </ul>
 */
@ApplicationScoped
public class CapabilityFetcher implements CapabilitySource {

    private static final Logger LOG = Logger.getLogger(CapabilityFetcher.class);
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    public static final String HEADER_DISCOVERY_VERSION = "X-Discovery-Version";
    public static final String USER_AGENT = "CIDS-Discovery/" + CapabilityDescriptor.CURRENT_VERSION;

    @Inject
    DiscoveryConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    ServiceTokenProvider serviceTokenProvider;

    private HttpClient httpClient;

    public CapabilityFetcher() {
    }

    CapabilityFetcher(DiscoveryConfig config, ObjectMapper objectMapper, ServiceTokenProvider serviceTokenProvider) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.serviceTokenProvider = serviceTokenProvider;
        init();
    }

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public void checkHealth(String discoveryUrl) throws DiscoveryException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(toUri(discoveryUrl))
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .header("User-Agent", USER_AGENT)
            .timeout(config.healthCheckTimeout())
            .build();

        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() >= 500) {
                throw new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR,
                    "Health check failed: HTTP " + response.statusCode() + " from " + discoveryUrl);
            }
            LOG.debugf("Health check for [%s] returned %d", discoveryUrl, response.statusCode());
        } catch (HttpTimeoutException e) {
            throw new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR,
                "Health check timed out after " + config.healthCheckTimeout().toSeconds() + "s: " + discoveryUrl, e);
        } catch (IOException e) {
            throw new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR,
                "Health check could not reach " + discoveryUrl + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, "Health check interrupted", e);
        }
    }

    private String discoveryToken() throws DiscoveryException {
        try {
            return serviceTokenProvider.discoveryToken();
        } catch (RuntimeException e) {
            throw new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR,
                "Could not issue the discovery service token: " + describe(e), e);
        }
    }

    @Override
    public JsonNode fetch(String discoveryUrl, boolean versioned) throws DiscoveryException {
        String url = versioned ? withVersionParameter(discoveryUrl) : discoveryUrl;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(toUri(url))
            .GET()
            .header("Authorization", "Bearer " + discoveryToken())
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .timeout(config.fetchTimeout());
        if (versioned) {
            builder.header(HEADER_DISCOVERY_VERSION, CapabilityDescriptor.CURRENT_VERSION);
        }

        HttpResponse<String> response;
        try {
            LOG.debugf("Fetching capability document from [%s]", url);
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR,
                "Timed out fetching " + url + ": " + describe(e), e);
        } catch (ConnectException e) {
            throw new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR,
                "Connection refused by " + url + ": " + describe(e), e);
        } catch (IOException e) {
            throw new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR,
                "I/O error fetching " + url + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, "Fetch interrupted: " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            DiscoveryErrorType type = DiscoveryErrorType.fromHttpStatus(status);
            throw new DiscoveryException(type, "HTTP " + status + " from " + url + truncate(response.body()));
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new DiscoveryException(DiscoveryErrorType.VALIDATION_ERROR, "Empty discovery response from " + url);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DiscoveryException(DiscoveryErrorType.VALIDATION_ERROR,
                "Discovery response from " + url + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Append {@code version=2.0}, respecting an existing query string.
     */
    static String withVersionParameter(String url) {
        String separator = url.contains("?") ? "&" : "?";
        return url + separator + "version=" + CapabilityDescriptor.CURRENT_VERSION;
    }

    private static URI toUri(String url) throws DiscoveryException {
        try {
            URI uri = URI.create(url);
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR,
                    "Discovery URL must use http or https: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR, "Invalid discovery URL: " + url, e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.length() > MAX_ERROR_BODY_LENGTH ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : body;
        return ": " + trimmed;
    }
}
