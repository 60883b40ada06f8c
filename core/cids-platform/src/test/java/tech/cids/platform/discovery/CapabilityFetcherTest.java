package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * HTTP behaviour of the capability fetcher against a local WireMock server.
 */
class CapabilityFetcherTest {

    private WireMockServer server;
    private CapabilityFetcher fetcher;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();

        DiscoveryConfig config = mock(DiscoveryConfig.class);
        when(config.connectTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(config.fetchTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(config.healthCheckTimeout()).thenReturn(Duration.ofSeconds(2));

        fetcher = new CapabilityFetcher(config, new ObjectMapper(), () -> "service-token");
    }

    @AfterEach
    void tearDown() {
        if (server.isRunning()) {
            server.stop();
        }
    }

    @Test
    @DisplayName("fetch should send the service token and discovery headers")
    void fetch_shouldSendDiscoveryHeaders() throws Exception {
        // Arrange
        server.stubFor(get(urlPathEqualTo("/discovery"))
            .willReturn(okJson("{\"app_id\":\"hr\",\"version\":\"2.0\"}")));

        // Act
        JsonNode document = fetcher.fetch(server.baseUrl() + "/discovery", true);

        // Assert
        assertThat(document.get("app_id").asText()).isEqualTo("hr");
        server.verify(getRequestedFor(urlPathEqualTo("/discovery"))
            .withQueryParam("version", equalTo("2.0"))
            .withHeader("Authorization", equalTo("Bearer service-token"))
            .withHeader("Accept", equalTo("application/json"))
            .withHeader("User-Agent", equalTo("CIDS-Discovery/2.0"))
            .withHeader("X-Discovery-Version", equalTo("2.0")));
    }

    @Test
    @DisplayName("fetch should omit version markers for legacy documents")
    void fetch_shouldOmitVersion_whenNotVersioned() throws Exception {
        server.stubFor(get(urlPathEqualTo("/discovery")).willReturn(okJson("{}")));

        fetcher.fetch(server.baseUrl() + "/discovery", false);

        server.verify(getRequestedFor(urlEqualTo("/discovery"))
            .withoutHeader("X-Discovery-Version"));
    }

    @ParameterizedTest(name = "HTTP {0} -> {1}")
    @CsvSource({
        "401, AUTHENTICATION_ERROR",
        "403, AUTHENTICATION_ERROR",
        "404, CONFIGURATION_ERROR",
        "408, TIMEOUT_ERROR",
        "429, SERVER_ERROR",
        "500, SERVER_ERROR",
        "503, SERVER_ERROR",
        "418, UNKNOWN_ERROR"
    })
    @DisplayName("fetch should classify non-2xx responses")
    void fetch_shouldClassifyHttpStatus(int status, DiscoveryErrorType expected) {
        server.stubFor(get(urlPathEqualTo("/discovery")).willReturn(aResponse().withStatus(status).withBody("nope")));

        assertThatThrownBy(() -> fetcher.fetch(server.baseUrl() + "/discovery", true))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType()).isEqualTo(expected))
            .hasMessageContaining("HTTP " + status);
    }

    @Test
    @DisplayName("fetch should report a non-JSON body as a validation error")
    void fetch_shouldFailValidation_whenBodyIsNotJson() {
        server.stubFor(get(urlPathEqualTo("/discovery"))
            .willReturn(aResponse().withStatus(200).withBody("<html>not json</html>")));

        assertThatThrownBy(() -> fetcher.fetch(server.baseUrl() + "/discovery", true))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType())
                .isEqualTo(DiscoveryErrorType.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("fetch should reject non-http schemes as configuration errors")
    void fetch_shouldFailConfiguration_whenSchemeIsNotHttp() {
        assertThatThrownBy(() -> fetcher.fetch("ftp://hr.internal/discovery", true))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType())
                .isEqualTo(DiscoveryErrorType.CONFIGURATION_ERROR));
    }

    @Test
    @DisplayName("fetch should turn a failing service token into a configuration error without calling out")
    void fetch_shouldFailConfiguration_whenServiceTokenCannotBeIssued() {
        DiscoveryConfig config = mock(DiscoveryConfig.class);
        when(config.connectTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(config.fetchTimeout()).thenReturn(Duration.ofSeconds(2));
        CapabilityFetcher failingTokens = new CapabilityFetcher(config, new ObjectMapper(), () -> {
            throw new IllegalStateException("signing key not loaded");
        });
        server.stubFor(get(urlPathEqualTo("/discovery")).willReturn(okJson("{}")));

        assertThatThrownBy(() -> failingTokens.fetch(server.baseUrl() + "/discovery", true))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageContaining("signing key not loaded")
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType())
                .isEqualTo(DiscoveryErrorType.CONFIGURATION_ERROR));
        server.verify(0, getRequestedFor(urlPathEqualTo("/discovery")));
    }

    @Test
    @DisplayName("fetch should report a refused connection as a network error")
    void fetch_shouldFailNetwork_whenConnectionRefused() {
        String url = server.baseUrl() + "/discovery";
        server.stop();

        assertThatThrownBy(() -> fetcher.fetch(url, true))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType())
                .isEqualTo(DiscoveryErrorType.NETWORK_ERROR));
    }

    @Test
    @DisplayName("checkHealth should accept client errors and reject server errors")
    void checkHealth_shouldFailOnlyOnServerErrors() throws Exception {
        server.stubFor(head(urlEqualTo("/ok")).willReturn(aResponse().withStatus(405)));
        server.stubFor(head(urlEqualTo("/down")).willReturn(aResponse().withStatus(502)));

        fetcher.checkHealth(server.baseUrl() + "/ok");

        assertThatThrownBy(() -> fetcher.checkHealth(server.baseUrl() + "/down"))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorType())
                .isEqualTo(DiscoveryErrorType.NETWORK_ERROR));
    }

    @Test
    void withVersionParameter_shouldRespectExistingQuery() {
        assertThat(CapabilityFetcher.withVersionParameter("https://a/d")).isEqualTo("https://a/d?version=2.0");
        assertThat(CapabilityFetcher.withVersionParameter("https://a/d?x=1")).isEqualTo("https://a/d?x=1&version=2.0");
    }
}
