package tech.cids.platform.token;

import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Signing and verification with real RSA keys.
 */
class SmallRyeTokenSignerTest {

    private static JwtKeyService keys;
    private static JwtKeyService otherKeys;

    @BeforeAll
    static void generateKeys() throws Exception {
        keys = new JwtKeyService(JwtKeyService.generateKeyPair());
        otherKeys = new JwtKeyService(JwtKeyService.generateKeyPair());
    }

    @Test
    @DisplayName("sign should assign registered claims and keep custom ones")
    void sign_shouldAssignRegisteredClaims() {
        // Arrange
        SmallRyeTokenSigner signer = signer(keys, "internal-auth-service", Clock.systemUTC());
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", "u-1");
        claims.put("aud", List.of("hr"));
        claims.put("iss", "someone-else");
        claims.put("token_type", "access");
        claims.put("roles", Map.of("hr", List.of("viewer")));

        // Act
        SignedToken signed = signer.sign(claims, Duration.ofMinutes(10));
        JsonWebToken jwt = signer.verify(signed.token());

        // Assert
        assertThat(jwt.getSubject()).isEqualTo("u-1");
        assertThat(jwt.getIssuer()).isEqualTo("internal-auth-service");
        assertThat(jwt.getAudience()).containsExactly("hr");
        assertThat(jwt.getTokenID()).isEqualTo(signed.jti());
        assertThat(TokenService.stringClaim(jwt, "token_type")).isEqualTo("access");
        assertThat(Duration.between(signed.issuedAt(), signed.expiresAt())).isEqualTo(Duration.ofMinutes(10));
        assertThat(jwt.getExpirationTime()).isEqualTo(signed.expiresAt().getEpochSecond());
    }

    @Test
    @DisplayName("sign should fall back to the configured audience")
    void sign_shouldUseDefaultAudience_whenClaimsHaveNone() {
        SmallRyeTokenSigner signer = signer(keys, "internal-auth-service", Clock.systemUTC());

        JsonWebToken jwt = signer.verify(signer.sign(Map.of("sub", "u-1"), Duration.ofMinutes(5)).token());

        assertThat(jwt.getAudience()).containsExactly("internal-services");
    }

    @Test
    @DisplayName("each token should get its own jti")
    void sign_shouldGenerateUniqueJti() {
        SmallRyeTokenSigner signer = signer(keys, "internal-auth-service", Clock.systemUTC());

        SignedToken first = signer.sign(Map.of("sub", "u-1"), Duration.ofMinutes(5));
        SignedToken second = signer.sign(Map.of("sub", "u-1"), Duration.ofMinutes(5));

        assertThat(first.jti()).isNotEqualTo(second.jti());
    }

    // ========================================
    // VERIFICATION FAILURES
    // ========================================

    @Test
    @DisplayName("verify should report an expired token as EXPIRED")
    void verify_shouldRejectExpiredToken() {
        Clock past = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
        String token = signer(keys, "internal-auth-service", past).sign(Map.of("sub", "u-1"), Duration.ofMinutes(10)).token();
        SmallRyeTokenSigner verifier = signer(keys, "internal-auth-service", Clock.systemUTC());

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(TokenValidationException.class)
            .extracting(e -> ((TokenValidationException) e).getReason())
            .isEqualTo(TokenValidationException.Reason.EXPIRED);
    }

    @Test
    @DisplayName("verify should reject a token signed with another key")
    void verify_shouldRejectForeignSignature() {
        String token = signer(otherKeys, "internal-auth-service", Clock.systemUTC())
            .sign(Map.of("sub", "u-1"), Duration.ofMinutes(10)).token();

        assertThatThrownBy(() -> signer(keys, "internal-auth-service", Clock.systemUTC()).verify(token))
            .extracting(e -> ((TokenValidationException) e).getReason())
            .isEqualTo(TokenValidationException.Reason.INVALID);
    }

    @Test
    @DisplayName("verify should reject a token from another issuer")
    void verify_shouldRejectForeignIssuer() {
        String token = signer(keys, "another-issuer", Clock.systemUTC())
            .sign(Map.of("sub", "u-1"), Duration.ofMinutes(10)).token();

        assertThatThrownBy(() -> signer(keys, "internal-auth-service", Clock.systemUTC()).verify(token))
            .extracting(e -> ((TokenValidationException) e).getReason())
            .isEqualTo(TokenValidationException.Reason.INVALID);
    }

    @Test
    @DisplayName("verify should reject garbage and empty input")
    void verify_shouldRejectMalformedInput() {
        SmallRyeTokenSigner signer = signer(keys, "internal-auth-service", Clock.systemUTC());

        assertThatThrownBy(() -> signer.verify("not.a.jwt"))
            .extracting(e -> ((TokenValidationException) e).getReason())
            .isEqualTo(TokenValidationException.Reason.INVALID);
        assertThatThrownBy(() -> signer.verify(""))
            .extracting(e -> ((TokenValidationException) e).getReason())
            .isEqualTo(TokenValidationException.Reason.INVALID);
    }

    @Test
    @DisplayName("the JWKS should publish the signing key under its key ID")
    void getJwks_shouldPublishSigningKey() {
        assertThat(keys.getJwks().getJsonArray("keys")).hasSize(1);
        assertThat(keys.getJwk().getString("kid")).isEqualTo(keys.getKeyId()).hasSize(8);
        assertThat(keys.getJwk().getString("alg")).isEqualTo("RS256");
        assertThat(keys.getKeyId()).isNotEqualTo(otherKeys.getKeyId());
    }

    static SmallRyeTokenSigner signer(JwtKeyService keyService, String issuer, Clock clock) {
        TokenConfig config = mock(TokenConfig.class);
        TokenConfig.JwtConfig jwt = mock(TokenConfig.JwtConfig.class);
        lenient().when(config.jwt()).thenReturn(jwt);
        lenient().when(jwt.issuer()).thenReturn(issuer);
        lenient().when(jwt.audience()).thenReturn("internal-services");
        lenient().when(jwt.accessTokenTtl()).thenReturn(Duration.ofMinutes(10));
        lenient().when(jwt.serviceTokenTtl()).thenReturn(Duration.ofMinutes(5));
        return new SmallRyeTokenSigner(keyService, config, clock);
    }
}
