package tech.cids.platform.token;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.Claims;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import org.jose4j.jwt.consumer.InvalidJwtException;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * RS256 signer on the SmallRye JWT builder, keyed by {@link JwtKeyService}.
 */
@ApplicationScoped
public class SmallRyeTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(SmallRyeTokenSigner.class);

    @Inject
    JwtKeyService keyService;

    @Inject
    TokenConfig config;

    Clock clock = Clock.systemUTC();

    private final JWTParser parser = new DefaultJWTParser();

    public SmallRyeTokenSigner() {
    }

    SmallRyeTokenSigner(JwtKeyService keyService, TokenConfig config, Clock clock) {
        this.keyService = keyService;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public SignedToken sign(Map<String, Object> claims, Duration ttl) {
        Map<String, Object> body = new LinkedHashMap<>(claims);
        Object audience = body.remove(Claims.aud.name());
        // registered claims are always assigned here
        body.remove(Claims.iss.name());
        body.remove(Claims.iat.name());
        body.remove(Claims.nbf.name());
        body.remove(Claims.exp.name());
        body.remove(Claims.jti.name());

        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String jti = TsidGenerator.generate(EntityType.ACCESS_TOKEN);

        JwtClaimsBuilder builder = Jwt.claims(body)
            .issuer(config.jwt().issuer())
            .issuedAt(now)
            .expiresAt(expiresAt)
            .claim(Claims.nbf.name(), now.getEpochSecond())
            .claim(Claims.jti.name(), jti);
        applyAudience(builder, audience);

        String token = builder.jws()
            .keyId(keyService.getKeyId())
            .sign(keyService.getPrivateKey());
        return new SignedToken(token, jti, now, expiresAt);
    }

    private void applyAudience(JwtClaimsBuilder builder, Object audience) {
        if (audience instanceof Collection<?> values && !values.isEmpty()) {
            Set<String> audiences = new LinkedHashSet<>();
            values.forEach(value -> audiences.add(String.valueOf(value)));
            builder.audience(audiences);
        } else if (audience instanceof String value && !value.isBlank()) {
            builder.audience(value);
        } else {
            builder.audience(config.jwt().audience());
        }
    }

    @Override
    public JsonWebToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenValidationException.Reason.INVALID, "Token is empty");
        }
        JsonWebToken jwt;
        try {
            jwt = parser.verify(token, keyService.getPublicKey());
        } catch (ParseException e) {
            if (hasExpired(e)) {
                throw new TokenValidationException(TokenValidationException.Reason.EXPIRED, "Token has expired", e);
            }
            LOG.debugf("Token verification failed: %s", e.getMessage());
            throw new TokenValidationException(TokenValidationException.Reason.INVALID,
                "Token signature or structure is invalid", e);
        }

        if (!config.jwt().issuer().equals(jwt.getIssuer())) {
            LOG.debugf("Token issuer mismatch: expected %s, got %s", config.jwt().issuer(), jwt.getIssuer());
            throw new TokenValidationException(TokenValidationException.Reason.INVALID, "Invalid token issuer");
        }
        if (jwt.getExpirationTime() < clock.instant().getEpochSecond()) {
            throw new TokenValidationException(TokenValidationException.Reason.EXPIRED, "Token has expired");
        }
        return jwt;
    }

    private static boolean hasExpired(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InvalidJwtException invalid && invalid.hasExpired()) {
                return true;
            }
        }
        return false;
    }
}
