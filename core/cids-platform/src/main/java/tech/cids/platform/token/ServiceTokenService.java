package tech.cids.platform.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.discovery.ServiceTokenProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signs the short-lived service tokens CIDS presents to applications when fetching their
 * capability descriptions.
 */
@ApplicationScoped
public class ServiceTokenService implements ServiceTokenProvider {

    private static final Logger LOG = Logger.getLogger(ServiceTokenService.class);

    public static final String DISCOVERY_SUBJECT = "cids-discovery-service";
    public static final String DISCOVERY_AUDIENCE = "discovery-api";
    public static final String DISCOVERY_CLIENT_ID = "cids-discovery";
    public static final String DISCOVERY_PERMISSION = "discovery.read";
    public static final String TOKEN_TYPE_SERVICE = "service";

    @Inject
    TokenSigner tokenSigner;

    @Inject
    TokenConfig config;

    @Override
    public String discoveryToken() {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(ClaimsComposer.CLAIM_SUB, DISCOVERY_SUBJECT);
        claims.put(ClaimsComposer.CLAIM_AUD, List.of(DISCOVERY_AUDIENCE));
        claims.put("client_id", DISCOVERY_CLIENT_ID);
        claims.put(ClaimsComposer.CLAIM_TOKEN_TYPE, TOKEN_TYPE_SERVICE);
        claims.put(ClaimsComposer.CLAIM_PERMISSIONS, List.of(DISCOVERY_PERMISSION));
        claims.put(ClaimsComposer.CLAIM_TOKEN_VERSION, ClaimsComposer.TOKEN_VERSION);

        SignedToken signed = tokenSigner.sign(claims, config.jwt().serviceTokenTtl());
        LOG.debugf("Signed discovery service token %s, expires %s", signed.jti(), signed.expiresAt());
        return signed.token();
    }
}
