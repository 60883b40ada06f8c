package tech.cids.platform.token;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Token issuance configuration.
 *
 * <p>Signing keys are read from PEM files when both paths are set. Otherwise a key pair is
 * generated once and kept in {@code dev-key-dir} so tokens survive restarts in development.
 */
@StaticInitSafe
@ConfigMapping(prefix = "cids.auth")
public interface TokenConfig {

    JwtConfig jwt();

    RefreshConfig refresh();

    interface JwtConfig {
        @WithDefault("internal-auth-service")
        String issuer();

        /**
         * Audience of tokens not issued for a specific application.
         */
        @WithDefault("internal-services")
        String audience();

        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        @WithName("access-token-ttl")
        @WithDefault("PT10M")
        Duration accessTokenTtl();

        @WithName("service-token-ttl")
        @WithDefault("PT5M")
        Duration serviceTokenTtl();
    }

    interface RefreshConfig {
        @WithDefault("P30D")
        Duration lifetime();
    }
}
