package tech.cids.platform.token;

import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically purges expired refresh tokens and revocation rows.
 */
@ApplicationScoped
public class TokenCleanupScheduler {

    private static final Logger LOG = Logger.getLogger(TokenCleanupScheduler.class);

    @Inject
    TokenService tokenService;

    private volatile boolean shutdownInProgress = false;

    @PreDestroy
    void onShutdown() {
        shutdownInProgress = true;
    }

    @Scheduled(every = "${cids.token-cleanup.interval:1h}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void cleanupExpiredTokens() {
        if (shutdownInProgress) {
            return;
        }
        try {
            CleanupResult result = tokenService.cleanupExpired();
            if (result.refreshTokensDeleted() > 0 || result.revocationsDeleted() > 0) {
                LOG.infof("Token cleanup removed %d refresh tokens and %d revocations",
                    result.refreshTokensDeleted(), result.revocationsDeleted());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Token cleanup failed, retrying at the next interval");
        }
    }
}
