package tech.cids.platform.support;

import tech.cids.platform.token.revocation.RevokedToken;
import tech.cids.platform.token.revocation.RevokedTokenRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryRevokedTokenRepository implements RevokedTokenRepository {

    private final Map<String, RevokedToken> revoked = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();

    @Override
    public boolean existsByJti(String jti) {
        lookups.incrementAndGet();
        return revoked.containsKey(jti);
    }

    @Override
    public Optional<RevokedToken> findByJti(String jti) {
        return Optional.ofNullable(revoked.get(jti));
    }

    @Override
    public void persist(RevokedToken token) {
        revoked.put(token.jti, token);
    }

    @Override
    public long deleteExpired(Instant before) {
        long count = revoked.size();
        revoked.values().removeIf(token -> token.expiresAt.isBefore(before));
        return count - revoked.size();
    }

    public int lookups() {
        return lookups.get();
    }

    public int size() {
        return revoked.size();
    }
}
