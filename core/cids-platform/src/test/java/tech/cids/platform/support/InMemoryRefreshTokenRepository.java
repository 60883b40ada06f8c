package tech.cids.platform.support;

import tech.cids.platform.token.refresh.RefreshToken;
import tech.cids.platform.token.refresh.RefreshTokenRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private final Map<String, RefreshToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return Optional.ofNullable(tokens.get(tokenHash));
    }

    @Override
    public void persist(RefreshToken token) {
        tokens.put(token.tokenHash, token);
    }

    @Override
    public synchronized boolean revokeToken(String tokenHash, String replacedBy) {
        RefreshToken token = tokens.get(tokenHash);
        if (token == null || token.revoked) {
            return false;
        }
        token.revoked = true;
        token.revokedAt = Instant.now();
        token.replacedBy = replacedBy;
        return true;
    }

    @Override
    public synchronized int revokeTokenFamily(String familyId) {
        int count = 0;
        for (RefreshToken token : tokens.values()) {
            if (familyId.equals(token.familyId) && !token.revoked) {
                token.revoked = true;
                token.revokedAt = Instant.now();
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized int revokeAllForSubject(String subject) {
        int count = 0;
        for (RefreshToken token : tokens.values()) {
            if (subject.equals(token.subject) && !token.revoked) {
                token.revoked = true;
                token.revokedAt = Instant.now();
                count++;
            }
        }
        return count;
    }

    @Override
    public long deleteExpired(Instant before) {
        long count = tokens.size();
        tokens.values().removeIf(token -> token.expiresAt.isBefore(before));
        return count - tokens.size();
    }

    public Collection<RefreshToken> all() {
        return tokens.values();
    }
}
