package tech.cids.platform.token.revocation;

public enum RevocationReason {
    LOGOUT,
    ADMIN_REVOKED,
    SECURITY_BREACH
}
