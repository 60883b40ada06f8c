package tech.cids.platform.token;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Holds the RSA key pair tokens are signed with and publishes its public half as a JWKS.
 *
 * Supports two modes:
 * 1. File-based keys (production) - PEM files from cids.auth.jwt.private-key-path / public-key-path
 * 2. Dev keys - generated on first start and persisted to cids.auth.jwt.dev-key-dir
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    @Inject
    TokenConfig config;

    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    public JwtKeyService() {
    }

    JwtKeyService(KeyPair keyPair) {
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
        this.keyId = generateKeyId(publicKey);
    }

    @PostConstruct
    void init() {
        try {
            TokenConfig.JwtConfig jwt = config.jwt();
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                loadKeysFromFiles(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
            } else {
                loadOrGenerateDevKeys(Path.of(jwt.devKeyDir()));
            }
            this.keyId = generateKeyId(publicKey);
            LOG.infof("JWT key service initialized with key ID: %s", keyId);
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
    }

    /**
     * Load dev keys from the local directory, or generate and persist new ones.
     */
    private void loadOrGenerateDevKeys(Path keyDir) throws IOException, GeneralSecurityException {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
                new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            KeyPair keyPair = generateKeyPair();
            this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
            this.publicKey = (RSAPublicKey) keyPair.getPublic();
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, privateKey.getEncoded());
            Files.write(publicKeyFile, publicKey.getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure cids.auth.jwt.private-key-path and "
            + "cids.auth.jwt.public-key-path for production.");
    }

    private void loadKeysFromFiles(Path privateKeyFile, Path publicKeyFile)
            throws IOException, GeneralSecurityException {
        LOG.info("Loading JWT keys from files");
        String privateKeyPem = Files.readString(privateKeyFile, StandardCharsets.US_ASCII);
        String publicKeyPem = Files.readString(publicKeyFile, StandardCharsets.US_ASCII);

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
            new PKCS8EncodedKeySpec(parsePemKey(privateKeyPem, "PRIVATE KEY")));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
            new X509EncodedKeySpec(parsePemKey(publicKeyPem, "PUBLIC KEY")));
    }

    static byte[] parsePemKey(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    static KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        return keyGen.generateKeyPair();
    }

    /**
     * First 8 characters of the base64url SHA-256 of the encoded public key.
     */
    static String generateKeyId(RSAPublicKey key) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * The JSON Web Key Set downstream applications verify tokens with.
     */
    public JsonObject getJwks() {
        JsonArrayBuilder keysArray = Json.createArrayBuilder();
        keysArray.add(getJwk());
        return Json.createObjectBuilder()
            .add("keys", keysArray)
            .build();
    }

    public JsonObject getJwk() {
        return Json.createObjectBuilder()
            .add("kty", "RSA")
            .add("alg", ALGORITHM)
            .add("use", "sig")
            .add("kid", keyId)
            .add("n", base64Url(publicKey.getModulus().toByteArray()))
            .add("e", base64Url(publicKey.getPublicExponent().toByteArray()))
            .build();
    }

    private static String base64Url(byte[] bytes) {
        // BigInteger adds a leading zero byte for the sign bit
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            bytes = trimmed;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String getKeyId() {
        return keyId;
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    public RSAPrivateKey getPrivateKey() {
        return privateKey;
    }
}
