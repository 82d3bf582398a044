package tech.mediagateway.auth.authentication;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.math.BigInteger;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the RSA key pair used to sign and verify tokens.
 *
 * Supports two modes:
 * 1. File-based keys (production) - loads PEM keys from the configured paths
 * 2. Dev keys - loads keys persisted in dev-key-dir, or generates and persists a new pair
 *
 * Exposes the public key as a JWK set so downstream services can verify tokens.
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    @Inject
    AuthConfig authConfig;

    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        try {
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                loadKeysFromPem(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
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
     * Tokens then survive restarts during development.
     */
    private void loadOrGenerateDevKeys(Path keyDir) throws IOException, GeneralSecurityException {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            loadKeys(Files.readAllBytes(privateKeyFile), Files.readAllBytes(publicKeyFile));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            generateKeyPair();
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, privateKey.getEncoded());
            Files.write(publicKeyFile, publicKey.getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure mediagateway.auth.jwt.private-key-path and "
            + "mediagateway.auth.jwt.public-key-path for production.");
    }

    private void loadKeysFromPem(Path privateKeyFile, Path publicKeyFile) throws IOException, GeneralSecurityException {
        LOG.infof("Loading JWT keys from %s and %s", privateKeyFile, publicKeyFile);
        String privateKeyPem = Files.readString(privateKeyFile, StandardCharsets.US_ASCII);
        String publicKeyPem = Files.readString(publicKeyFile, StandardCharsets.US_ASCII);
        loadKeys(parsePemKey(privateKeyPem, "PRIVATE KEY"), parsePemKey(publicKeyPem, "PUBLIC KEY"));
    }

    private void loadKeys(byte[] privateKeyBytes, byte[] publicKeyBytes) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
    }

    private byte[] parsePemKey(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private void generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        KeyPair keyPair = keyGen.generateKeyPair();
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
    }

    private String generateKeyId(RSAPublicKey key) throws NoSuchAlgorithmException {
        byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
        return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
    }

    /**
     * Get the JWKS (JSON Web Key Set) for token verification.
     */
    public Map<String, Object> getJwks() {
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", "RSA");
        jwk.put("alg", ALGORITHM);
        jwk.put("use", "sig");
        jwk.put("kid", keyId);
        jwk.put("n", base64Url(publicKey.getModulus()));
        jwk.put("e", base64Url(publicKey.getPublicExponent()));
        return Map.of("keys", List.of(jwk));
    }

    private static String base64Url(BigInteger value) {
        byte[] bytes = value.toByteArray();
        // Drop the sign byte BigInteger adds for positive values with the high bit set
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] tmp = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, tmp, 0, tmp.length);
            bytes = tmp;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String getIssuer() {
        return authConfig.jwt().issuer();
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
