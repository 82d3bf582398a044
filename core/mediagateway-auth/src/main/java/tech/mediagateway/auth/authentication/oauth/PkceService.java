package tech.mediagateway.auth.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange), S256 method only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge in the authorization request
 * 4. Server stores code_challenge with the authorization code
 * 5. Client sends code_verifier in the token request
 * 6. Server verifies BASE64URL(SHA256(code_verifier)) == stored code_challenge
 *
 * The {@code plain} method is rejected.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Pattern UNRESERVED = Pattern.compile("^[A-Za-z0-9\\-._~]+$");
    private static final Pattern BASE64URL = Pattern.compile("^[A-Za-z0-9\\-_]+$");

    /**
     * Generate a cryptographically random code verifier.
     *
     * 48 random bytes encode to 64 base64url characters, inside the 43-128 range
     * RFC 7636 requires.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Compute the S256 challenge for a verifier.
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify a code verifier against the stored challenge.
     *
     * @param codeVerifier the verifier from the token request
     * @param codeChallenge the challenge stored with the authorization code
     * @param method the challenge method stored with the code; anything but S256 fails
     * @return true if the verifier matches the challenge
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null || !METHOD_S256.equals(method)) {
            return false;
        }
        if (!isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        String computed = generateCodeChallenge(codeVerifier);
        return MessageDigest.isEqual(
            computed.getBytes(StandardCharsets.US_ASCII),
            codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * An S256 challenge is exactly 43 base64url characters (32 bytes, no padding).
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return codeChallenge != null
            && codeChallenge.length() == 43
            && BASE64URL.matcher(codeChallenge).matches();
    }

    /**
     * Verifiers are 43-128 unreserved URI characters.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null
            && codeVerifier.length() >= 43
            && codeVerifier.length() <= 128
            && UNRESERVED.matcher(codeVerifier).matches();
    }
}
