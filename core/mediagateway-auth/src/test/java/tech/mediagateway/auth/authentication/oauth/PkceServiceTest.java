package tech.mediagateway.auth.authentication.oauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PkceServiceTest {

    private static final String VERIFIER = "dBjftJeZ4CVP-mJ0gTxGQK2NpT2zRvvohjrLb6WVW9o";
    private static final String CHALLENGE = "FMCqk0K8GnXQaiQnNg-nF5oOBnG9UzbzXq2LyNXSk3s";

    private final PkceService pkceService = new PkceService();

    // ==================== Generation ====================

    @Test
    @DisplayName("Generated verifiers should be valid and distinct")
    void generateCodeVerifier_shouldProduceValidDistinctVerifiers() {
        String first = pkceService.generateCodeVerifier();
        String second = pkceService.generateCodeVerifier();

        assertThat(pkceService.isValidCodeVerifier(first)).isTrue();
        assertThat(first).hasSize(64).isNotEqualTo(second);
    }

    @Test
    @DisplayName("S256 challenge should be the base64url SHA-256 of the verifier")
    void generateCodeChallenge_shouldMatchKnownValue() {
        assertThat(pkceService.generateCodeChallenge(VERIFIER)).isEqualTo(CHALLENGE);
        assertThat(pkceService.isValidCodeChallenge(CHALLENGE)).isTrue();
    }

    // ==================== Verification ====================

    @Test
    @DisplayName("Verification should succeed for the matching verifier")
    void verifyCodeChallenge_shouldSucceed_whenVerifierMatches() {
        assertThat(pkceService.verifyCodeChallenge(VERIFIER, CHALLENGE, "S256")).isTrue();
    }

    @Test
    @DisplayName("Verification should fail for a different verifier")
    void verifyCodeChallenge_shouldFail_whenVerifierDiffers() {
        String other = pkceService.generateCodeVerifier();

        assertThat(pkceService.verifyCodeChallenge(other, CHALLENGE, "S256")).isFalse();
    }

    @Test
    @DisplayName("Verification should reject the plain method even when values are equal")
    void verifyCodeChallenge_shouldFail_whenMethodIsPlain() {
        assertThat(pkceService.verifyCodeChallenge(VERIFIER, VERIFIER, "plain")).isFalse();
        assertThat(pkceService.isSupportedMethod("plain")).isFalse();
    }

    @Test
    @DisplayName("Verification should fail for null input")
    void verifyCodeChallenge_shouldFail_whenInputNull() {
        assertThat(pkceService.verifyCodeChallenge(null, CHALLENGE, "S256")).isFalse();
        assertThat(pkceService.verifyCodeChallenge(VERIFIER, null, "S256")).isFalse();
    }

    // ==================== Format ====================

    @Test
    @DisplayName("Verifiers outside 43-128 characters should be invalid")
    void isValidCodeVerifier_shouldEnforceLength() {
        assertThat(pkceService.isValidCodeVerifier("a".repeat(42))).isFalse();
        assertThat(pkceService.isValidCodeVerifier("a".repeat(43))).isTrue();
        assertThat(pkceService.isValidCodeVerifier("a".repeat(128))).isTrue();
        assertThat(pkceService.isValidCodeVerifier("a".repeat(129))).isFalse();
    }

    @Test
    @DisplayName("Verifiers with reserved characters should be invalid")
    void isValidCodeVerifier_shouldRejectReservedCharacters() {
        assertThat(pkceService.isValidCodeVerifier("a".repeat(42) + "+")).isFalse();
        assertThat(pkceService.isValidCodeVerifier("a".repeat(40) + "-._~")).isTrue();
    }

    @Test
    @DisplayName("Challenges must be exactly 43 base64url characters")
    void isValidCodeChallenge_shouldRejectMalformedChallenge() {
        assertThat(pkceService.isValidCodeChallenge(null)).isFalse();
        assertThat(pkceService.isValidCodeChallenge(CHALLENGE + "A")).isFalse();
        assertThat(pkceService.isValidCodeChallenge(CHALLENGE.substring(1) + "=")).isFalse();
    }
}
