package tech.mediagateway.auth.authentication;

import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Mints and verifies RS256 access and refresh tokens.
 *
 * <p>Both token types carry {@code sub}, {@code email}, {@code groups} (roles),
 * {@code scope} and a unique {@code jti}; the {@code token_use} claim tells them
 * apart. Refresh tokens also carry {@code fam}, the rotation family.
 *
 * <p>Stateless apart from the signing key held by {@link JwtKeyService}. Expiry
 * is checked against the injected {@link Clock}, the same clock that stamps
 * {@code iat} and {@code exp}.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_SCOPE = "scope";
    static final String CLAIM_TOKEN_USE = "token_use";
    static final String CLAIM_FAMILY = "fam";
    static final String CLAIM_GROUPS = "groups";

    private static final int ALLOWED_CLOCK_SKEW_SECONDS = 60;

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    /**
     * Create a signed access token.
     *
     * @param subject the user id
     * @param email the user's email
     * @param roles the user's roles, carried in the groups claim
     * @param scopes granted scopes
     */
    public IssuedToken createAccessToken(String subject, String email, Collection<String> roles,
                                         Collection<String> scopes) {
        return sign(claims(subject, email, roles, scopes, TokenUse.ACCESS),
            authConfig.jwt().accessTokenExpiry());
    }

    /**
     * Create a signed refresh token.
     *
     * @param family rotation family; every token rotated from the same grant shares it
     */
    public IssuedToken createRefreshToken(String subject, String email, Collection<String> roles,
                                          Collection<String> scopes, String family) {
        JwtClaimsBuilder builder = claims(subject, email, roles, scopes, TokenUse.REFRESH)
            .claim(CLAIM_FAMILY, family);
        return sign(builder, authConfig.jwt().refreshTokenExpiry());
    }

    public TokenClaims verifyAccessToken(String token) {
        return verify(token, TokenUse.ACCESS);
    }

    public TokenClaims verifyRefreshToken(String token) {
        return verify(token, TokenUse.REFRESH);
    }

    /**
     * Verify a token of either type. Access verification is tried first; refresh
     * verification only when the token is not a valid access token. An expired
     * token fails as expired without trying the other type.
     */
    public TokenClaims verifyAnyToken(String token) {
        try {
            return verifyAccessToken(token);
        } catch (AuthException e) {
            if (e.getError() instanceof AuthError.TokenExpired) {
                throw e;
            }
            return verifyRefreshToken(token);
        }
    }

    private JwtClaimsBuilder claims(String subject, String email, Collection<String> roles,
                                    Collection<String> scopes, TokenUse use) {
        JwtClaimsBuilder builder = Jwt.issuer(jwtKeyService.getIssuer())
            .subject(subject)
            .groups(new LinkedHashSet<>(roles))
            .claim(CLAIM_SCOPE, Scopes.join(scopes))
            .claim(CLAIM_TOKEN_USE, use.claimValue());
        if (email != null) {
            builder.claim(CLAIM_EMAIL, email);
        }
        return builder;
    }

    private IssuedToken sign(JwtClaimsBuilder builder, Duration lifetime) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(lifetime);
        String jti = UUID.randomUUID().toString();
        try {
            String token = builder
                .claim("jti", jti)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .jws()
                .keyId(jwtKeyService.getKeyId())
                .sign(jwtKeyService.getPrivateKey());
            return new IssuedToken(token, jti, now, expiresAt);
        } catch (RuntimeException e) {
            throw new AuthException(new AuthError.Internal("Token signing failed: " + e.getMessage()), e);
        }
    }

    private TokenClaims verify(String token, TokenUse expectedUse) {
        if (token == null || token.isBlank()) {
            throw new AuthException(new AuthError.InvalidToken("Token is missing"));
        }

        JwtClaims jwt;
        try {
            jwt = consumer().processToClaims(token);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                LOG.debug("Token expired");
                throw new AuthException(new AuthError.TokenExpired());
            }
            LOG.debugf("Token validation failed: %s", e.getMessage());
            throw new AuthException(new AuthError.InvalidToken("Token is malformed or has an invalid signature"));
        }

        try {
            if (!jwtKeyService.getIssuer().equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", jwtKeyService.getIssuer(), jwt.getIssuer());
                throw new AuthException(new AuthError.InvalidToken("Token issuer is not trusted"));
            }

            TokenUse use = TokenUse.fromClaim(stringClaim(jwt, CLAIM_TOKEN_USE)).orElse(null);
            if (use != expectedUse) {
                throw new AuthException(new AuthError.InvalidToken("Not a " + expectedUse.claimValue() + " token"));
            }

            List<String> groups = jwt.hasClaim(CLAIM_GROUPS) ? jwt.getStringListClaimValue(CLAIM_GROUPS) : List.of();
            NumericDate issuedAt = jwt.getIssuedAt();
            return new TokenClaims(
                jwt.getSubject(),
                stringClaim(jwt, CLAIM_EMAIL),
                Set.copyOf(groups),
                Scopes.parse(stringClaim(jwt, CLAIM_SCOPE)),
                jwt.getJwtId(),
                issuedAt != null ? Instant.ofEpochSecond(issuedAt.getValue()) : null,
                Instant.ofEpochSecond(jwt.getExpirationTime().getValue()),
                use,
                stringClaim(jwt, CLAIM_FAMILY)
            );
        } catch (MalformedClaimException e) {
            LOG.debugf("Token claims malformed: %s", e.getMessage());
            throw new AuthException(new AuthError.InvalidToken("Token is malformed or has an invalid signature"));
        }
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
            .setRequireExpirationTime()
            .setAllowedClockSkewInSeconds(ALLOWED_CLOCK_SKEW_SECONDS)
            .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
            .setSkipDefaultAudienceValidation()
            .setVerificationKey(jwtKeyService.getPublicKey())
            .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256))
            .build();
    }

    private static String stringClaim(JwtClaims jwt, String name) {
        Object value = jwt.getClaimValue(name);
        return value != null ? value.toString() : null;
    }
}
