package tech.mediagateway.auth.authentication;

import java.util.Optional;

/**
 * Value of the {@code token_use} claim that separates access from refresh tokens.
 */
public enum TokenUse {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenUse(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenUse> fromClaim(String value) {
        for (TokenUse use : values()) {
            if (use.claimValue.equals(value)) {
                return Optional.of(use);
            }
        }
        return Optional.empty();
    }
}
