package tech.mediagateway.auth.authentication;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Space-delimited scope strings as used on the wire and in the {@code scope} claim.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Split a scope string into distinct scopes, keeping request order.
     * Null or blank input yields an empty list.
     */
    public static List<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
            .distinct()
            .toList();
    }

    public static String join(Collection<String> scopes) {
        return String.join(" ", scopes);
    }
}
