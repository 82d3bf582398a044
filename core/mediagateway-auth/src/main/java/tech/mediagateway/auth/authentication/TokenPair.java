package tech.mediagateway.auth.authentication;

import java.util.List;

/**
 * Access and refresh token issued together for one grant.
 */
public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken, List<String> scopes, String family) {}
