package tech.mediagateway.auth.authentication;

import java.util.Set;

/**
 * Identity attributes copied into tokens.
 */
public record UserProfile(String userId, String email, Set<String> roles) {}
