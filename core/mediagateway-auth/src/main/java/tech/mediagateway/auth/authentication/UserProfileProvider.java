package tech.mediagateway.auth.authentication;

/**
 * Resolves email and roles for a user id when tokens are minted.
 *
 * <p>The user directory lives outside this service. Deployments provide their own
 * bean; {@link ConfiguredUserProfileProvider} is the fallback.
 */
public interface UserProfileProvider {

    UserProfile profileFor(String userId);
}
