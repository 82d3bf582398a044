package tech.mediagateway.auth.authentication;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.LinkedHashSet;

/**
 * Grants every user the configured default roles and a placeholder email.
 */
@DefaultBean
@ApplicationScoped
public class ConfiguredUserProfileProvider implements UserProfileProvider {

    @Inject
    AuthConfig authConfig;

    @Override
    public UserProfile profileFor(String userId) {
        return new UserProfile(userId, "user" + userId + "@example.com",
            new LinkedHashSet<>(authConfig.defaultRoles()));
    }
}
