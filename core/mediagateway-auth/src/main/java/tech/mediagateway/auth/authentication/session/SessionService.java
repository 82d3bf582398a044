package tech.mediagateway.auth.authentication.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.store.CredentialKeys;
import tech.mediagateway.auth.store.CredentialStore;
import tech.mediagateway.auth.store.StoredRecordCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks issued refresh tokens and answers revocation queries.
 *
 * <p>Store layout:
 * <ul>
 *   <li>{@code session:{jti}} - the {@link SessionRecord}, expiring with the token</li>
 *   <li>{@code sessions:user:{userId}} - set of the user's session jtis</li>
 *   <li>{@code revoked:{jti}} - revocation marker, expiring when the token would have</li>
 * </ul>
 *
 * <p>Revocation markers only need to outlive the token they revoke; after that the
 * token fails verification as expired anyway.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);
    private static final Duration MIN_MARKER_TTL = Duration.ofSeconds(1);

    @Inject
    CredentialStore store;

    @Inject
    StoredRecordCodec codec;

    @Inject
    Clock clock;

    /**
     * Register a newly issued refresh token.
     *
     * @param deviceLabel optional, may be null
     */
    public SessionRecord createSession(String userId, String jti, String family, String deviceLabel,
                                       Instant expiresAt) {
        Instant now = clock.instant();
        SessionRecord session = new SessionRecord(userId, jti, family, deviceLabel, now, expiresAt);
        Duration ttl = markerTtl(expiresAt);
        store.put(CredentialKeys.session(jti), codec.encode(session), ttl);
        store.addMember(CredentialKeys.userSessions(userId), jti, ttl);
        LOG.debugf("Session created: user=%s jti=%s family=%s", userId, jti, family);
        return session;
    }

    public boolean isRevoked(String jti) {
        return store.get(CredentialKeys.revoked(jti)).isPresent();
    }

    /**
     * Revoke a token id. Idempotent.
     *
     * @param ttl how long to remember the revocation, normally the token's remaining lifetime
     */
    public void revoke(String jti, Duration ttl) {
        store.put(CredentialKeys.revoked(jti), clock.instant().toString(), atLeastMinimum(ttl));
        dropSession(jti);
        LOG.infof("Token revoked: jti=%s", jti);
    }

    /**
     * Revoke a token id only if it is not revoked yet. Exactly one of any number of
     * concurrent callers gets {@code true}.
     */
    public boolean revokeIfActive(String jti, Duration ttl) {
        boolean revoked = store.putIfAbsent(CredentialKeys.revoked(jti), clock.instant().toString(),
            atLeastMinimum(ttl));
        if (revoked) {
            dropSession(jti);
        }
        return revoked;
    }

    /**
     * Revoke every session of a user, except optionally one.
     *
     * @param exceptJti jti to keep, or null to revoke all
     * @return number of sessions revoked by this call
     */
    public int invalidateAllSessions(String userId, String exceptJti) {
        int count = 0;
        for (SessionRecord session : activeSessions(userId)) {
            if (session.jti().equals(exceptJti)) {
                continue;
            }
            if (revokeIfActive(session.jti(), markerTtl(session.expiresAt()))) {
                count++;
            }
        }
        LOG.infof("Invalidated %d sessions for user %s", count, userId);
        return count;
    }

    /**
     * Revoke every session that belongs to a refresh-token family.
     *
     * @return number of sessions revoked by this call
     */
    public int revokeFamily(String userId, String family) {
        if (family == null) {
            return 0;
        }
        int count = 0;
        for (SessionRecord session : activeSessions(userId)) {
            if (family.equals(session.family())
                    && revokeIfActive(session.jti(), markerTtl(session.expiresAt()))) {
                count++;
            }
        }
        LOG.warnf("Revoked token family %s for user %s (%d sessions)", family, userId, count);
        return count;
    }

    /**
     * Sessions of a user that are neither expired nor revoked. Index entries whose
     * session record is gone are pruned.
     */
    public List<SessionRecord> activeSessions(String userId) {
        String indexKey = CredentialKeys.userSessions(userId);
        List<SessionRecord> sessions = new ArrayList<>();
        for (String jti : store.members(indexKey)) {
            Optional<SessionRecord> session = findSession(jti);
            if (session.isEmpty()) {
                store.removeMember(indexKey, jti);
                continue;
            }
            sessions.add(session.get());
        }
        return sessions;
    }

    public Optional<SessionRecord> findSession(String jti) {
        return store.get(CredentialKeys.session(jti))
            .map(json -> codec.decode(json, SessionRecord.class));
    }

    private void dropSession(String jti) {
        Optional<String> raw = store.getAndDelete(CredentialKeys.session(jti));
        raw.map(json -> codec.decode(json, SessionRecord.class))
            .map(SessionRecord::userId)
            .filter(Objects::nonNull)
            .ifPresent(userId -> store.removeMember(CredentialKeys.userSessions(userId), jti));
    }

    private Duration markerTtl(Instant expiresAt) {
        return atLeastMinimum(Duration.between(clock.instant(), expiresAt));
    }

    private static Duration atLeastMinimum(Duration ttl) {
        return ttl.compareTo(MIN_MARKER_TTL) < 0 ? MIN_MARKER_TTL : ttl;
    }
}
