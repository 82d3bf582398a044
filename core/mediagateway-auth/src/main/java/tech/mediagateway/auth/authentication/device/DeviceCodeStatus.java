package tech.mediagateway.auth.authentication.device;

/**
 * RFC 8628 device authorization states.
 *
 * <p>PENDING moves to APPROVED or DENIED once, or to EXPIRED when its lifetime
 * ends. Nothing moves back to PENDING.
 */
public enum DeviceCodeStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED
}
