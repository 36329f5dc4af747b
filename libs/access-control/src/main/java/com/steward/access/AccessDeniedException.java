package com.steward.access;

/**
 * Thrown when a request is refused: insufficient privilege, an inactive principal or object, or
 * a removal that would leave a group or resource without an owner.
 *
 * <p>Raised exactly when the paired {@code can*} predicate answers false, so callers may catch it
 * to fall back to a different presentation. It never signals corrupted state.
 */
public class AccessDeniedException extends AccessControlException {

    private final DenialReason reason;

    public AccessDeniedException(DenialReason reason) {
        super("Access denied: " + reason.description());
        this.reason = reason;
    }

    public DenialReason reason() {
        return reason;
    }
}
