package com.steward.access;

/**
 * Thrown when stored state is found to break an invariant, e.g. an object with no owner or two
 * grants sharing one (subject, object, grantor) key.
 *
 * <p>Only schema or data corruption can cause this. It is not recoverable.
 */
public class AccessIntegrityException extends AccessControlException {

    public AccessIntegrityException(String message) {
        super(message);
    }

    public AccessIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
