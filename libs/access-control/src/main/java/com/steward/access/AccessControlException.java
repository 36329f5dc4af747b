package com.steward.access;

/**
 * Base class of every error raised by the access control engine. Never thrown directly.
 *
 * <p>Subclasses separate the three failure kinds:
 *
 * <ul>
 *   <li>{@link AccessDeniedException}: the request is not permitted; safe to catch
 *   <li>{@link AccessUsageException}: the call itself is malformed; a programming error
 *   <li>{@link AccessIntegrityException}: stored state breaks an invariant; fatal
 * </ul>
 */
public abstract class AccessControlException extends RuntimeException {

    protected AccessControlException(String message) {
        super(message);
    }

    protected AccessControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
