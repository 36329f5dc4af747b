package com.steward.access;

/**
 * Thrown for invalid call parameters: unknown users, groups or resources, a privilege that cannot
 * be granted, or a group requested as resource owner.
 *
 * <p>Indicates a defect in the caller. Catching it is not recommended.
 */
public class AccessUsageException extends AccessControlException {

    public AccessUsageException(String message) {
        super(message);
    }
}
