package com.steward.access;

/**
 * A user principal as supplied by the identity provider.
 *
 * @param id unique user identifier
 * @param active inactive users can neither act nor be granted anything
 * @param superuser superusers resolve to {@link Privilege#OWNER} over everything
 */
public record AccessUser(String id, boolean active, boolean superuser) {

    public AccessUser {
        if (id == null || id.isBlank()) {
            throw new AccessUsageException("user id must not be null or blank");
        }
    }

    /** Creates an active, non-superuser user. */
    public static AccessUser of(String id) {
        return new AccessUser(id, true, false);
    }

    public AccessUser withActive(boolean active) {
        return new AccessUser(id, active, superuser);
    }

    public AccessUser withSuperuser(boolean superuser) {
        return new AccessUser(id, active, superuser);
    }
}
