package com.steward.access;

/**
 * A group. Membership is not stored here: a member is any user holding a grant over the group.
 *
 * @param id unique group identifier
 * @param name display name
 * @param flags current state flags
 */
public record AccessGroup(String id, String name, GroupFlags flags) {

    public AccessGroup {
        if (id == null || id.isBlank()) {
            throw new AccessUsageException("group id must not be null or blank");
        }
        if (flags == null) {
            flags = GroupFlags.defaults();
        }
    }

    public boolean active() {
        return flags.active();
    }

    public AccessGroup withFlags(GroupFlags flags) {
        return new AccessGroup(id, name, flags);
    }
}
