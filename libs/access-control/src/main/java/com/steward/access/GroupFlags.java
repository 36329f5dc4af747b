package com.steward.access;

/**
 * State flags of a group.
 *
 * @param active inactive groups confer no privilege over resources and cannot be owned
 * @param discoverable whether the group description is visible to everyone
 * @param isPublic whether the member list is visible to everyone
 * @param shareable whether members who are not owners may share the group
 */
public record GroupFlags(boolean active, boolean discoverable, boolean isPublic, boolean shareable) {

    /** Flags of a newly created group: everything enabled. */
    public static GroupFlags defaults() {
        return new GroupFlags(true, true, true, true);
    }

    public GroupFlags withActive(boolean active) {
        return new GroupFlags(active, discoverable, isPublic, shareable);
    }

    public GroupFlags withDiscoverable(boolean discoverable) {
        return new GroupFlags(active, discoverable, isPublic, shareable);
    }

    public GroupFlags withPublic(boolean isPublic) {
        return new GroupFlags(active, discoverable, isPublic, shareable);
    }

    public GroupFlags withShareable(boolean shareable) {
        return new GroupFlags(active, discoverable, isPublic, shareable);
    }
}
