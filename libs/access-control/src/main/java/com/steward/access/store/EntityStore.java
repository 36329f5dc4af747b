package com.steward.access.store;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.ResourceFlags;
import java.util.Optional;

/**
 * Source of users, groups and resources together with their flags.
 *
 * <p>Users are mirrored from the identity provider via {@link #saveUser}. Group and resource
 * flags change only through the mutation engine's flag-setting actions.
 */
public interface EntityStore {

    Optional<AccessUser> findUser(String userId);

    /** Creates or replaces a user record. */
    AccessUser saveUser(AccessUser user);

    Optional<AccessGroup> findGroup(String groupId);

    /** Creates a group with a fresh id. */
    AccessGroup insertGroup(String name, GroupFlags flags);

    AccessGroup updateGroupFlags(String groupId, GroupFlags flags);

    void deleteGroup(String groupId);

    Optional<AccessResource> findResource(String resourceId);

    /** Creates a resource with a fresh id. */
    AccessResource insertResource(String title, ResourceFlags flags);

    AccessResource updateResourceFlags(String resourceId, ResourceFlags flags);

    void deleteResource(String resourceId);
}
