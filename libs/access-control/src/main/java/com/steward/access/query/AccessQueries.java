package com.steward.access.query;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Membership, holding and ownership as projections over the grant store.
 *
 * <p>Nothing here is stored separately: a user is a member of a group exactly when some grant
 * over the group names them. Results are distinct and ordered by first grant. These are raw
 * reports over grant records; they do not consult flags or activity except where a method says
 * so, and they are not authorization checks.
 */
public class AccessQueries {

    private final EntityStore entities;
    private final GrantStore grants;

    public AccessQueries(EntityStore entities, GrantStore grants) {
        this.entities = entities;
        this.grants = grants;
    }

    // ── Per user ──

    /** Groups over which the user holds any grant. */
    public List<AccessGroup> heldGroups(AccessUser user) {
        return groups(objects(GrantFilter.of(GrantRelation.USER_GROUP).subject(idOf(user))));
    }

    public int countHeldGroups(AccessUser user) {
        return heldGroups(user).size();
    }

    public List<AccessGroup> ownedGroups(AccessUser user) {
        return groups(
                objects(
                        GrantFilter.of(GrantRelation.USER_GROUP)
                                .subject(idOf(user))
                                .privilege(Privilege.OWNER)));
    }

    public int countOwnedGroups(AccessUser user) {
        return ownedGroups(user).size();
    }

    /** Groups over which the user holds a grant of CHANGE or better. */
    public List<AccessGroup> editableGroups(AccessUser user) {
        return groups(
                objects(
                        GrantFilter.of(GrantRelation.USER_GROUP)
                                .subject(idOf(user))
                                .atLeast(Privilege.CHANGE)));
    }

    /** Resources the user holds directly or through any group they belong to. */
    public List<AccessResource> heldResources(AccessUser user) {
        String userId = idOf(user);
        Set<String> ids = objects(GrantFilter.of(GrantRelation.USER_RESOURCE).subject(userId));
        for (String groupId : objects(GrantFilter.of(GrantRelation.USER_GROUP).subject(userId))) {
            ids.addAll(objects(GrantFilter.of(GrantRelation.GROUP_RESOURCE).subject(groupId)));
        }
        return resources(ids);
    }

    public int countHeldResources(AccessUser user) {
        return heldResources(user).size();
    }

    public List<AccessResource> ownedResources(AccessUser user) {
        return resources(
                objects(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .subject(idOf(user))
                                .privilege(Privilege.OWNER)));
    }

    public int countOwnedResources(AccessUser user) {
        return ownedResources(user).size();
    }

    /** Mutable resources over which the user holds a direct grant of CHANGE or better. */
    public List<AccessResource> editableResources(AccessUser user) {
        List<AccessResource> editable = new ArrayList<>();
        for (AccessResource resource :
                resources(
                        objects(
                                GrantFilter.of(GrantRelation.USER_RESOURCE)
                                        .subject(idOf(user))
                                        .atLeast(Privilege.CHANGE)))) {
            if (!resource.flags().immutable()) {
                editable.add(resource);
            }
        }
        return editable;
    }

    /**
     * Mutable resources whose strongest direct grant to the user is exactly {@code privilege}.
     * Group grants are ignored.
     */
    public List<AccessResource> resourcesWithExplicitPrivilege(
            AccessUser user, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        String userId = idOf(user);
        List<AccessResource> matching = new ArrayList<>();
        for (AccessResource resource :
                resources(
                        objects(
                                GrantFilter.of(GrantRelation.USER_RESOURCE)
                                        .subject(userId)
                                        .privilege(privilege)))) {
            boolean stronger =
                    grants.findAll(
                                    GrantFilter.of(GrantRelation.USER_RESOURCE)
                                            .subject(userId)
                                            .object(resource.id()))
                            .stream()
                            .anyMatch(grant -> grant.privilege().isStrongerThan(privilege));
            if (!stronger && !resource.flags().immutable()) {
                matching.add(resource);
            }
        }
        return matching;
    }

    // ── Per group ──

    public List<AccessUser> members(AccessGroup group) {
        return users(subjects(GrantFilter.of(GrantRelation.USER_GROUP).object(idOf(group))));
    }

    public int countMembers(AccessGroup group) {
        return members(group).size();
    }

    public List<AccessUser> groupOwners(AccessGroup group) {
        return users(
                subjects(
                        GrantFilter.of(GrantRelation.USER_GROUP)
                                .object(idOf(group))
                                .privilege(Privilege.OWNER)));
    }

    /** Distinct owning users; see {@link #countGroupOwnerRecords} for the raw record count. */
    public int countGroupOwners(AccessGroup group) {
        return groupOwners(group).size();
    }

    /** OWNER grant records, which exceed owners when one user was made owner by several grantors. */
    public int countGroupOwnerRecords(AccessGroup group) {
        return grants.count(
                GrantFilter.of(GrantRelation.USER_GROUP)
                        .object(idOf(group))
                        .privilege(Privilege.OWNER));
    }

    public List<AccessResource> groupHeldResources(AccessGroup group) {
        return resources(objects(GrantFilter.of(GrantRelation.GROUP_RESOURCE).subject(idOf(group))));
    }

    public int countGroupHeldResources(AccessGroup group) {
        return groupHeldResources(group).size();
    }

    /** Mutable resources over which the group holds a grant of CHANGE. */
    public List<AccessResource> groupEditableResources(AccessGroup group) {
        List<AccessResource> editable = new ArrayList<>();
        for (AccessResource resource :
                resources(
                        objects(
                                GrantFilter.of(GrantRelation.GROUP_RESOURCE)
                                        .subject(idOf(group))
                                        .atLeast(Privilege.CHANGE)))) {
            if (!resource.flags().immutable()) {
                editable.add(resource);
            }
        }
        return editable;
    }

    // ── Per resource ──

    /** Users with a direct grant over the resource; group access is excluded. */
    public List<AccessUser> holdingUsers(AccessResource resource) {
        return users(subjects(GrantFilter.of(GrantRelation.USER_RESOURCE).object(idOf(resource))));
    }

    public int countHoldingUsers(AccessResource resource) {
        return holdingUsers(resource).size();
    }

    public List<AccessGroup> holdingGroups(AccessResource resource) {
        return groups(subjects(GrantFilter.of(GrantRelation.GROUP_RESOURCE).object(idOf(resource))));
    }

    public int countHoldingGroups(AccessResource resource) {
        return holdingGroups(resource).size();
    }

    /** Users holding some direct grant of VIEW or better. */
    public List<AccessUser> viewUsers(AccessResource resource) {
        return users(
                subjects(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .object(idOf(resource))
                                .atLeast(Privilege.VIEW)));
    }

    public List<AccessUser> editUsers(AccessResource resource) {
        return users(
                subjects(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .object(idOf(resource))
                                .atLeast(Privilege.CHANGE)));
    }

    public List<AccessGroup> viewGroups(AccessResource resource) {
        return groups(
                subjects(
                        GrantFilter.of(GrantRelation.GROUP_RESOURCE)
                                .object(idOf(resource))
                                .atLeast(Privilege.VIEW)));
    }

    public List<AccessGroup> editGroups(AccessResource resource) {
        return groups(
                subjects(
                        GrantFilter.of(GrantRelation.GROUP_RESOURCE)
                                .object(idOf(resource))
                                .atLeast(Privilege.CHANGE)));
    }

    public List<AccessUser> resourceOwners(AccessResource resource) {
        return users(
                subjects(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .object(idOf(resource))
                                .privilege(Privilege.OWNER)));
    }

    public int countResourceOwners(AccessResource resource) {
        return resourceOwners(resource).size();
    }

    public int countResourceOwnerRecords(AccessResource resource) {
        return grants.count(
                GrantFilter.of(GrantRelation.USER_RESOURCE)
                        .object(idOf(resource))
                        .privilege(Privilege.OWNER));
    }

    /** Users holding the resource directly or as a member of a holding group. */
    public List<AccessUser> holders(AccessResource resource) {
        String resourceId = idOf(resource);
        Set<String> ids = subjects(GrantFilter.of(GrantRelation.USER_RESOURCE).object(resourceId));
        for (String groupId : subjects(GrantFilter.of(GrantRelation.GROUP_RESOURCE).object(resourceId))) {
            ids.addAll(subjects(GrantFilter.of(GrantRelation.USER_GROUP).object(groupId)));
        }
        return users(ids);
    }

    public int countHolders(AccessResource resource) {
        return holders(resource).size();
    }

    // ── Private Helpers ──

    private Set<String> subjects(GrantFilter filter) {
        return collect(filter, Grant::subjectId);
    }

    private Set<String> objects(GrantFilter filter) {
        return collect(filter, Grant::objectId);
    }

    private Set<String> collect(GrantFilter filter, Function<Grant, String> id) {
        Set<String> ids = new LinkedHashSet<>();
        for (Grant grant : grants.findAll(filter)) {
            ids.add(id.apply(grant));
        }
        return ids;
    }

    private List<AccessUser> users(Collection<String> ids) {
        List<AccessUser> users = new ArrayList<>(ids.size());
        for (String id : ids) {
            entities.findUser(id).ifPresent(users::add);
        }
        return users;
    }

    private List<AccessGroup> groups(Collection<String> ids) {
        List<AccessGroup> groups = new ArrayList<>(ids.size());
        for (String id : ids) {
            entities.findGroup(id).ifPresent(groups::add);
        }
        return groups;
    }

    private List<AccessResource> resources(Collection<String> ids) {
        List<AccessResource> resources = new ArrayList<>(ids.size());
        for (String id : ids) {
            entities.findResource(id).ifPresent(resources::add);
        }
        return resources;
    }

    private static String idOf(AccessUser user) {
        if (user == null) {
            throw new AccessUsageException("user must not be null");
        }
        return user.id();
    }

    private static String idOf(AccessGroup group) {
        if (group == null) {
            throw new AccessUsageException("group must not be null");
        }
        return group.id();
    }

    private static String idOf(AccessResource resource) {
        if (resource == null) {
            throw new AccessUsageException("resource must not be null");
        }
        return resource.id();
    }
}
