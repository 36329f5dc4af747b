package com.steward.access.authz;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.resolve.PrivilegeResolver;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only answers to "may this user do that?".
 *
 * <p>Use these predicates to decide which controls to offer. They are advisory: the corresponding
 * {@code MutationEngine} action re-evaluates the same {@link AccessRules} rule in its own
 * transaction, and raises {@code AccessDeniedException} exactly when the predicate, evaluated at
 * that moment, would have answered false.
 *
 * <pre>{@code
 * if (authorization.canShareResourceWithUser(me, resource, colleague, Privilege.VIEW)) {
 *     // ...time passes, a form is submitted...
 *     mutations.shareResourceWithUser(me, resource, colleague, Privilege.VIEW);
 * }
 * }</pre>
 *
 * <p>Predicates return false for every "not permitted" outcome. Unknown users, groups or
 * resources, or a privilege that cannot be granted, raise {@code AccessUsageException}.
 */
public class AuthorizationEngine {

    private final EntityStore entities;
    private final GrantStore grants;
    private final PrivilegeResolver resolver;
    private final AccessRules rules;

    public AuthorizationEngine(
            EntityStore entities, GrantStore grants, PrivilegeResolver resolver, AccessRules rules) {
        this.entities = entities;
        this.grants = grants;
        this.resolver = resolver;
        this.rules = rules;
    }

    // ── Privileges ──

    public Privilege combinedPrivilege(AccessUser user, AccessGroup group) {
        return resolver.combinedPrivilege(rules.currentUser(user), rules.currentGroup(group));
    }

    public Privilege combinedPrivilege(AccessUser user, AccessResource resource) {
        return resolver.combinedPrivilege(rules.currentUser(user), rules.currentResource(resource));
    }

    public Privilege effectivePrivilege(AccessUser user, AccessResource resource) {
        return resolver.effectivePrivilege(rules.currentUser(user), rules.currentResource(resource));
    }

    public Privilege groupPrivilege(AccessGroup group, AccessResource resource) {
        return resolver.groupPrivilege(rules.currentGroup(group), rules.currentResource(resource));
    }

    public boolean ownsGroup(AccessUser user, AccessGroup group) {
        return resolver.owns(rules.currentUser(user), rules.currentGroup(group));
    }

    public boolean ownsResource(AccessUser user, AccessResource resource) {
        return resolver.owns(rules.currentUser(user), rules.currentResource(resource));
    }

    // ── Groups ──

    public boolean canCreateGroup(AccessUser user) {
        return rules.create(user).allowed();
    }

    public boolean canViewGroup(AccessUser user, AccessGroup group) {
        return rules.viewGroup(user, group).allowed();
    }

    /** Description and abstract, not the member list. */
    public boolean canViewGroupMetadata(AccessUser user, AccessGroup group) {
        return rules.viewGroupMetadata(user, group).allowed();
    }

    public boolean canChangeGroup(AccessUser user, AccessGroup group) {
        return rules.changeGroup(user, group).allowed();
    }

    public boolean canChangeGroupFlags(AccessUser user, AccessGroup group) {
        return rules.administerGroup(user, group).allowed();
    }

    public boolean canDeleteGroup(AccessUser user, AccessGroup group) {
        return rules.administerGroup(user, group).allowed();
    }

    /** Whether the user may share the group at {@code privilege} with anyone at all. */
    public boolean canShareGroup(AccessUser user, AccessGroup group, Privilege privilege) {
        return rules.shareGroup(user, group, privilege).allowed();
    }

    public boolean canShareGroupWithUser(
            AccessUser user, AccessGroup group, AccessUser grantee, Privilege privilege) {
        return rules.shareGroupWithUser(user, group, grantee, privilege).allowed();
    }

    public boolean canUnshareGroupWithUser(AccessUser user, AccessGroup group, AccessUser member) {
        return rules.unshareGroupWithUser(user, group, member).allowed();
    }

    public boolean canUndoShareGroupWithUser(AccessUser user, AccessGroup group, AccessUser member) {
        return rules.undoShareGroupWithUser(user, group, member).allowed();
    }

    public boolean canUndoShareGroupWithUserByGrantor(
            AccessUser user, AccessGroup group, AccessUser member, AccessUser grantor) {
        return rules.undoShareGroupWithUserByGrantor(user, group, member, grantor).allowed();
    }

    // ── Resources ──

    public boolean canCreateResource(AccessUser user) {
        return rules.create(user).allowed();
    }

    public boolean canViewResource(AccessUser user, AccessResource resource) {
        return rules.viewResource(user, resource).allowed();
    }

    public boolean canViewResourceMetadata(AccessUser user, AccessResource resource) {
        return rules.viewResourceMetadata(user, resource).allowed();
    }

    /** Always false for immutable resources, owners included. */
    public boolean canChangeResource(AccessUser user, AccessResource resource) {
        return rules.changeResource(user, resource).allowed();
    }

    public boolean canChangeResourceFlags(AccessUser user, AccessResource resource) {
        return rules.administerResource(user, resource).allowed();
    }

    public boolean canDeleteResource(AccessUser user, AccessResource resource) {
        return rules.administerResource(user, resource).allowed();
    }

    /** Whether the user may share the resource at {@code privilege} with anyone at all. */
    public boolean canShareResource(AccessUser user, AccessResource resource, Privilege privilege) {
        return rules.shareResource(user, resource, privilege).allowed();
    }

    public boolean canShareResourceWithUser(
            AccessUser user, AccessResource resource, AccessUser grantee, Privilege privilege) {
        return rules.shareResourceWithUser(user, resource, grantee, privilege).allowed();
    }

    public boolean canShareResourceWithGroup(
            AccessUser user, AccessResource resource, AccessGroup group, Privilege privilege) {
        return rules.shareResourceWithGroup(user, resource, group, privilege).allowed();
    }

    public boolean canUnshareResourceWithUser(
            AccessUser user, AccessResource resource, AccessUser holder) {
        return rules.unshareResourceWithUser(user, resource, holder).allowed();
    }

    public boolean canUnshareResourceWithGroup(
            AccessUser user, AccessResource resource, AccessGroup group) {
        return rules.unshareResourceWithGroup(user, resource, group).allowed();
    }

    public boolean canUndoShareResourceWithUser(
            AccessUser user, AccessResource resource, AccessUser holder) {
        return rules.undoShareResourceWithUser(user, resource, holder).allowed();
    }

    public boolean canUndoShareResourceWithUserByGrantor(
            AccessUser user, AccessResource resource, AccessUser holder, AccessUser grantor) {
        return rules.undoShareResourceWithUserByGrantor(user, resource, holder, grantor).allowed();
    }

    public boolean canUndoShareResourceWithGroup(
            AccessUser user, AccessResource resource, AccessGroup group) {
        return rules.undoShareResourceWithGroup(user, resource, group).allowed();
    }

    public boolean canUndoShareResourceWithGroupByGrantor(
            AccessUser user, AccessResource resource, AccessGroup group, AccessUser grantor) {
        return rules.undoShareResourceWithGroupByGrantor(user, resource, group, grantor).allowed();
    }

    // ── Who could I remove? ──
    //
    // Each list is built by evaluating the same rule as the matching predicate for every
    // candidate, so membership in a list and a true predicate always coincide.

    /**
     * Members of the group for whom {@code user} could undo at least one grant: grants the user made
     * personally or, for owners and superusers, grants made by anyone. The sole owner never appears.
     */
    public List<AccessUser> getGroupUndoUsers(AccessUser user, AccessGroup group) {
        AccessUser requester = rules.currentUser(user);
        AccessGroup current = rules.currentGroup(group);
        Set<String> undoable = new LinkedHashSet<>();
        for (Grant grant : grantsOver(GrantRelation.USER_GROUP, current.id())) {
            AccessUser member = userRef(grant.subjectId());
            if (undoable.contains(member.id())) {
                continue;
            }
            boolean allowed =
                    grant.grantorId().equals(requester.id())
                            ? rules.undoShareGroupWithUser(requester, current, member).allowed()
                            : rules.undoShareGroupWithUserByGrantor(
                                            requester, current, member, userRef(grant.grantorId()))
                                    .allowed();
            if (allowed) {
                undoable.add(member.id());
            }
        }
        return usersByIds(undoable);
    }

    /**
     * Members {@code user} could remove from the group entirely: everyone for owners and superusers,
     * only themselves for other members, never the sole owner.
     */
    public List<AccessUser> getGroupUnshareUsers(AccessUser user, AccessGroup group) {
        AccessUser requester = rules.currentUser(user);
        AccessGroup current = rules.currentGroup(group);
        Set<String> removable = new LinkedHashSet<>();
        for (String memberId : subjectsOf(GrantRelation.USER_GROUP, current.id())) {
            if (rules.unshareGroupWithUser(requester, current, userRef(memberId)).allowed()) {
                removable.add(memberId);
            }
        }
        return usersByIds(removable);
    }

    /** Holders of the resource for whom {@code user} could undo at least one direct grant. */
    public List<AccessUser> getResourceUndoUsers(AccessUser user, AccessResource resource) {
        AccessUser requester = rules.currentUser(user);
        AccessResource current = rules.currentResource(resource);
        Set<String> undoable = new LinkedHashSet<>();
        for (Grant grant : grantsOver(GrantRelation.USER_RESOURCE, current.id())) {
            AccessUser holder = userRef(grant.subjectId());
            if (undoable.contains(holder.id())) {
                continue;
            }
            boolean allowed =
                    grant.grantorId().equals(requester.id())
                            ? rules.undoShareResourceWithUser(requester, current, holder).allowed()
                            : rules.undoShareResourceWithUserByGrantor(
                                            requester, current, holder, userRef(grant.grantorId()))
                                    .allowed();
            if (allowed) {
                undoable.add(holder.id());
            }
        }
        return usersByIds(undoable);
    }

    /** Direct holders {@code user} could remove from the resource entirely. */
    public List<AccessUser> getResourceUnshareUsers(AccessUser user, AccessResource resource) {
        AccessUser requester = rules.currentUser(user);
        AccessResource current = rules.currentResource(resource);
        Set<String> removable = new LinkedHashSet<>();
        for (String holderId : subjectsOf(GrantRelation.USER_RESOURCE, current.id())) {
            if (rules.unshareResourceWithUser(requester, current, userRef(holderId)).allowed()) {
                removable.add(holderId);
            }
        }
        return usersByIds(removable);
    }

    /** Groups holding the resource for which {@code user} could undo at least one grant. */
    public List<AccessGroup> getResourceUndoGroups(AccessUser user, AccessResource resource) {
        AccessUser requester = rules.currentUser(user);
        AccessResource current = rules.currentResource(resource);
        Map<String, AccessGroup> undoable = new LinkedHashMap<>();
        for (Grant grant : grantsOver(GrantRelation.GROUP_RESOURCE, current.id())) {
            if (undoable.containsKey(grant.subjectId())) {
                continue;
            }
            AccessGroup group = groupRef(grant.subjectId());
            boolean allowed =
                    grant.grantorId().equals(requester.id())
                            ? rules.undoShareResourceWithGroup(requester, current, group).allowed()
                            : rules.undoShareResourceWithGroupByGrantor(
                                            requester, current, group, userRef(grant.grantorId()))
                                    .allowed();
            if (allowed) {
                undoable.put(group.id(), group);
            }
        }
        return new ArrayList<>(undoable.values());
    }

    /** Groups {@code user} could remove from the resource entirely. */
    public List<AccessGroup> getResourceUnshareGroups(AccessUser user, AccessResource resource) {
        AccessUser requester = rules.currentUser(user);
        AccessResource current = rules.currentResource(resource);
        List<AccessGroup> removable = new ArrayList<>();
        for (String groupId : subjectsOf(GrantRelation.GROUP_RESOURCE, current.id())) {
            AccessGroup group = groupRef(groupId);
            if (rules.unshareResourceWithGroup(requester, current, group).allowed()) {
                removable.add(group);
            }
        }
        return removable;
    }

    // ── Private Helpers ──

    private List<Grant> grantsOver(GrantRelation relation, String objectId) {
        return grants.findAll(GrantFilter.of(relation).object(objectId));
    }

    private Set<String> subjectsOf(GrantRelation relation, String objectId) {
        Set<String> subjects = new LinkedHashSet<>();
        for (Grant grant : grantsOver(relation, objectId)) {
            subjects.add(grant.subjectId());
        }
        return subjects;
    }

    private AccessUser userRef(String userId) {
        return rules.currentUser(AccessUser.of(userId));
    }

    private AccessGroup groupRef(String groupId) {
        return rules.currentGroup(new AccessGroup(groupId, null, null));
    }

    private List<AccessUser> usersByIds(Set<String> ids) {
        List<AccessUser> users = new ArrayList<>(ids.size());
        for (String id : ids) {
            entities.findUser(id).ifPresent(users::add);
        }
        return users;
    }
}
