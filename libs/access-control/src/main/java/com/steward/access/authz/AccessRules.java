package com.steward.access.authz;

import static com.steward.access.AccessDecision.allow;
import static com.steward.access.AccessDecision.allowIf;
import static com.steward.access.AccessDecision.deny;

import com.steward.access.AccessDecision;
import com.steward.access.AccessGroup;
import com.steward.access.AccessIntegrityException;
import com.steward.access.AccessResource;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.DenialReason;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.resolve.PrivilegeResolver;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import java.util.Optional;

/**
 * Every authorization rule of the access control system, each written exactly once.
 *
 * <p>A rule re-reads the users, groups and resources it is given from the {@link EntityStore},
 * evaluates against the current grants, and returns an {@link AccessDecision}. The {@code can*}
 * predicates of {@link AuthorizationEngine} report {@link AccessDecision#allowed()}; the actions
 * of {@code MutationEngine} evaluate the same rule inside their transaction and {@link
 * AccessDecision#enforce() enforce} it. A predicate and its action therefore cannot disagree.
 *
 * <p>Malformed input (unknown ids, a non-grantable privilege, OWNER for a group) raises {@link
 * AccessUsageException} from the rule itself, identically for predicate and action.
 */
public class AccessRules {

    private final EntityStore entities;
    private final GrantStore grants;
    private final PrivilegeResolver resolver;

    public AccessRules(EntityStore entities, GrantStore grants, PrivilegeResolver resolver) {
        this.entities = entities;
        this.grants = grants;
        this.resolver = resolver;
    }

    // ── Current state ──

    /**
     * Reads the stored state of a user.
     *
     * @throws AccessUsageException if the user is null or unknown
     */
    public AccessUser currentUser(AccessUser user) {
        if (user == null) {
            throw new AccessUsageException("user must not be null");
        }
        return entities.findUser(user.id())
                .orElseThrow(() -> new AccessUsageException("Unknown user: " + user.id()));
    }

    /**
     * Reads the stored state of a group.
     *
     * @throws AccessUsageException if the group is null or unknown
     */
    public AccessGroup currentGroup(AccessGroup group) {
        if (group == null) {
            throw new AccessUsageException("group must not be null");
        }
        return entities.findGroup(group.id())
                .orElseThrow(() -> new AccessUsageException("Unknown group: " + group.id()));
    }

    /**
     * Reads the stored state of a resource.
     *
     * @throws AccessUsageException if the resource is null or unknown
     */
    public AccessResource currentResource(AccessResource resource) {
        if (resource == null) {
            throw new AccessUsageException("resource must not be null");
        }
        return entities.findResource(resource.id())
                .orElseThrow(() -> new AccessUsageException("Unknown resource: " + resource.id()));
    }

    // ── Lifecycle ──

    /** Any active user may create a group or a resource. */
    public AccessDecision create(AccessUser requester) {
        return allowIf(currentUser(requester).active(), DenialReason.INACTIVE_REQUESTER);
    }

    // ── Groups: view, change, flags ──

    public AccessDecision viewGroup(AccessUser requester, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        return viewGroupAs(user, current);
    }

    public AccessDecision viewGroupMetadata(AccessUser requester, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (current.flags().discoverable() || current.flags().isPublic()) {
            return allow();
        }
        return viewGroupAs(user, current);
    }

    public AccessDecision changeGroup(AccessUser requester, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!current.active()) {
            return deny(DenialReason.INACTIVE_OBJECT);
        }
        return allowIf(
                resolver.combinedPrivilege(user, current).isAtLeast(Privilege.CHANGE),
                DenialReason.INSUFFICIENT_PRIVILEGE);
    }

    /** Flag changes and deletion both require ownership or superuser. */
    public AccessDecision administerGroup(AccessUser requester, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return allowIf(user.superuser() || resolver.owns(user, current), DenialReason.NOT_OWNER);
    }

    // ── Groups: sharing ──

    /**
     * Whether the requester may share the group at {@code privilege} with someone, independent of
     * whom.
     */
    public AccessDecision shareGroup(AccessUser requester, AccessGroup group, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        return shareGroupAuthority(currentUser(requester), currentGroup(group), privilege);
    }

    public AccessDecision shareGroupWithUser(
            AccessUser requester, AccessGroup group, AccessUser grantee, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        AccessUser target = currentUser(grantee);

        AccessDecision authority = shareGroupAuthority(user, current, privilege);
        if (authority.denied()) {
            return authority;
        }
        if (!target.active()) {
            return deny(DenialReason.INACTIVE_GRANTEE);
        }
        return keepsAnOwnerAfterRegrant(
                new Grant.Key(GrantRelation.USER_GROUP, target.id(), current.id(), user.id()),
                privilege);
    }

    /**
     * Removal of every grant the user holds over the group. Allowed for superusers, group owners,
     * and users removing themselves, unless the user is the group's sole owner. Removing a user
     * who holds nothing is allowed and has no effect.
     */
    public AccessDecision unshareGroupWithUser(
            AccessUser requester, AccessGroup group, AccessUser member) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        AccessUser target = currentUser(member);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!user.superuser()
                && !resolver.owns(user, current)
                && !user.id().equals(target.id())) {
            return deny(DenialReason.INSUFFICIENT_UNSHARE_PRIVILEGE);
        }
        return keepsAnOwnerWithoutSubject(GrantRelation.USER_GROUP, current.id(), target.id());
    }

    /** Removal of the single grant the requester made to the user over the group. */
    public AccessDecision undoShareGroupWithUser(
            AccessUser requester, AccessGroup group, AccessUser member) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        AccessUser target = currentUser(member);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return undoable(new Grant.Key(GrantRelation.USER_GROUP, target.id(), current.id(), user.id()));
    }

    /**
     * Removal, by an owner or superuser, of the single grant {@code grantor} made to the user over
     * the group.
     */
    public AccessDecision undoShareGroupWithUserByGrantor(
            AccessUser requester, AccessGroup group, AccessUser member, AccessUser grantor) {
        AccessUser user = currentUser(requester);
        AccessGroup current = currentGroup(group);
        AccessUser target = currentUser(member);
        AccessUser originalGrantor = currentUser(grantor);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!user.superuser() && !resolver.owns(user, current)) {
            return deny(DenialReason.NOT_OWNER);
        }
        return undoable(
                new Grant.Key(
                        GrantRelation.USER_GROUP, target.id(), current.id(), originalGrantor.id()));
    }

    // ── Resources: view, change, flags ──

    public AccessDecision viewResource(AccessUser requester, AccessResource resource) {
        return viewResourceAs(currentUser(requester), currentResource(resource));
    }

    public AccessDecision viewResourceMetadata(AccessUser requester, AccessResource resource) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (current.flags().discoverable() || current.flags().isPublic()) {
            return allow();
        }
        return viewResourceAs(user, current);
    }

    public AccessDecision changeResource(AccessUser requester, AccessResource resource) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (current.flags().immutable()) {
            return deny(DenialReason.IMMUTABLE);
        }
        return allowIf(
                resolver.effectivePrivilege(user, current).isAtLeast(Privilege.CHANGE),
                DenialReason.INSUFFICIENT_PRIVILEGE);
    }

    /** Flag changes and deletion both require ownership or superuser. */
    public AccessDecision administerResource(AccessUser requester, AccessResource resource) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return allowIf(user.superuser() || resolver.owns(user, current), DenialReason.NOT_OWNER);
    }

    // ── Resources: sharing with users ──

    /**
     * Whether the requester may share the resource at {@code privilege} with someone, independent
     * of whom.
     */
    public AccessDecision shareResource(
            AccessUser requester, AccessResource resource, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        return shareResourceAuthority(currentUser(requester), currentResource(resource), privilege);
    }

    public AccessDecision shareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser grantee, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessUser target = currentUser(grantee);

        AccessDecision authority = shareResourceAuthority(user, current, privilege);
        if (authority.denied()) {
            return authority;
        }
        if (!target.active()) {
            return deny(DenialReason.INACTIVE_GRANTEE);
        }
        if (!user.superuser()
                && resolver.combinedPrivilege(user, current) != Privilege.OWNER
                && holdsStrongerGrantFromOthers(target, current, user, privilege)) {
            return deny(DenialReason.INSUFFICIENT_PRIVILEGE);
        }
        return keepsAnOwnerAfterRegrant(
                new Grant.Key(GrantRelation.USER_RESOURCE, target.id(), current.id(), user.id()),
                privilege);
    }

    /**
     * Removal of every grant the user holds over the resource. Allowed for superusers, resource
     * owners, and users removing themselves, unless the user is the resource's sole owner.
     */
    public AccessDecision unshareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser holder) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessUser target = currentUser(holder);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!user.superuser()
                && !resolver.owns(user, current)
                && !user.id().equals(target.id())) {
            return deny(DenialReason.INSUFFICIENT_UNSHARE_PRIVILEGE);
        }
        return keepsAnOwnerWithoutSubject(GrantRelation.USER_RESOURCE, current.id(), target.id());
    }

    public AccessDecision undoShareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser holder) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessUser target = currentUser(holder);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return undoable(
                new Grant.Key(GrantRelation.USER_RESOURCE, target.id(), current.id(), user.id()));
    }

    public AccessDecision undoShareResourceWithUserByGrantor(
            AccessUser requester, AccessResource resource, AccessUser holder, AccessUser grantor) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessUser target = currentUser(holder);
        AccessUser originalGrantor = currentUser(grantor);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!user.superuser() && !resolver.owns(user, current)) {
            return deny(DenialReason.NOT_OWNER);
        }
        return undoable(
                new Grant.Key(
                        GrantRelation.USER_RESOURCE,
                        target.id(),
                        current.id(),
                        originalGrantor.id()));
    }

    // ── Resources: sharing with groups ──

    /**
     * Sharing a resource with a group: the requester must be able to share the resource at that
     * level and, unless superuser, be a member of the group.
     *
     * @throws AccessUsageException if {@code privilege} is OWNER; groups never own resources
     */
    public AccessDecision shareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group, Privilege privilege) {
        requireGroupGrantable(privilege);
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessGroup grantee = currentGroup(group);

        AccessDecision authority = shareResourceAuthority(user, current, privilege);
        if (authority.denied()) {
            return authority;
        }
        if (!grantee.active()) {
            return deny(DenialReason.INACTIVE_GRANTEE);
        }
        return allowIf(
                user.superuser() || resolver.isMember(user.id(), grantee.id()),
                DenialReason.NOT_A_MEMBER);
    }

    /**
     * Removal of every grant the group holds over the resource. Allowed for superusers, resource
     * owners and group owners. Groups never own resources, so no owner check applies.
     */
    public AccessDecision unshareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessGroup grantee = currentGroup(group);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return allowIf(
                user.superuser() || resolver.owns(user, current) || resolver.owns(user, grantee),
                DenialReason.INSUFFICIENT_UNSHARE_PRIVILEGE);
    }

    public AccessDecision undoShareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessGroup grantee = currentGroup(group);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return undoable(
                new Grant.Key(GrantRelation.GROUP_RESOURCE, grantee.id(), current.id(), user.id()));
    }

    public AccessDecision undoShareResourceWithGroupByGrantor(
            AccessUser requester, AccessResource resource, AccessGroup group, AccessUser grantor) {
        AccessUser user = currentUser(requester);
        AccessResource current = currentResource(resource);
        AccessGroup grantee = currentGroup(group);
        AccessUser originalGrantor = currentUser(grantor);
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (!user.superuser() && !resolver.owns(user, current)) {
            return deny(DenialReason.NOT_OWNER);
        }
        return undoable(
                new Grant.Key(
                        GrantRelation.GROUP_RESOURCE,
                        grantee.id(),
                        current.id(),
                        originalGrantor.id()));
    }

    // ── Private Helpers ──

    private AccessDecision viewGroupAs(AccessUser user, AccessGroup group) {
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (user.superuser() || group.flags().isPublic()) {
            return allow();
        }
        return allowIf(
                resolver.combinedPrivilege(user, group).isAtLeast(Privilege.VIEW),
                DenialReason.NO_PRIVILEGE);
    }

    /** A non-owner may not offer a weaker level to someone another grantor already gave more. */
    private boolean holdsStrongerGrantFromOthers(
            AccessUser grantee, AccessResource resource, AccessUser grantor, Privilege privilege) {
        return grants.findAll(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .subject(grantee.id())
                                .object(resource.id()))
                .stream()
                .anyMatch(grant -> grant.privilege().isStrongerThan(privilege)
                        && !grant.grantorId().equals(grantor.id()));
    }

    private AccessDecision viewResourceAs(AccessUser user, AccessResource resource) {
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        return allowIf(
                resolver.effectivePrivilege(user, resource).isAtLeast(Privilege.VIEW),
                DenialReason.NO_PRIVILEGE);
    }

    /**
     * Superusers may share at any level. Everyone else needs an active group, ownership or a
     * shareable group, membership, and a privilege at least as strong as the one granted.
     */
    private AccessDecision shareGroupAuthority(
            AccessUser user, AccessGroup group, Privilege privilege) {
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (user.superuser()) {
            return allow();
        }
        if (!group.active()) {
            return deny(DenialReason.INACTIVE_OBJECT);
        }
        if (!resolver.owns(user, group) && !group.flags().shareable()) {
            return deny(DenialReason.NOT_SHAREABLE);
        }
        return sufficientToGrant(resolver.combinedPrivilege(user, group), privilege);
    }

    private AccessDecision shareResourceAuthority(
            AccessUser user, AccessResource resource, Privilege privilege) {
        if (!user.active()) {
            return deny(DenialReason.INACTIVE_REQUESTER);
        }
        if (user.superuser()) {
            return allow();
        }
        if (!resource.active()) {
            return deny(DenialReason.INACTIVE_OBJECT);
        }
        Privilege own = resolver.combinedPrivilege(user, resource);
        if (own != Privilege.OWNER && !resource.flags().shareable()) {
            return deny(DenialReason.NOT_SHAREABLE);
        }
        return sufficientToGrant(own, privilege);
    }

    private static AccessDecision sufficientToGrant(Privilege own, Privilege privilege) {
        if (!own.isAtLeast(Privilege.VIEW)) {
            return deny(DenialReason.NO_PRIVILEGE);
        }
        return allowIf(own.isAtLeast(privilege), DenialReason.INSUFFICIENT_PRIVILEGE);
    }

    /** Re-granting may not turn the last OWNER grant into something weaker. */
    private AccessDecision keepsAnOwnerAfterRegrant(Grant.Key key, Privilege privilege) {
        Optional<Grant> existing = grants.find(key);
        if (existing.isEmpty()
                || existing.get().privilege() != Privilege.OWNER
                || privilege == Privilege.OWNER) {
            return allow();
        }
        return allowIf(hasOwnerGrantOtherThan(key), DenialReason.SOLE_OWNER);
    }

    /** Removing every grant of {@code subjectId} must leave some other owner in place. */
    private AccessDecision keepsAnOwnerWithoutSubject(
            GrantRelation relation, String objectId, String subjectId) {
        requireOwned(relation, objectId);
        return allowIf(
                grants.exists(
                        GrantFilter.of(relation)
                                .object(objectId)
                                .privilege(Privilege.OWNER)
                                .excludingSubject(subjectId)),
                DenialReason.SOLE_OWNER);
    }

    /** The grant must exist, and removing it must not remove the last OWNER grant. */
    private AccessDecision undoable(Grant.Key key) {
        Optional<Grant> existing = grants.find(key);
        if (existing.isEmpty()) {
            return deny(DenialReason.NOTHING_TO_UNDO);
        }
        if (existing.get().privilege() != Privilege.OWNER) {
            return allow();
        }
        return allowIf(hasOwnerGrantOtherThan(key), DenialReason.SOLE_OWNER);
    }

    private boolean hasOwnerGrantOtherThan(Grant.Key key) {
        requireOwned(key.relation(), key.objectId());
        return grants.findAll(GrantFilter.of(key.relation()).object(key.objectId()).privilege(Privilege.OWNER))
                .stream()
                .anyMatch(grant -> !grant.key().equals(key));
    }

    private void requireOwned(GrantRelation relation, String objectId) {
        if (!grants.exists(GrantFilter.of(relation).object(objectId).privilege(Privilege.OWNER))) {
            throw new AccessIntegrityException(
                    "No owner found for " + relation.objectKind().name().toLowerCase() + " " + objectId);
        }
    }

    private static void requireGroupGrantable(Privilege privilege) {
        Privilege.requireGrantable(privilege);
        if (privilege == Privilege.OWNER) {
            throw new AccessUsageException("Groups cannot own resources");
        }
    }
}
