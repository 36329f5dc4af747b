package com.steward.access.resolve;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.Privilege;
import com.steward.access.ResourceFlags;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;

/**
 * Computes the privilege a principal holds over a group or resource.
 *
 * <ul>
 *   <li><b>combined</b> privilege: the strongest of all direct grants and, for resources, all
 *       grants to active groups the user belongs to
 *   <li><b>effective</b> privilege: combined privilege adjusted by the resource's
 *       {@code immutable} and {@code public} flags
 * </ul>
 *
 * <p>All methods are read-only and take the entity state they are given at face value; callers
 * pass records freshly read from the {@link EntityStore}.
 */
public class PrivilegeResolver {

    private final EntityStore entities;
    private final GrantStore grants;

    public PrivilegeResolver(EntityStore entities, GrantStore grants) {
        this.entities = entities;
        this.grants = grants;
    }

    /**
     * Privilege of a user over a group: the strongest of the user's grants over it.
     *
     * <p>Superusers resolve to {@link Privilege#OWNER}; inactive users to {@link Privilege#NONE}.
     */
    public Privilege combinedPrivilege(AccessUser user, AccessGroup group) {
        if (user.superuser()) {
            return Privilege.OWNER;
        }
        if (!user.active()) {
            return Privilege.NONE;
        }
        return strongestOf(GrantFilter.of(GrantRelation.USER_GROUP).subject(user.id()).object(group.id()));
    }

    /**
     * Privilege of a user over a resource: the strongest of the user's direct grants and the grants
     * held by every active group the user is a member of.
     *
     * <p>Superusers resolve to {@link Privilege#OWNER}; inactive users to {@link Privilege#NONE}.
     */
    public Privilege combinedPrivilege(AccessUser user, AccessResource resource) {
        if (user.superuser()) {
            return Privilege.OWNER;
        }
        if (!user.active()) {
            return Privilege.NONE;
        }
        Privilege direct =
                strongestOf(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .subject(user.id())
                                .object(resource.id()));
        Privilege viaGroups = Privilege.NONE;
        for (Grant grant :
                grants.findAll(GrantFilter.of(GrantRelation.GROUP_RESOURCE).object(resource.id()))) {
            if (grant.privilege().isStrongerThan(viaGroups)
                    && isActiveGroup(grant.subjectId())
                    && isMember(user.id(), grant.subjectId())) {
                viaGroups = Privilege.strongest(viaGroups, grant.privilege());
            }
        }
        return Privilege.strongest(direct, viaGroups);
    }

    /**
     * Privilege a group holds over a resource; {@link Privilege#NONE} when the group is inactive.
     */
    public Privilege groupPrivilege(AccessGroup group, AccessResource resource) {
        if (!group.active()) {
            return Privilege.NONE;
        }
        return strongestOf(
                GrantFilter.of(GrantRelation.GROUP_RESOURCE).subject(group.id()).object(resource.id()));
    }

    /** Combined privilege adjusted by the resource's flags; see {@link #applyFlags}. */
    public Privilege effectivePrivilege(AccessUser user, AccessResource resource) {
        return applyFlags(combinedPrivilege(user, resource), resource.flags());
    }

    /**
     * Adjusts a combined privilege for resource flags.
     *
     * <ul>
     *   <li>{@code immutable}: never better than VIEW, i.e. {@code weakest(p, VIEW)}
     *   <li>{@code public}: never worse than VIEW, i.e. {@code strongest(p, VIEW)}
     * </ul>
     *
     * <p>The order is immaterial. With both flags set the two bounds meet and every input,
     * OWNER through NONE, comes out as exactly VIEW.
     */
    public static Privilege applyFlags(Privilege combined, ResourceFlags flags) {
        Privilege result = combined;
        if (flags.immutable()) {
            result = Privilege.weakest(result, Privilege.VIEW);
        }
        if (flags.isPublic()) {
            result = Privilege.strongest(result, Privilege.VIEW);
        }
        return result;
    }

    /** Whether an active user holds a direct OWNER grant over an active group. */
    public boolean owns(AccessUser user, AccessGroup group) {
        return user.active()
                && group.active()
                && grants.exists(
                        GrantFilter.of(GrantRelation.USER_GROUP)
                                .subject(user.id())
                                .object(group.id())
                                .privilege(Privilege.OWNER));
    }

    /** Whether an active user holds a direct OWNER grant over an active resource. */
    public boolean owns(AccessUser user, AccessResource resource) {
        return user.active()
                && resource.active()
                && grants.exists(
                        GrantFilter.of(GrantRelation.USER_RESOURCE)
                                .subject(user.id())
                                .object(resource.id())
                                .privilege(Privilege.OWNER));
    }

    /** Whether the user holds any grant over the group. */
    public boolean isMember(String userId, String groupId) {
        return grants.exists(GrantFilter.of(GrantRelation.USER_GROUP).subject(userId).object(groupId));
    }

    // ── Private Helpers ──

    private Privilege strongestOf(GrantFilter filter) {
        Privilege strongest = Privilege.NONE;
        for (Grant grant : grants.findAll(filter)) {
            strongest = Privilege.strongest(strongest, grant.privilege());
        }
        return strongest;
    }

    private boolean isActiveGroup(String groupId) {
        return entities.findGroup(groupId).map(AccessGroup::active).orElse(false);
    }
}
