package com.steward.access.mutate;

import com.steward.access.AccessDecision;
import com.steward.access.AccessDeniedException;
import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.Privilege;
import com.steward.access.ResourceFlags;
import com.steward.access.authz.AccessRules;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.resolve.PrivilegeResolver;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import com.steward.access.store.TransactionRunner;
import com.steward.observability.AccessMetrics;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only writer of grants and flags.
 *
 * <p>Every action runs in one {@link TransactionRunner} transaction that first locks the target
 * group or resource, then re-evaluates the same {@link AccessRules} rule as the matching {@code
 * AuthorizationEngine} predicate and {@link AccessDecision#enforce() enforces} it. A refused or
 * failed action leaves no partial effect.
 *
 * <p>Sharing upserts the grant keyed by (subject, object, requester). When the requester owns the
 * object or is a superuser, the subject's other grants over the object that are weaker than the
 * new level are removed (owner override).
 *
 * <p>Actions raise {@link AccessDeniedException} exactly when the paired predicate is false, and
 * {@link AccessUsageException} for unknown ids, a non-grantable level or OWNER for a group.
 */
public class MutationEngine {

    private static final Logger log = LoggerFactory.getLogger(MutationEngine.class);

    private final EntityStore entities;
    private final GrantStore grants;
    private final TransactionRunner transactions;
    private final AccessRules rules;
    private final PrivilegeResolver resolver;
    private final GrantAuditLogger audit;
    private final AccessMetrics metrics;
    private final Clock clock;

    public MutationEngine(
            EntityStore entities,
            GrantStore grants,
            TransactionRunner transactions,
            AccessRules rules,
            PrivilegeResolver resolver,
            GrantAuditLogger audit,
            AccessMetrics metrics,
            Clock clock) {
        this.entities = entities;
        this.grants = grants;
        this.transactions = transactions;
        this.rules = rules;
        this.resolver = resolver;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Lifecycle ──

    /** Creates a group with default flags, owned by {@code requester}. */
    public AccessGroup createGroup(AccessUser requester, String name) {
        return perform("create_group", requester, () -> {
            AccessUser creator = rules.currentUser(requester);
            rules.create(creator).enforce();
            AccessGroup group = entities.insertGroup(name, GroupFlags.defaults());
            bootstrapOwner(creator, GrantRelation.USER_GROUP, group.id());
            log.info("Created group {} owned by {}", group.id(), creator.id());
            return group;
        });
    }

    /** Creates a resource with default flags, owned by {@code requester}. */
    public AccessResource createResource(AccessUser requester, String title) {
        return perform("create_resource", requester, () -> {
            AccessUser creator = rules.currentUser(requester);
            rules.create(creator).enforce();
            AccessResource resource = entities.insertResource(title, ResourceFlags.defaults());
            bootstrapOwner(creator, GrantRelation.USER_RESOURCE, resource.id());
            log.info("Created resource {} owned by {}", resource.id(), creator.id());
            return resource;
        });
    }

    /** Deletes the group together with its memberships and every resource grant it holds. */
    public void deleteGroup(AccessUser requester, AccessGroup group) {
        perform("delete_group", requester, () -> {
            AccessGroup current = lock(group);
            rules.administerGroup(requester, current).enforce();
            String actor = requester.id();
            revoke(actor, "delete", GrantFilter.of(GrantRelation.USER_GROUP).object(current.id()));
            revoke(actor, "delete", GrantFilter.of(GrantRelation.GROUP_RESOURCE).subject(current.id()));
            entities.deleteGroup(current.id());
            log.info("Deleted group {} by {}", current.id(), actor);
            return null;
        });
    }

    /** Deletes the resource together with every user and group grant over it. */
    public void deleteResource(AccessUser requester, AccessResource resource) {
        perform("delete_resource", requester, () -> {
            AccessResource current = lock(resource);
            rules.administerResource(requester, current).enforce();
            String actor = requester.id();
            revoke(actor, "delete", GrantFilter.of(GrantRelation.USER_RESOURCE).object(current.id()));
            revoke(actor, "delete", GrantFilter.of(GrantRelation.GROUP_RESOURCE).object(current.id()));
            entities.deleteResource(current.id());
            log.info("Deleted resource {} by {}", current.id(), actor);
            return null;
        });
    }

    // ── Flags ──

    public AccessGroup setGroupFlags(AccessUser requester, AccessGroup group, GroupFlags flags) {
        requireFlags(flags);
        return perform("set_group_flags", requester, () -> {
            AccessGroup current = lock(group);
            rules.administerGroup(requester, current).enforce();
            AccessGroup updated = entities.updateGroupFlags(current.id(), flags);
            log.info("Group {} flags set to {} by {}", current.id(), flags, requester.id());
            return updated;
        });
    }

    public AccessResource setResourceFlags(
            AccessUser requester, AccessResource resource, ResourceFlags flags) {
        requireFlags(flags);
        return perform("set_resource_flags", requester, () -> {
            AccessResource current = lock(resource);
            rules.administerResource(requester, current).enforce();
            AccessResource updated = entities.updateResourceFlags(current.id(), flags);
            log.info("Resource {} flags set to {} by {}", current.id(), flags, requester.id());
            return updated;
        });
    }

    // ── Groups ──

    public Grant shareGroupWithUser(
            AccessUser requester, AccessGroup group, AccessUser grantee, Privilege privilege) {
        return perform("share_group_with_user", requester, () -> {
            AccessGroup current = lock(group);
            rules.shareGroupWithUser(requester, current, grantee, privilege).enforce();
            AccessUser user = rules.currentUser(requester);
            boolean override = user.superuser() || resolver.owns(user, current);
            return upsert(
                    user.id(),
                    new Grant.Key(GrantRelation.USER_GROUP, grantee.id(), current.id(), user.id()),
                    privilege,
                    override);
        });
    }

    /** Removes every grant the member holds over the group. */
    public void unshareGroupWithUser(AccessUser requester, AccessGroup group, AccessUser member) {
        perform("unshare_group_with_user", requester, () -> {
            AccessGroup current = lock(group);
            rules.unshareGroupWithUser(requester, current, member).enforce();
            revoke(
                    requester.id(),
                    "unshare",
                    GrantFilter.of(GrantRelation.USER_GROUP).subject(member.id()).object(current.id()));
            return null;
        });
    }

    /** Removes the grant the requester made to the member. */
    public void undoShareGroupWithUser(AccessUser requester, AccessGroup group, AccessUser member) {
        perform("undo_share_group_with_user", requester, () -> {
            AccessGroup current = lock(group);
            rules.undoShareGroupWithUser(requester, current, member).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(GrantRelation.USER_GROUP, member.id(), current.id(), requester.id()));
            return null;
        });
    }

    /** Removes the grant {@code grantor} made to the member; for owners and superusers. */
    public void undoShareGroupWithUserByGrantor(
            AccessUser requester, AccessGroup group, AccessUser member, AccessUser grantor) {
        perform("undo_share_group_with_user", requester, () -> {
            AccessGroup current = lock(group);
            rules.undoShareGroupWithUserByGrantor(requester, current, member, grantor).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(GrantRelation.USER_GROUP, member.id(), current.id(), grantor.id()));
            return null;
        });
    }

    // ── Resources ──

    public Grant shareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser grantee, Privilege privilege) {
        return perform("share_resource_with_user", requester, () -> {
            AccessResource current = lock(resource);
            rules.shareResourceWithUser(requester, current, grantee, privilege).enforce();
            AccessUser user = rules.currentUser(requester);
            boolean override = user.superuser() || resolver.owns(user, current);
            return upsert(
                    user.id(),
                    new Grant.Key(GrantRelation.USER_RESOURCE, grantee.id(), current.id(), user.id()),
                    privilege,
                    override);
        });
    }

    public Grant shareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group, Privilege privilege) {
        return perform("share_resource_with_group", requester, () -> {
            AccessResource current = lock(resource);
            rules.shareResourceWithGroup(requester, current, group, privilege).enforce();
            AccessUser user = rules.currentUser(requester);
            boolean override = user.superuser() || resolver.owns(user, current);
            return upsert(
                    user.id(),
                    new Grant.Key(GrantRelation.GROUP_RESOURCE, group.id(), current.id(), user.id()),
                    privilege,
                    override);
        });
    }

    public void unshareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser holder) {
        perform("unshare_resource_with_user", requester, () -> {
            AccessResource current = lock(resource);
            rules.unshareResourceWithUser(requester, current, holder).enforce();
            revoke(
                    requester.id(),
                    "unshare",
                    GrantFilter.of(GrantRelation.USER_RESOURCE)
                            .subject(holder.id())
                            .object(current.id()));
            return null;
        });
    }

    public void unshareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group) {
        perform("unshare_resource_with_group", requester, () -> {
            AccessResource current = lock(resource);
            rules.unshareResourceWithGroup(requester, current, group).enforce();
            revoke(
                    requester.id(),
                    "unshare",
                    GrantFilter.of(GrantRelation.GROUP_RESOURCE)
                            .subject(group.id())
                            .object(current.id()));
            return null;
        });
    }

    public void undoShareResourceWithUser(
            AccessUser requester, AccessResource resource, AccessUser holder) {
        perform("undo_share_resource_with_user", requester, () -> {
            AccessResource current = lock(resource);
            rules.undoShareResourceWithUser(requester, current, holder).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(
                            GrantRelation.USER_RESOURCE, holder.id(), current.id(), requester.id()));
            return null;
        });
    }

    public void undoShareResourceWithUserByGrantor(
            AccessUser requester, AccessResource resource, AccessUser holder, AccessUser grantor) {
        perform("undo_share_resource_with_user", requester, () -> {
            AccessResource current = lock(resource);
            rules.undoShareResourceWithUserByGrantor(requester, current, holder, grantor).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(
                            GrantRelation.USER_RESOURCE, holder.id(), current.id(), grantor.id()));
            return null;
        });
    }

    public void undoShareResourceWithGroup(
            AccessUser requester, AccessResource resource, AccessGroup group) {
        perform("undo_share_resource_with_group", requester, () -> {
            AccessResource current = lock(resource);
            rules.undoShareResourceWithGroup(requester, current, group).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(
                            GrantRelation.GROUP_RESOURCE, group.id(), current.id(), requester.id()));
            return null;
        });
    }

    public void undoShareResourceWithGroupByGrantor(
            AccessUser requester, AccessResource resource, AccessGroup group, AccessUser grantor) {
        perform("undo_share_resource_with_group", requester, () -> {
            AccessResource current = lock(resource);
            rules.undoShareResourceWithGroupByGrantor(requester, current, group, grantor).enforce();
            undo(
                    requester.id(),
                    new Grant.Key(
                            GrantRelation.GROUP_RESOURCE, group.id(), current.id(), grantor.id()));
            return null;
        });
    }

    // ── Private Helpers ──

    /**
     * Runs {@code action} in a transaction and records its outcome. Denials are expected traffic
     * and logged at DEBUG only.
     */
    private <T> T perform(String operation, AccessUser requester, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            T result = transactions.inTransaction(action);
            metrics.record(operation, AccessMetrics.Outcome.SUCCESS, System.nanoTime() - start);
            return result;
        } catch (AccessDeniedException e) {
            metrics.record(operation, AccessMetrics.Outcome.DENIED, System.nanoTime() - start);
            log.debug(
                    "Denied {} for user {}: {}",
                    operation,
                    requester == null ? null : requester.id(),
                    e.reason());
            throw e;
        } catch (RuntimeException e) {
            metrics.record(operation, AccessMetrics.Outcome.ERROR, System.nanoTime() - start);
            throw e;
        }
    }

    private AccessGroup lock(AccessGroup group) {
        AccessGroup current = rules.currentGroup(group);
        grants.lockObject(GrantRelation.USER_GROUP, current.id());
        return current;
    }

    private AccessResource lock(AccessResource resource) {
        AccessResource current = rules.currentResource(resource);
        grants.lockObject(GrantRelation.USER_RESOURCE, current.id());
        return current;
    }

    private void bootstrapOwner(AccessUser creator, GrantRelation relation, String objectId) {
        Grant owner =
                grants.insert(
                        new Grant(
                                relation,
                                creator.id(),
                                objectId,
                                creator.id(),
                                Privilege.OWNER,
                                clock.instant()));
        audit.logGrant(creator.id(), owner);
    }

    /**
     * Creates or re-levels the grant under {@code key}; with {@code override}, then drops the
     * subject's weaker grants over the object from any grantor.
     */
    private Grant upsert(String actor, Grant.Key key, Privilege privilege, boolean override) {
        Optional<Grant> existing = grants.find(key);
        Grant result;
        if (existing.isEmpty()) {
            result =
                    grants.insert(
                            new Grant(
                                    key.relation(),
                                    key.subjectId(),
                                    key.objectId(),
                                    key.grantorId(),
                                    privilege,
                                    clock.instant()));
            audit.logGrant(actor, result);
        } else if (existing.get().privilege() != privilege) {
            result = grants.updatePrivilege(key, privilege);
            audit.logRegrant(actor, existing.get(), result);
        } else {
            result = existing.get();
        }

        if (override) {
            revoke(
                    actor,
                    "override",
                    GrantFilter.of(key.relation())
                            .subject(key.subjectId())
                            .object(key.objectId())
                            .weakerThan(privilege));
        }
        return result;
    }

    private void undo(String actor, Grant.Key key) {
        revoke(
                actor,
                "undo",
                GrantFilter.of(key.relation())
                        .subject(key.subjectId())
                        .object(key.objectId())
                        .grantor(key.grantorId()));
    }

    private void revoke(String actor, String action, GrantFilter filter) {
        List<Grant> doomed = grants.findAll(filter);
        if (doomed.isEmpty()) {
            return;
        }
        grants.delete(filter);
        for (Grant grant : doomed) {
            audit.logRevoke(actor, action, grant);
        }
    }

    private static void requireFlags(Object flags) {
        if (flags == null) {
            throw new AccessUsageException("flags must not be null");
        }
    }
}
