package com.steward.access.memory;

import com.steward.access.AccessGroup;
import com.steward.access.AccessIntegrityException;
import com.steward.access.AccessResource;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.Privilege;
import com.steward.access.ResourceFlags;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import com.steward.access.store.TransactionRunner;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entity, grant and transaction store held entirely in memory.
 *
 * <p>One {@link ReentrantLock} guards all state, so a transaction is serializable against every
 * other transaction and every read. A transaction snapshots the state on entry and restores it if
 * the work throws. {@link #lockObject} is satisfied by the store-wide lock.
 *
 * <p>Suited to tests and to embedding applications that keep access state in process.
 */
public class InMemoryAccessStore implements EntityStore, GrantStore, TransactionRunner {

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    private State state = new State();

    public InMemoryAccessStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAccessStore(Clock clock) {
        this.clock = clock;
    }

    // ── TransactionRunner ──

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                // nested: join the outer transaction
                return work.get();
            }
            State snapshot = state.copy();
            try {
                return work.get();
            } catch (RuntimeException | Error e) {
                state = snapshot;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    // ── GrantStore ──

    @Override
    public Optional<Grant> find(Grant.Key key) {
        return locked(() -> Optional.ofNullable(state.grants.get(key)));
    }

    @Override
    public List<Grant> findAll(GrantFilter filter) {
        return locked(() -> state.grants.values().stream().filter(filter::matches).toList());
    }

    @Override
    public Grant insert(Grant grant) {
        return locked(
                () -> {
                    if (state.grants.containsKey(grant.key())) {
                        throw new AccessIntegrityException("Duplicate grant: " + grant.key());
                    }
                    state.grants.put(grant.key(), grant);
                    return grant;
                });
    }

    @Override
    public Grant updatePrivilege(Grant.Key key, Privilege privilege) {
        return locked(
                () -> {
                    Grant existing = state.grants.get(key);
                    if (existing == null) {
                        throw new AccessIntegrityException("No grant to update: " + key);
                    }
                    Grant updated = existing.withPrivilege(privilege, now());
                    state.grants.put(key, updated);
                    return updated;
                });
    }

    @Override
    public int delete(GrantFilter filter) {
        return locked(
                () -> {
                    int before = state.grants.size();
                    state.grants.values().removeIf(filter::matches);
                    return before - state.grants.size();
                });
    }

    @Override
    public void lockObject(GrantRelation relation, String objectId) {
        // the store-wide lock already serializes every transaction
    }

    // ── EntityStore ──

    @Override
    public Optional<AccessUser> findUser(String userId) {
        return locked(() -> Optional.ofNullable(state.users.get(userId)));
    }

    @Override
    public AccessUser saveUser(AccessUser user) {
        return locked(
                () -> {
                    state.users.put(user.id(), user);
                    return user;
                });
    }

    @Override
    public Optional<AccessGroup> findGroup(String groupId) {
        return locked(() -> Optional.ofNullable(state.groups.get(groupId)));
    }

    @Override
    public AccessGroup insertGroup(String name, GroupFlags flags) {
        return locked(
                () -> {
                    AccessGroup group = new AccessGroup(newId(), name, flags);
                    state.groups.put(group.id(), group);
                    return group;
                });
    }

    @Override
    public AccessGroup updateGroupFlags(String groupId, GroupFlags flags) {
        return locked(
                () -> {
                    AccessGroup group = state.groups.get(groupId);
                    if (group == null) {
                        throw new AccessUsageException("Unknown group: " + groupId);
                    }
                    AccessGroup updated = group.withFlags(flags);
                    state.groups.put(groupId, updated);
                    return updated;
                });
    }

    @Override
    public void deleteGroup(String groupId) {
        locked(() -> state.groups.remove(groupId));
    }

    @Override
    public Optional<AccessResource> findResource(String resourceId) {
        return locked(() -> Optional.ofNullable(state.resources.get(resourceId)));
    }

    @Override
    public AccessResource insertResource(String title, ResourceFlags flags) {
        return locked(
                () -> {
                    AccessResource resource = new AccessResource(newId(), title, flags);
                    state.resources.put(resource.id(), resource);
                    return resource;
                });
    }

    @Override
    public AccessResource updateResourceFlags(String resourceId, ResourceFlags flags) {
        return locked(
                () -> {
                    AccessResource resource = state.resources.get(resourceId);
                    if (resource == null) {
                        throw new AccessUsageException("Unknown resource: " + resourceId);
                    }
                    AccessResource updated = resource.withFlags(flags);
                    state.resources.put(resourceId, updated);
                    return updated;
                });
    }

    @Override
    public void deleteResource(String resourceId) {
        locked(() -> state.resources.remove(resourceId));
    }

    /** Current time according to this store's clock; used for grant timestamps. */
    public Instant now() {
        return clock.instant();
    }

    // ── Private Helpers ──

    private <T> T locked(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static final class State {
        final Map<String, AccessUser> users = new LinkedHashMap<>();
        final Map<String, AccessGroup> groups = new LinkedHashMap<>();
        final Map<String, AccessResource> resources = new LinkedHashMap<>();
        final Map<Grant.Key, Grant> grants = new LinkedHashMap<>();

        State copy() {
            State copy = new State();
            copy.users.putAll(users);
            copy.groups.putAll(groups);
            copy.resources.putAll(resources);
            copy.grants.putAll(grants);
            return copy;
        }
    }
}
