package com.steward.access.testing;

import com.steward.access.AccessControl;
import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.ResourceFlags;
import com.steward.access.memory.InMemoryAccessStore;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import com.steward.access.store.TransactionRunner;
import com.steward.observability.AccessMetrics;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds users, groups and resources for tests.
 *
 * <p>Placed in {@code src/main/java} so modules that store access state elsewhere can reuse it in
 * their test scope. Groups and resources are created through the mutation engine, so each starts
 * with its creator's bootstrap OWNER grant. Flag helpers write straight to the entity store and
 * skip authorization.
 */
public final class AccessFixtures {

    /** Fixed instant all fixture clocks report. */
    public static final Instant FIXED_INSTANT = Instant.parse("2024-01-01T00:00:00Z");

    private final EntityStore entities;
    private final GrantStore grants;
    private final AccessControl access;
    private final AtomicInteger sequence = new AtomicInteger();

    private AccessFixtures(EntityStore entities, GrantStore grants, AccessControl access) {
        this.entities = entities;
        this.grants = grants;
        this.access = access;
    }

    /** Fixtures over a fresh in-memory store and a fixed clock. */
    public static AccessFixtures inMemory() {
        InMemoryAccessStore store = new InMemoryAccessStore(fixedClock());
        return over(store, store, store, AccessMetrics.noop());
    }

    /** Fixtures over caller-supplied stores, e.g. a JDBC store backed by H2. */
    public static AccessFixtures over(
            EntityStore entities,
            GrantStore grants,
            TransactionRunner transactions,
            AccessMetrics metrics) {
        return new AccessFixtures(
                entities,
                grants,
                AccessControl.create(entities, grants, transactions, metrics, fixedClock()));
    }

    public static Clock fixedClock() {
        return Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);
    }

    public AccessUser user(String id) {
        return entities.saveUser(AccessUser.of(id));
    }

    public AccessUser superuser(String id) {
        return entities.saveUser(AccessUser.of(id).withSuperuser(true));
    }

    public AccessUser inactiveUser(String id) {
        return entities.saveUser(AccessUser.of(id).withActive(false));
    }

    /** Stores the user's new state and returns it. */
    public AccessUser update(AccessUser user) {
        return entities.saveUser(user);
    }

    public AccessGroup group(AccessUser owner) {
        return access.mutations().createGroup(owner, "group-" + sequence.incrementAndGet());
    }

    public AccessGroup group(AccessUser owner, GroupFlags flags) {
        return flags(group(owner), flags);
    }

    public AccessResource resource(AccessUser owner) {
        return access.mutations().createResource(owner, "resource-" + sequence.incrementAndGet());
    }

    public AccessResource resource(AccessUser owner, ResourceFlags flags) {
        return flags(resource(owner), flags);
    }

    public AccessGroup flags(AccessGroup group, GroupFlags flags) {
        return entities.updateGroupFlags(group.id(), flags);
    }

    public AccessResource flags(AccessResource resource, ResourceFlags flags) {
        return entities.updateResourceFlags(resource.id(), flags);
    }

    public AccessControl access() {
        return access;
    }

    public EntityStore entities() {
        return entities;
    }

    public GrantStore grants() {
        return grants;
    }
}
