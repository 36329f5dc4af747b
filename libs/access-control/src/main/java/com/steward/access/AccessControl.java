package com.steward.access;

import com.steward.access.authz.AccessRules;
import com.steward.access.authz.AuthorizationEngine;
import com.steward.access.memory.InMemoryAccessStore;
import com.steward.access.mutate.GrantAuditLogger;
import com.steward.access.mutate.MutationEngine;
import com.steward.access.query.AccessQueries;
import com.steward.access.resolve.PrivilegeResolver;
import com.steward.access.store.EntityStore;
import com.steward.access.store.GrantStore;
import com.steward.access.store.TransactionRunner;
import com.steward.observability.AccessMetrics;
import java.time.Clock;

/**
 * Entry point bundling the engines that share one set of stores.
 *
 * <pre>{@code
 * AccessControl access = AccessControl.create(entities, grants, transactions, metrics);
 * AccessResource doc = access.mutations().createResource(alice, "Field notes");
 * access.authorization().canViewResource(bob, doc); // false
 * }</pre>
 *
 * @param resolver privilege computation
 * @param authorization read-only predicates and removal lists
 * @param mutations the only writer of grants and flags
 * @param queries membership and holding projections
 */
public record AccessControl(
        PrivilegeResolver resolver,
        AuthorizationEngine authorization,
        MutationEngine mutations,
        AccessQueries queries) {

    public static AccessControl create(
            EntityStore entities,
            GrantStore grants,
            TransactionRunner transactions,
            AccessMetrics metrics) {
        return create(entities, grants, transactions, metrics, Clock.systemUTC());
    }

    public static AccessControl create(
            EntityStore entities,
            GrantStore grants,
            TransactionRunner transactions,
            AccessMetrics metrics,
            Clock clock) {
        PrivilegeResolver resolver = new PrivilegeResolver(entities, grants);
        AccessRules rules = new AccessRules(entities, grants, resolver);
        return new AccessControl(
                resolver,
                new AuthorizationEngine(entities, grants, resolver, rules),
                new MutationEngine(
                        entities,
                        grants,
                        transactions,
                        rules,
                        resolver,
                        new GrantAuditLogger(),
                        metrics,
                        clock),
                new AccessQueries(entities, grants));
    }

    /** Access control over a fresh {@link InMemoryAccessStore}, with unscraped metrics. */
    public static AccessControl inMemory(InMemoryAccessStore store) {
        return create(store, store, store, AccessMetrics.noop());
    }
}
