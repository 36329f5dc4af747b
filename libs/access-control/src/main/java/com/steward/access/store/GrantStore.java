package com.steward.access.store;

import com.steward.access.AccessIntegrityException;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of the three grant relations.
 *
 * <p>Implementations enforce uniqueness of {@link Grant#key()} and must honour the surrounding
 * {@link TransactionRunner} transaction. Only the mutation engine writes through this interface.
 */
public interface GrantStore {

    /** Finds the single grant with the given key, if any. */
    Optional<Grant> find(Grant.Key key);

    /** Returns every grant matching the filter, in insertion order. */
    List<Grant> findAll(GrantFilter filter);

    /** Whether any grant matches the filter. */
    default boolean exists(GrantFilter filter) {
        return !findAll(filter).isEmpty();
    }

    /** Counts grants matching the filter. */
    default int count(GrantFilter filter) {
        return findAll(filter).size();
    }

    /**
     * Inserts a new grant.
     *
     * @throws AccessIntegrityException if a grant with the same key already exists
     */
    Grant insert(Grant grant);

    /**
     * Replaces the privilege of an existing grant, refreshing its timestamp.
     *
     * @return the updated grant
     * @throws AccessIntegrityException if no grant with that key exists
     */
    Grant updatePrivilege(Grant.Key key, Privilege privilege);

    /**
     * Deletes every grant matching the filter.
     *
     * @return number of grants deleted
     */
    int delete(GrantFilter filter);

    /**
     * Locks the group or resource that {@code relation}'s objects refer to for the rest of the
     * current transaction, serializing concurrent mutations of that object's grants.
     */
    void lockObject(GrantRelation relation, String objectId);
}
