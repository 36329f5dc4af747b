package com.steward.access.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.steward.access.AccessGroup;
import com.steward.access.AccessIntegrityException;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.testing.AccessFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryAccessStore")
class InMemoryAccessStoreTest {

    private InMemoryAccessStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryAccessStore(AccessFixtures.fixedClock());
    }

    private Grant grant(String subject, String object, String grantor, Privilege privilege) {
        return new Grant(
                GrantRelation.USER_RESOURCE, subject, object, grantor, privilege, store.now());
    }

    @Nested
    @DisplayName("Grants")
    class Grants {

        @Test
        @DisplayName("should reject a duplicate key")
        void shouldRejectDuplicateKey() {
            store.insert(grant("u1", "r1", "u1", Privilege.OWNER));

            assertThatThrownBy(() -> store.insert(grant("u1", "r1", "u1", Privilege.VIEW)))
                    .isInstanceOf(AccessIntegrityException.class);
        }

        @Test
        @DisplayName("should allow the same subject and object from different grantors")
        void shouldAllowDifferentGrantors() {
            store.insert(grant("u2", "r1", "u1", Privilege.VIEW));
            store.insert(grant("u2", "r1", "u3", Privilege.CHANGE));

            assertThat(store.count(GrantFilter.of(GrantRelation.USER_RESOURCE).subject("u2")))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("should update privilege in place")
        void shouldUpdatePrivilege() {
            Grant original = store.insert(grant("u2", "r1", "u1", Privilege.VIEW));

            Grant updated = store.updatePrivilege(original.key(), Privilege.CHANGE);

            assertThat(updated.privilege()).isEqualTo(Privilege.CHANGE);
            assertThat(store.find(original.key())).contains(updated);
        }

        @Test
        @DisplayName("should refuse to update a missing grant")
        void shouldRefuseMissingUpdate() {
            Grant.Key key = new Grant.Key(GrantRelation.USER_RESOURCE, "u2", "r1", "u1");

            assertThatThrownBy(() -> store.updatePrivilege(key, Privilege.VIEW))
                    .isInstanceOf(AccessIntegrityException.class);
        }

        @Test
        @DisplayName("should delete only matching grants")
        void shouldDeleteMatching() {
            store.insert(grant("u1", "r1", "u1", Privilege.OWNER));
            store.insert(grant("u2", "r1", "u1", Privilege.VIEW));
            store.insert(grant("u2", "r1", "u3", Privilege.CHANGE));

            int deleted =
                    store.delete(
                            GrantFilter.of(GrantRelation.USER_RESOURCE)
                                    .object("r1")
                                    .weakerThan(Privilege.CHANGE));

            assertThat(deleted).isEqualTo(1);
            assertThat(store.findAll(GrantFilter.of(GrantRelation.USER_RESOURCE)))
                    .extracting(Grant::privilege)
                    .containsExactly(Privilege.OWNER, Privilege.CHANGE);
        }
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("should roll back every write when the work throws")
        void shouldRollBack() {
            store.saveUser(AccessUser.of("u1"));

            assertThatThrownBy(
                            () ->
                                    store.inTransaction(
                                            () -> {
                                                store.insertGroup("g", GroupFlags.defaults());
                                                store.insert(grant("u1", "r1", "u1", Privilege.OWNER));
                                                store.saveUser(AccessUser.of("u1").withActive(false));
                                                throw new IllegalStateException("boom");
                                            }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");

            assertThat(store.findAll(GrantFilter.of(GrantRelation.USER_RESOURCE))).isEmpty();
            assertThat(store.findUser("u1")).contains(AccessUser.of("u1"));
        }

        @Test
        @DisplayName("should keep writes when the work completes")
        void shouldCommit() {
            AccessGroup group =
                    store.inTransaction(() -> store.insertGroup("g", GroupFlags.defaults()));

            assertThat(store.findGroup(group.id())).contains(group);
        }

        @Test
        @DisplayName("nested transactions should join the outer one")
        void nestedShouldJoinOuter() {
            assertThatThrownBy(
                            () ->
                                    store.inTransaction(
                                            () -> {
                                                store.inTransaction(
                                                        () -> store.insert(grant("u1", "r1", "u1", Privilege.OWNER)));
                                                throw new IllegalStateException("outer fails");
                                            }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(store.findAll(GrantFilter.of(GrantRelation.USER_RESOURCE))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("should assign distinct ids to new groups and resources")
        void shouldAssignIds() {
            AccessGroup first = store.insertGroup("a", GroupFlags.defaults());
            AccessGroup second = store.insertGroup("b", GroupFlags.defaults());

            assertThat(first.id()).isNotEqualTo(second.id());
        }

        @Test
        @DisplayName("should reject flag updates for unknown groups")
        void shouldRejectUnknownGroupFlags() {
            assertThatThrownBy(() -> store.updateGroupFlags("missing", GroupFlags.defaults()))
                    .isInstanceOf(AccessUsageException.class);
        }
    }
}
