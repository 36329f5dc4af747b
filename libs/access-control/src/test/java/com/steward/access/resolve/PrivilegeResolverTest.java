package com.steward.access.resolve;

import static org.assertj.core.api.Assertions.assertThat;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.Privilege;
import com.steward.access.ResourceFlags;
import com.steward.access.mutate.MutationEngine;
import com.steward.access.testing.AccessFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("PrivilegeResolver")
class PrivilegeResolverTest {

    private AccessFixtures fixtures;
    private PrivilegeResolver resolver;
    private MutationEngine mutations;
    private AccessUser owner;
    private AccessUser member;

    @BeforeEach
    void setUp() {
        fixtures = AccessFixtures.inMemory();
        resolver = fixtures.access().resolver();
        mutations = fixtures.access().mutations();
        owner = fixtures.user("owner");
        member = fixtures.user("member");
    }

    @Nested
    @DisplayName("Combined privilege over resources")
    class CombinedOverResources {

        @Test
        @DisplayName("creator should hold OWNER")
        void creatorShouldOwn() {
            AccessResource resource = fixtures.resource(owner);

            assertThat(resolver.combinedPrivilege(owner, resource)).isEqualTo(Privilege.OWNER);
            assertThat(resolver.owns(owner, resource)).isTrue();
        }

        @Test
        @DisplayName("a user without grants should hold NONE")
        void strangerShouldHoldNone() {
            AccessResource resource = fixtures.resource(owner);

            assertThat(resolver.combinedPrivilege(member, resource)).isEqualTo(Privilege.NONE);
        }

        @Test
        @DisplayName("should take the strongest of direct and group grants")
        void shouldTakeStrongestOfDirectAndGroup() {
            AccessResource resource = fixtures.resource(owner);
            AccessGroup group = fixtures.group(owner);
            mutations.shareGroupWithUser(owner, group, member, Privilege.VIEW);
            mutations.shareResourceWithUser(owner, resource, member, Privilege.VIEW);
            mutations.shareResourceWithGroup(owner, resource, group, Privilege.CHANGE);

            assertThat(resolver.combinedPrivilege(member, resource)).isEqualTo(Privilege.CHANGE);
            assertThat(resolver.groupPrivilege(group, resource)).isEqualTo(Privilege.CHANGE);
        }

        @Test
        @DisplayName("grants through an inactive group should not count")
        void inactiveGroupShouldNotCount() {
            AccessResource resource = fixtures.resource(owner);
            AccessGroup group = fixtures.group(owner);
            mutations.shareGroupWithUser(owner, group, member, Privilege.VIEW);
            mutations.shareResourceWithGroup(owner, resource, group, Privilege.CHANGE);

            AccessGroup inactive = fixtures.flags(group, GroupFlags.defaults().withActive(false));

            assertThat(resolver.combinedPrivilege(member, resource)).isEqualTo(Privilege.NONE);
            assertThat(resolver.groupPrivilege(inactive, resource)).isEqualTo(Privilege.NONE);
        }

        @Test
        @DisplayName("superusers should hold OWNER over everything")
        void superuserShouldHoldOwner() {
            AccessResource resource = fixtures.resource(owner);
            AccessUser admin = fixtures.superuser("admin");

            assertThat(resolver.combinedPrivilege(admin, resource)).isEqualTo(Privilege.OWNER);
        }

        @Test
        @DisplayName("inactive users should hold NONE and own nothing")
        void inactiveUserShouldHoldNone() {
            AccessResource resource = fixtures.resource(owner);
            AccessUser retired = fixtures.update(owner.withActive(false));

            assertThat(resolver.combinedPrivilege(retired, resource)).isEqualTo(Privilege.NONE);
            assertThat(resolver.owns(retired, resource)).isFalse();
        }

        @Test
        @DisplayName("an owner of an inactive resource should not own it")
        void inactiveResourceShouldNotBeOwned() {
            AccessResource resource =
                    fixtures.resource(owner, ResourceFlags.defaults().withActive(false));

            assertThat(resolver.owns(owner, resource)).isFalse();
        }
    }

    @Nested
    @DisplayName("Combined privilege over groups")
    class CombinedOverGroups {

        @Test
        @DisplayName("should take the strongest of the user's grants from several grantors")
        void shouldTakeStrongestAcrossGrantors() {
            AccessUser coOwner = fixtures.user("co-owner");
            AccessGroup group = fixtures.group(owner);
            mutations.shareGroupWithUser(owner, group, coOwner, Privilege.OWNER);
            mutations.shareGroupWithUser(owner, group, member, Privilege.VIEW);
            mutations.shareGroupWithUser(coOwner, group, member, Privilege.CHANGE);

            assertThat(resolver.combinedPrivilege(member, group)).isEqualTo(Privilege.CHANGE);
            assertThat(resolver.isMember(member.id(), group.id())).isTrue();
        }
    }

    @Nested
    @DisplayName("Effective privilege")
    class Effective {

        @Test
        @DisplayName("public resource should give VIEW to a user with no grant")
        void publicResourceShouldGiveView() {
            AccessUser outsider = fixtures.user("outsider");
            AccessResource resource =
                    fixtures.resource(owner, ResourceFlags.defaults().withPublic(true));

            assertThat(resolver.effectivePrivilege(outsider, resource)).isEqualTo(Privilege.VIEW);
        }

        @Test
        @DisplayName("immutable resource should cap an owner at VIEW")
        void immutableShouldCapOwner() {
            AccessResource resource =
                    fixtures.resource(owner, ResourceFlags.defaults().withImmutable(true));

            assertThat(resolver.effectivePrivilege(owner, resource)).isEqualTo(Privilege.VIEW);
            assertThat(resolver.combinedPrivilege(owner, resource)).isEqualTo(Privilege.OWNER);
        }

        @ParameterizedTest
        @EnumSource(Privilege.class)
        @DisplayName("immutable and public together should always yield VIEW")
        void immutableAndPublicShouldYieldView(Privilege combined) {
            ResourceFlags flags = ResourceFlags.defaults().withImmutable(true).withPublic(true);

            assertThat(PrivilegeResolver.applyFlags(combined, flags)).isEqualTo(Privilege.VIEW);
        }

        @ParameterizedTest
        @EnumSource(Privilege.class)
        @DisplayName("without immutable or public the combined privilege should pass through")
        void plainFlagsShouldPassThrough(Privilege combined) {
            assertThat(PrivilegeResolver.applyFlags(combined, ResourceFlags.defaults()))
                    .isEqualTo(combined);
        }
    }
}
