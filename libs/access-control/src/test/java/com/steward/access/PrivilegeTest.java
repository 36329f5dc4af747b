package com.steward.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Privilege")
class PrivilegeTest {

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("lower code should be stronger")
        void lowerCodeShouldBeStronger() {
            assertThat(Privilege.OWNER.isStrongerThan(Privilege.CHANGE)).isTrue();
            assertThat(Privilege.CHANGE.isStrongerThan(Privilege.VIEW)).isTrue();
            assertThat(Privilege.VIEW.isStrongerThan(Privilege.NONE)).isTrue();
            assertThat(Privilege.NONE.isWeakerThan(Privilege.VIEW)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(Privilege.class)
        @DisplayName("every privilege should be at least itself but not stronger than itself")
        void shouldCompareReflexively(Privilege privilege) {
            assertThat(privilege.isAtLeast(privilege)).isTrue();
            assertThat(privilege.isStrongerThan(privilege)).isFalse();
            assertThat(privilege.isWeakerThan(privilege)).isFalse();
        }

        @Test
        @DisplayName("strongest and weakest should pick numeric min and max")
        void shouldPickMinAndMax() {
            assertThat(Privilege.strongest(Privilege.VIEW, Privilege.CHANGE)).isEqualTo(Privilege.CHANGE);
            assertThat(Privilege.weakest(Privilege.VIEW, Privilege.CHANGE)).isEqualTo(Privilege.VIEW);
            assertThat(Privilege.strongest(Privilege.NONE, Privilege.OWNER)).isEqualTo(Privilege.OWNER);
            assertThat(Privilege.weakest(Privilege.NONE, Privilege.OWNER)).isEqualTo(Privilege.NONE);
        }
    }

    @Nested
    @DisplayName("Codes")
    class Codes {

        @ParameterizedTest
        @EnumSource(Privilege.class)
        @DisplayName("fromCode should resolve every code")
        void shouldResolveCodes(Privilege privilege) {
            assertThat(Privilege.fromCode(privilege.code())).isEqualTo(privilege);
        }

        @Test
        @DisplayName("should use persisted codes 1 to 4")
        void shouldUsePersistedCodes() {
            assertThat(Privilege.OWNER.code()).isEqualTo(1);
            assertThat(Privilege.CHANGE.code()).isEqualTo(2);
            assertThat(Privilege.VIEW.code()).isEqualTo(3);
            assertThat(Privilege.NONE.code()).isEqualTo(4);
        }

        @Test
        @DisplayName("should reject unknown code")
        void shouldRejectUnknownCode() {
            assertThatThrownBy(() -> Privilege.fromCode(7))
                    .isInstanceOf(AccessUsageException.class)
                    .hasMessageContaining("7");
        }
    }

    @Nested
    @DisplayName("Grantability")
    class Grantability {

        @Test
        @DisplayName("NONE and null should not be grantable")
        void noneShouldNotBeGrantable() {
            assertThat(Privilege.NONE.isGrantable()).isFalse();
            assertThatThrownBy(() -> Privilege.requireGrantable(Privilege.NONE))
                    .isInstanceOf(AccessUsageException.class);
            assertThatThrownBy(() -> Privilege.requireGrantable(null))
                    .isInstanceOf(AccessUsageException.class);
        }

        @Test
        @DisplayName("OWNER, CHANGE and VIEW should be grantable")
        void othersShouldBeGrantable() {
            assertThat(Privilege.requireGrantable(Privilege.OWNER)).isEqualTo(Privilege.OWNER);
            assertThat(Privilege.requireGrantable(Privilege.CHANGE)).isEqualTo(Privilege.CHANGE);
            assertThat(Privilege.requireGrantable(Privilege.VIEW)).isEqualTo(Privilege.VIEW);
        }
    }
}
