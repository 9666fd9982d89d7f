package com.cred.freestyle.jewelryauction.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Role Tests")
class RoleTest {

    @Test
    @DisplayName("atLeast - Follows declaration order")
    void atLeast() {
        assertThat(Role.ADMIN.atLeast(Role.MANAGER)).isTrue();
        assertThat(Role.MANAGER.atLeast(Role.STAFF)).isTrue();
        assertThat(Role.STAFF.atLeast(Role.STAFF)).isTrue();
        assertThat(Role.MEMBER.atLeast(Role.STAFF)).isFalse();
        assertThat(Role.GUEST.atLeast(Role.MEMBER)).isFalse();
    }

    @Test
    @DisplayName("fromString - Lenient parsing, unknown values fall back to GUEST")
    void fromString() {
        assertThat(Role.fromString("manager")).isEqualTo(Role.MANAGER);
        assertThat(Role.fromString(" ROLE_staff ")).isEqualTo(Role.STAFF);
        assertThat(Role.fromString("superuser")).isEqualTo(Role.GUEST);
        assertThat(Role.fromString(null)).isEqualTo(Role.GUEST);
        assertThat(Role.fromString("")).isEqualTo(Role.GUEST);
    }
}
