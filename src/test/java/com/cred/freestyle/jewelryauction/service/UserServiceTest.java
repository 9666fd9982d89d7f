package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.User;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.exception.ConflictException;
import com.cred.freestyle.jewelryauction.exception.InvalidCredentialsException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.repository.UserRepository;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService Unit Tests")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private UserService userService;

    // ========================================
    // register() Tests
    // ========================================

    @Test
    @DisplayName("register - Email is normalized and the password hashed")
    void register_Success() {
        // Given
        when(userRepository.existsByEmailIgnoreCase("ana@example.com")).thenReturn(false);
        when(passwordEncoder.encode("s3cretpass")).thenReturn("{bcrypt}hash");
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        User user = userService.register(" Ana ", "  Ana@Example.com ", "s3cretpass", "555-0100", "1 Main St");

        // Then
        assertThat(user.getEmail()).isEqualTo("ana@example.com");
        assertThat(user.getName()).isEqualTo("Ana");
        assertThat(user.getPasswordHash()).isEqualTo("{bcrypt}hash");
        assertThat(user.getRole()).isEqualTo(Role.MEMBER);
        assertThat(user.getActive()).isTrue();
    }

    @Test
    @DisplayName("register - Duplicate email is a conflict")
    void register_DuplicateEmail() {
        when(userRepository.existsByEmailIgnoreCase("ana@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register("Ana", "ANA@example.com", "s3cretpass", null, null))
                .isInstanceOf(ConflictException.class)
                .hasFieldOrPropertyWithValue("code", UserService.DUPLICATE_EMAIL);
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("register - Unique index race is reported as duplicate email")
    void register_UniqueIndexRace() {
        when(userRepository.existsByEmailIgnoreCase("ana@example.com")).thenReturn(false);
        when(passwordEncoder.encode(anyString())).thenReturn("hash");
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("uk_users_email"));

        assertThatThrownBy(() -> userService.register("Ana", "ana@example.com", "s3cretpass", null, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("register - Short password is rejected")
    void register_ShortPassword() {
        assertThatThrownBy(() -> userService.register("Ana", "ana@example.com", "short", null, null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(userRepository);
    }

    // ========================================
    // Administration Tests
    // ========================================

    @Test
    @DisplayName("get - Members see only themselves")
    void get_OtherUser() {
        assertThatThrownBy(() -> userService.get(TestDataBuilder.SELLER_ID, TestDataBuilder.bidder()))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("deactivate - Admin soft-deletes the user")
    void deactivate_Success() {
        User user = User.builder().userId("u-1").name("Ana").email("ana@example.com").build();
        when(userRepository.findById("u-1")).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);

        User result = userService.deactivate("u-1", TestDataBuilder.admin());

        assertThat(result.getActive()).isFalse();
        assertThat(result.getDeactivatedAt()).isNotNull();
    }

    @Test
    @DisplayName("deactivate - Already inactive user is left alone")
    void deactivate_AlreadyInactive() {
        User user = User.builder().userId("u-1").active(false).build();
        when(userRepository.findById("u-1")).thenReturn(Optional.of(user));

        userService.deactivate("u-1", TestDataBuilder.admin());

        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("changeRole - Managers cannot change roles")
    void changeRole_ManagerDenied() {
        assertThatThrownBy(() -> userService.changeRole("u-1", Role.STAFF, TestDataBuilder.manager()))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("changeRole - Admin promotes a member")
    void changeRole_Success() {
        User user = User.builder().userId("u-1").build();
        when(userRepository.findById("u-1")).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);

        assertThat(userService.changeRole("u-1", Role.STAFF, TestDataBuilder.admin()).getRole())
                .isEqualTo(Role.STAFF);
    }

    // ========================================
    // verifyCredentials() Tests
    // ========================================

    private User storedUser(boolean active) {
        return User.builder()
                .userId("user-42")
                .name("Ana")
                .email("ana@example.com")
                .passwordHash("{bcrypt}hash")
                .role(Role.MEMBER)
                .active(active)
                .build();
    }

    @Test
    @DisplayName("verifyCredentials - Matching password returns the user")
    void verifyCredentials_Success() {
        // Given
        when(userRepository.findByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(storedUser(true)));
        when(passwordEncoder.matches("s3cretpass", "{bcrypt}hash")).thenReturn(true);

        // When
        User user = userService.verifyCredentials(" ANA@example.com ", "s3cretpass");

        // Then
        assertThat(user.getUserId()).isEqualTo("user-42");
    }

    @Test
    @DisplayName("verifyCredentials - Wrong password is rejected")
    void verifyCredentials_WrongPassword() {
        when(userRepository.findByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(storedUser(true)));
        when(passwordEncoder.matches("wrongpass", "{bcrypt}hash")).thenReturn(false);

        assertThatThrownBy(() -> userService.verifyCredentials("ana@example.com", "wrongpass"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasFieldOrPropertyWithValue("code", InvalidCredentialsException.CODE);
    }

    @Test
    @DisplayName("verifyCredentials - Unknown email is rejected without a hash check")
    void verifyCredentials_UnknownEmail() {
        when(userRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.verifyCredentials("ghost@example.com", "s3cretpass"))
                .isInstanceOf(InvalidCredentialsException.class);
        verify(passwordEncoder, never()).matches(any(), any());
    }

    @Test
    @DisplayName("verifyCredentials - Deactivated account is rejected")
    void verifyCredentials_Deactivated() {
        when(userRepository.findByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(storedUser(false)));
        when(passwordEncoder.matches("s3cretpass", "{bcrypt}hash")).thenReturn(true);

        assertThatThrownBy(() -> userService.verifyCredentials("ana@example.com", "s3cretpass"))
                .isInstanceOf(InvalidCredentialsException.class);
    }
}
