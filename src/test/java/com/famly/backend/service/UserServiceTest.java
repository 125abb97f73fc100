package com.famly.backend.service;

import com.famly.backend.exception.DuplicateUsernameException;
import com.famly.backend.exception.UnauthorizedException;
import com.famly.backend.exception.UserNotFoundException;
import com.famly.backend.exception.ValidationException;
import com.famly.backend.model.User;
import com.famly.backend.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService Tests")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordService passwordService;

    @InjectMocks
    private UserService userService;

    @Nested
    class Create {

        @Test
        void create_HashesPasswordAndSaves() {
            when(userRepository.findByUsername("alice")).thenReturn(Optional.empty());
            when(passwordService.hash("secret")).thenReturn("hashed");

            User user = userService.create("alice", "secret");

            assertThat(user.getUsername()).isEqualTo("alice");
            assertThat(user.getPassword()).isEqualTo("hashed");
            assertThat(user.getId()).isNotNull();
            verify(userRepository).save(user);
        }

        @Test
        void create_WithTakenUsername_ThrowsDuplicate() {
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(new User("alice", "x")));

            assertThatThrownBy(() -> userService.create("alice", "secret"))
                .isInstanceOf(DuplicateUsernameException.class);
            verify(userRepository, never()).save(any());
        }

        @Test
        void create_WithBlankUsername_ThrowsValidation() {
            assertThatThrownBy(() -> userService.create(" ", "secret"))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void create_WithEmptyPassword_ThrowsValidation() {
            assertThatThrownBy(() -> userService.create("alice", ""))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class Authenticate {

        @Test
        void authenticate_WithCorrectPassword_ReturnsUser() {
            User user = new User("alice", "hashed");
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(user));
            when(passwordService.matches("secret", "hashed")).thenReturn(true);

            assertThat(userService.authenticate("alice", "secret")).isSameAs(user);
        }

        @Test
        void authenticate_WithWeakerStoredHash_UpgradesIt() {
            User user = new User("alice", "old-hash");
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(user));
            when(passwordService.matches("secret", "old-hash")).thenReturn(true);
            when(passwordService.needsRehash("old-hash")).thenReturn(true);
            when(passwordService.hash("secret")).thenReturn("new-hash");

            userService.authenticate("alice", "secret");

            assertThat(user.getPassword()).isEqualTo("new-hash");
            verify(userRepository).save(user);
        }

        @Test
        void authenticate_WithWrongPassword_ThrowsUnauthorized() {
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(new User("alice", "hashed")));
            when(passwordService.matches("nope", "hashed")).thenReturn(false);

            assertThatThrownBy(() -> userService.authenticate("alice", "nope"))
                .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        void authenticate_WithUnknownUser_ThrowsUnauthorized() {
            when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> userService.authenticate("ghost", "secret"))
                .isInstanceOf(UnauthorizedException.class);
        }
    }

    @Nested
    class Updates {

        @Test
        void updateUsername_ToTakenName_ThrowsDuplicate() {
            User user = new User("alice", "hashed");
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(userRepository.findByUsername("bob")).thenReturn(Optional.of(new User("bob", "x")));

            assertThatThrownBy(() -> userService.updateUsername(user.getId().toString(), "bob"))
                .isInstanceOf(DuplicateUsernameException.class);
            assertThat(user.getUsername()).isEqualTo("alice");
        }

        @Test
        void updatePassword_WithWrongCurrent_ThrowsUnauthorized() {
            User user = new User("alice", "hashed");
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(passwordService.matches("wrong", "hashed")).thenReturn(false);

            assertThatThrownBy(() -> userService.updatePassword(user.getId().toString(), "wrong", "new"))
                .isInstanceOf(UnauthorizedException.class);
            verify(userRepository, never()).save(any());
        }

        @Test
        void updatePassword_StoresNewHash() {
            User user = new User("alice", "hashed");
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(passwordService.matches("secret", "hashed")).thenReturn(true);
            when(passwordService.hash("new")).thenReturn("new-hash");

            userService.updatePassword(user.getId().toString(), "secret", "new");

            assertThat(user.getPassword()).isEqualTo("new-hash");
            verify(userRepository).save(user);
        }
    }

    @Test
    void getUserById_WithMalformedId_ThrowsNotFound() {
        assertThatThrownBy(() -> userService.getUserById("not-a-uuid"))
            .isInstanceOf(UserNotFoundException.class);
        verifyNoInteractions(userRepository);
    }

    @Test
    void resolveUsernames_MapsUnknownIdsToDeletedUser() {
        User alice = new User("alice", "hashed");
        UUID gone = UUID.randomUUID();
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(userRepository.findById(gone)).thenReturn(Optional.empty());

        Map<String, String> usernames = userService.resolveUsernames(
            List.of(alice.getId().toString(), gone.toString(), alice.getId().toString()));

        assertThat(usernames)
            .containsEntry(alice.getId().toString(), "alice")
            .containsEntry(gone.toString(), UserService.DELETED_USER)
            .hasSize(2);
        verify(userRepository, times(1)).findById(alice.getId());
    }
}
