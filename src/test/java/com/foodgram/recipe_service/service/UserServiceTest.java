package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.user.SetPasswordRequestDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateRequestDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateResponseDto;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.SubscriptionRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private UserService userService;

    @Test
    @DisplayName("register: пароль сохраняется в закодированном виде")
    void register_encodesPassword() {
        UserCreateRequestDto dto = request("cook@example.com", "cook");
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("encoded");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserCreateResponseDto result = userService.register(dto);

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository, times(1)).save(captor.capture());
        assertEquals("encoded", captor.getValue().getPassword());
        assertEquals("cook", result.getUsername());
        assertEquals("cook@example.com", result.getEmail());
    }

    @Test
    @DisplayName("register: имя 'me' зарезервировано")
    void register_reservedUsername_throws() {
        CustomException ex = assertThrows(CustomException.class,
                () -> userService.register(request("me@example.com", "me")));

        assertEquals(ErrorCode.FORBIDDEN_USERNAME, ex.getErrorCode());
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("register: занятый email дает DUPLICATE_EMAIL")
    void register_duplicateEmail_throws() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.register(request("cook@example.com", "cook")));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, ex.getErrorCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("setPassword: неверный текущий пароль отклоняется")
    void setPassword_wrongCurrent_throws() {
        User user = User.builder().id(1L).password("encoded").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "encoded")).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.setPassword(1L, new SetPasswordRequestDto("wrong", "newSecret123")));

        assertEquals(ErrorCode.INVALID_CURRENT_PASSWORD, ex.getErrorCode());
        assertEquals("encoded", user.getPassword());
    }

    @Test
    @DisplayName("setPassword: новый пароль кодируется и сохраняется")
    void setPassword_success() {
        User user = User.builder().id(1L).password("encoded").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret123", "encoded")).thenReturn(true);
        when(passwordEncoder.encode("newSecret123")).thenReturn("encoded-new");

        userService.setPassword(1L, new SetPasswordRequestDto("secret123", "newSecret123"));

        assertEquals("encoded-new", user.getPassword());
    }

    private UserCreateRequestDto request(String email, String username) {
        return UserCreateRequestDto.builder()
                .email(email)
                .username(username)
                .firstName("Иван")
                .lastName("Иванов")
                .password("secret123")
                .build();
    }
}
