package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.user.SetPasswordRequestDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateRequestDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateResponseDto;
import com.foodgram.recipe_service.domain.dto.user.UserDto;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.SubscriptionRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.Nullable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class UserService {

    static final String RESERVED_USERNAME = "me";

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PasswordEncoder passwordEncoder;

    public UserCreateResponseDto register(UserCreateRequestDto dto) {
        if (RESERVED_USERNAME.equalsIgnoreCase(dto.getUsername())) {
            throw new CustomException(ErrorCode.FORBIDDEN_USERNAME);
        }
        if (userRepository.existsByEmail(dto.getEmail())) {
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL);
        }
        if (userRepository.existsByUsername(dto.getUsername())) {
            throw new CustomException(ErrorCode.DUPLICATE_USERNAME);
        }

        User saved = userRepository.save(UserMapper.toEntity(dto, passwordEncoder.encode(dto.getPassword())));
        log.info("Зарегистрирован пользователь id={}", saved.getId());
        return UserMapper.toCreateResponse(saved);
    }

    @Transactional(readOnly = true)
    public Page<UserDto> getUsers(Pageable pageable, @Nullable Long currentUserId) {
        Page<User> page = userRepository.findAll(pageable);
        List<Long> ids = page.getContent().stream().map(User::getId).toList();
        Set<Long> subscribed = (currentUserId == null || ids.isEmpty())
                ? Collections.emptySet()
                : subscriptionRepository.findAuthorIdsByUserIdAndAuthorIdIn(currentUserId, ids);
        return page.map(user -> UserMapper.toDto(user, subscribed.contains(user.getId())));
    }

    @Transactional(readOnly = true)
    public UserDto getUser(Long userId, @Nullable Long currentUserId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        boolean isSubscribed = currentUserId != null
                && subscriptionRepository.existsByUserIdAndAuthorId(currentUserId, userId);
        return UserMapper.toDto(user, isSubscribed);
    }

    @Transactional(readOnly = true)
    public UserDto getMe(Long currentUserId) {
        User user = userRepository.findById(currentUserId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        return UserMapper.toDto(user, false);
    }

    public void setPassword(Long currentUserId, SetPasswordRequestDto dto) {
        User user = userRepository.findById(currentUserId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPassword())) {
            throw new CustomException(ErrorCode.INVALID_CURRENT_PASSWORD);
        }
        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
    }
}
