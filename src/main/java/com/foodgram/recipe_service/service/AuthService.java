package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.auth.AuthTokenDto;
import com.foodgram.recipe_service.domain.dto.auth.LoginRequestDto;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.jwt.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional(readOnly = true)
    public AuthTokenDto login(LoginRequestDto dto) {
        User user = userRepository.findByEmail(dto.getEmail())
                .filter(u -> passwordEncoder.matches(dto.getPassword(), u.getPassword()))
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_CREDENTIALS));

        log.info("Выдан токен пользователю id={}", user.getId());
        return new AuthTokenDto(jwtTokenProvider.createAccessToken(user));
    }
}
