package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.auth.AuthTokenDto;
import com.foodgram.recipe_service.domain.dto.auth.LoginRequestDto;
import com.foodgram.recipe_service.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth/token")
@Tag(name = "Авторизация", description = "Получение токена по email и паролю")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    @Operation(summary = "Получить токен")
    public ResponseEntity<AuthTokenDto> login(@Valid @RequestBody LoginRequestDto dto) {
        return ResponseEntity.ok(authService.login(dto));
    }

    // JWT не хранится на сервере, выход выполняет клиент, удаляя токен
    @PostMapping("/logout")
    @Operation(summary = "Выйти")
    public ResponseEntity<Void> logout() {
        return ResponseEntity.noContent().build();
    }
}
