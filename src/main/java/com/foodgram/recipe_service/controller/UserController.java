package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.user.*;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.security.CustomUserDetails;
import com.foodgram.recipe_service.service.SubscriptionService;
import com.foodgram.recipe_service.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@Tag(name = "Пользователи", description = "Регистрация, профили и подписки на авторов")
public class UserController {

    private final UserService userService;
    private final SubscriptionService subscriptionService;

    @PostMapping
    @Operation(summary = "Регистрация пользователя")
    public ResponseEntity<UserCreateResponseDto> register(@Valid @RequestBody UserCreateRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(dto));
    }

    @GetMapping
    @Operation(summary = "Список пользователей")
    public ResponseEntity<Page<UserDto>> getUsers(
            @ParameterObject @PageableDefault(size = 6, sort = "id") Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(userService.getUsers(pageable, currentUserId(userDetails)));
    }

    @GetMapping("/me")
    @Operation(summary = "Текущий пользователь")
    public ResponseEntity<UserDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.getMe(requireUserId(userDetails)));
    }

    @GetMapping("/subscriptions")
    @Operation(summary = "Мои подписки", description = "Авторы, на которых подписан пользователь, вместе с их рецептами.")
    public ResponseEntity<Page<UserWithRecipesDto>> getSubscriptions(
            @Parameter(description = "Сколько рецептов автора показывать")
            @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(subscriptionService.getSubscriptions(requireUserId(userDetails), pageable, recipesLimit));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Профиль пользователя")
    public ResponseEntity<UserDto> getUser(
            @Parameter(description = "ID пользователя") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(userService.getUser(id, currentUserId(userDetails)));
    }

    @PostMapping("/set_password")
    @Operation(summary = "Смена пароля")
    public ResponseEntity<Void> setPassword(
            @Valid @RequestBody SetPasswordRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        userService.setPassword(requireUserId(userDetails), dto);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/subscribe")
    @Operation(summary = "Подписаться на автора")
    public ResponseEntity<UserWithRecipesDto> subscribe(
            @Parameter(description = "ID автора") @PathVariable Long id,
            @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        UserWithRecipesDto body = subscriptionService.subscribe(requireUserId(userDetails), id, recipesLimit);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/{id}/subscribe")
    @Operation(summary = "Отписаться от автора")
    public ResponseEntity<Void> unsubscribe(
            @Parameter(description = "ID автора") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        subscriptionService.unsubscribe(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    private static Long currentUserId(CustomUserDetails userDetails) {
        return userDetails != null ? userDetails.getUserId() : null;
    }

    private static Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
