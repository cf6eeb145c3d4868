package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.security.CustomUserDetails;
import com.foodgram.recipe_service.service.RecipeFavoriteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "Избранное", description = "Добавление рецептов в избранное и удаление из него")
public class RecipeFavoriteController {

    private final RecipeFavoriteService favoriteService;

    @PostMapping("/{id}/favorite")
    @Operation(summary = "Добавить в избранное")
    public ResponseEntity<RecipeMinifiedDto> addFavorite(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        RecipeMinifiedDto body = favoriteService.addFavorite(userDetails.getUserId(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/{id}/favorite")
    @Operation(summary = "Удалить из избранного")
    public ResponseEntity<Void> removeFavorite(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        favoriteService.removeFavorite(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
