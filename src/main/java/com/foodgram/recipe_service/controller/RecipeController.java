package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.recipe.*;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.security.CustomUserDetails;
import com.foodgram.recipe_service.service.RecipeService;
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
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "Рецепты", description = "Создание, просмотр, изменение и поиск рецептов")
public class RecipeController {

    private final RecipeService recipeService;

    @GetMapping
    @Operation(summary = "Список рецептов", description = "Новые рецепты первыми. Фильтры по автору, тегам, избранному и списку покупок.")
    public ResponseEntity<Page<RecipeDetailDto>> getRecipes(
            @Parameter(description = "ID автора") @RequestParam(required = false) Long author,
            @Parameter(description = "Slug тега, можно несколько") @RequestParam(required = false) List<String> tags,
            @Parameter(description = "1 - только избранные, 0 - исключить избранные")
            @RequestParam(name = "is_favorited", required = false) Boolean isFavorited,
            @Parameter(description = "1 - только из списка покупок, 0 - исключить их")
            @RequestParam(name = "is_in_shopping_cart", required = false) Boolean isInShoppingCart,
            @Parameter(description = "Поиск по названию и описанию") @RequestParam(required = false) String search,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeSearchCondition cond = RecipeSearchCondition.builder()
                .author(author)
                .tags(tags)
                .isFavorited(isFavorited)
                .isInShoppingCart(isInShoppingCart)
                .search(search)
                .build();
        return ResponseEntity.ok(recipeService.searchRecipes(cond, pageable, currentUserId(userDetails)));
    }

    @PostMapping
    @Operation(summary = "Создать рецепт")
    public ResponseEntity<RecipeDetailDto> createRecipe(
            @Valid @RequestBody RecipeCreateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeDetailDto created = recipeService.createRecipe(requireUserId(userDetails), dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Рецепт по ID")
    public ResponseEntity<RecipeDetailDto> getRecipe(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(recipeService.getRecipe(id, currentUserId(userDetails)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Изменить рецепт", description = "Доступно только автору. Не переданные поля не меняются.")
    public ResponseEntity<RecipeDetailDto> updateRecipe(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @Valid @RequestBody RecipeUpdateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(recipeService.updateRecipe(requireUserId(userDetails), id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Удалить рецепт", description = "Доступно только автору.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        recipeService.deleteRecipe(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping({"/{id}/get-link", "/{id}/get-link/"})
    @Operation(summary = "Короткая ссылка на рецепт")
    public ResponseEntity<ShortLinkDto> getShortLink(@Parameter(description = "ID рецепта") @PathVariable Long id) {
        String token = recipeService.getShortLinkToken(id);
        String url = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/s/{token}")
                .buildAndExpand(token)
                .toUriString();
        return ResponseEntity.ok(new ShortLinkDto(url));
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
