package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.security.CustomUserDetails;
import com.foodgram.recipe_service.service.ShoppingCartService;
import com.foodgram.recipe_service.service.ShoppingListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "Список покупок", description = "Корзина рецептов и выгрузка сводного списка ингредиентов")
public class ShoppingCartController {

    static final String SHOPPING_LIST_FILENAME = "shopping_cart.txt";

    private final ShoppingCartService shoppingCartService;
    private final ShoppingListService shoppingListService;

    @PostMapping("/{id}/shopping_cart")
    @Operation(summary = "Добавить рецепт в список покупок")
    public ResponseEntity<RecipeMinifiedDto> addToCart(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeMinifiedDto body = shoppingCartService.addToCart(requireUserId(userDetails), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/{id}/shopping_cart")
    @Operation(summary = "Удалить рецепт из списка покупок")
    public ResponseEntity<Void> removeFromCart(
            @Parameter(description = "ID рецепта") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        shoppingCartService.removeFromCart(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping({"/download_shopping_cart", "/download_shopping_cart/"})
    @Operation(summary = "Скачать список покупок",
            description = "Текстовый файл с суммарным количеством каждого ингредиента по всем рецептам корзины.")
    public ResponseEntity<String> downloadShoppingCart(@AuthenticationPrincipal CustomUserDetails userDetails) {
        String body = shoppingListService.downloadShoppingList(requireUserId(userDetails));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(SHOPPING_LIST_FILENAME)
                .build());
        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }

    private static Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
