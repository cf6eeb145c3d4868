package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.config.ShortLinkProperties;
import com.foodgram.recipe_service.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;

@RestController
@RequiredArgsConstructor
@Tag(name = "Короткие ссылки")
public class ShortLinkController {

    private final RecipeService recipeService;
    private final ShortLinkProperties shortLinkProperties;

    @GetMapping({"/s/{token}", "/s/{token}/"})
    @Operation(summary = "Переход по короткой ссылке", description = "Перенаправляет на страницу рецепта.")
    public ResponseEntity<Void> redirect(@PathVariable String token) {
        Long recipeId = recipeService.resolveShortLink(token);
        URI location = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path(shortLinkProperties.recipePathFor(recipeId))
                .build()
                .toUri();
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
