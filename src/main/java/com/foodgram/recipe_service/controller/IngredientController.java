package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.ingredient.IngredientDto;
import com.foodgram.recipe_service.service.IngredientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ingredients")
@Tag(name = "Ингредиенты", description = "Справочник ингредиентов")
public class IngredientController {

    private final IngredientService ingredientService;

    @GetMapping
    @Operation(summary = "Поиск ингредиентов", description = "Поиск по началу названия без учета регистра.")
    public ResponseEntity<List<IngredientDto>> search(
            @Parameter(description = "Начало названия") @RequestParam(required = false) String name
    ) {
        return ResponseEntity.ok(ingredientService.search(name));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Ингредиент по ID")
    public ResponseEntity<IngredientDto> getIngredient(@PathVariable Long id) {
        return ResponseEntity.ok(ingredientService.findById(id));
    }
}
