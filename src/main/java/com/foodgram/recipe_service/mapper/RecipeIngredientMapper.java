package com.foodgram.recipe_service.mapper;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeIngredientDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeIngredientRequestDto;
import com.foodgram.recipe_service.domain.entity.Ingredient;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.RecipeIngredient;

public class RecipeIngredientMapper {

    public static RecipeIngredient toEntity(RecipeIngredientRequestDto dto, Recipe recipe, Ingredient ingredient) {
        return RecipeIngredient.builder()
                .recipe(recipe)
                .ingredient(ingredient)
                .amount(dto.getAmount())
                .build();
    }

    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        Ingredient ingredient = entity.getIngredient();
        return RecipeIngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .amount(entity.getAmount())
                .build();
    }
}
