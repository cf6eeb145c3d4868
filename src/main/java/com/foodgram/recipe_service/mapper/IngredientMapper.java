package com.foodgram.recipe_service.mapper;

import com.foodgram.recipe_service.domain.dto.ingredient.IngredientDto;
import com.foodgram.recipe_service.domain.entity.Ingredient;

public class IngredientMapper {

    public static IngredientDto toDto(Ingredient ingredient) {
        if (ingredient == null) return null;
        return IngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .build();
    }
}
