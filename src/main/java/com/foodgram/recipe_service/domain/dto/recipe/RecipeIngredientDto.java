package com.foodgram.recipe_service.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientDto {
    // id ингредиента, а не строки рецепта
    private Long id;
    private String name;
    private String measurementUnit;
    private Integer amount;
}
