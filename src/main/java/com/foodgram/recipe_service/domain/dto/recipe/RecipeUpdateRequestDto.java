package com.foodgram.recipe_service.domain.dto.recipe;

import com.foodgram.recipe_service.domain.entity.Recipe;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * Частичное обновление рецепта: поля со значением null не меняются.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeUpdateRequestDto {

    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    private List<Long> tags;

    private String image;

    @Size(min = 1, max = Recipe.NAME_MAX_LENGTH)
    private String name;

    @Size(min = 1, max = Recipe.TEXT_MAX_LENGTH)
    private String text;

    @Min(Recipe.MIN_COOKING_TIME)
    @Max(Recipe.MAX_COOKING_TIME)
    private Integer cookingTime;
}
