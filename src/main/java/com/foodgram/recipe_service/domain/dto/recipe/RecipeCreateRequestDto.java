package com.foodgram.recipe_service.domain.dto.recipe;

import com.foodgram.recipe_service.domain.entity.Recipe;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

/**
 * Создание рецепта
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeCreateRequestDto {

    @NotEmpty(message = "Нужно указать хотя бы один ингредиент.")
    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    @NotEmpty(message = "Нужно указать хотя бы один тег.")
    private List<Long> tags;

    private String image;

    @NotBlank(message = "Название рецепта обязательно.")
    @Size(max = Recipe.NAME_MAX_LENGTH)
    private String name;

    @NotBlank(message = "Описание рецепта обязательно.")
    @Size(max = Recipe.TEXT_MAX_LENGTH)
    private String text;

    @NotNull(message = "Время приготовления обязательно.")
    @Min(value = Recipe.MIN_COOKING_TIME, message = "Время приготовления должно быть не меньше 1 минуты.")
    @Max(value = Recipe.MAX_COOKING_TIME, message = "Время приготовления должно быть не больше 32000 минут.")
    private Integer cookingTime;
}
