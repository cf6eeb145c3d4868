package com.foodgram.recipe_service.domain.dto.recipe;

import com.foodgram.recipe_service.domain.entity.RecipeIngredient;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeIngredientRequestDto {

    @NotNull(message = "Не указан ингредиент.")
    private Long id;

    @NotNull(message = "Не указано количество.")
    @Min(value = RecipeIngredient.MIN_AMOUNT, message = "Количество должно быть не меньше 1.")
    @Max(value = RecipeIngredient.MAX_AMOUNT, message = "Количество должно быть не больше 32000.")
    private Integer amount;
}
