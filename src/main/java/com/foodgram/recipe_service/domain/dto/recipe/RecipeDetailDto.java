package com.foodgram.recipe_service.domain.dto.recipe;

import com.foodgram.recipe_service.domain.dto.tag.TagDto;
import com.foodgram.recipe_service.domain.dto.user.UserDto;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Полная информация о рецепте")
public class RecipeDetailDto {

    private Long id;
    private List<TagDto> tags;
    private UserDto author;
    private List<RecipeIngredientDto> ingredients;

    @Schema(description = "Рецепт в избранном у текущего пользователя")
    private Boolean isFavorited;

    @Schema(description = "Рецепт в списке покупок текущего пользователя")
    private Boolean isInShoppingCart;

    private String name;
    private String image;
    private String text;

    @Schema(description = "Время приготовления (в минутах)")
    private Integer cookingTime;
}
