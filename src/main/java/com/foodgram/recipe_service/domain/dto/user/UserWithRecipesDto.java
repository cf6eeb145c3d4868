package com.foodgram.recipe_service.domain.dto.user;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder
@NoArgsConstructor
@Schema(description = "Автор из подписок вместе с его рецептами")
public class UserWithRecipesDto extends UserDto {

    private List<RecipeMinifiedDto> recipes;

    @Schema(description = "Общее количество рецептов автора")
    private Long recipesCount;
}
