package com.foodgram.recipe_service.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeMinifiedDto {
    private Long id;
    private String name;
    private String image;
    private Integer cookingTime;
}
