package com.foodgram.recipe_service.domain.dto.recipe;

import lombok.*;

import java.util.List;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeSearchCondition {
    private Long author;
    private List<String> tags;
    private Boolean isFavorited;
    private Boolean isInShoppingCart;
    private String search;
}
