package com.foodgram.recipe_service.mapper;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeDetailDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeIngredientDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.domain.dto.tag.TagDto;
import com.foodgram.recipe_service.domain.dto.user.UserDto;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.Tag;
import com.foodgram.recipe_service.domain.entity.User;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto, User author, Set<Tag> tags) {
        Recipe recipe = Recipe.builder()
                .author(author)
                .name(dto.getName())
                .text(dto.getText())
                .cookingTime(dto.getCookingTime())
                .image(dto.getImage())
                .build();
        recipe.replaceTags(tags);
        return recipe;
    }

    public static RecipeDetailDto toDetailDto(Recipe recipe,
                                              UserDto author,
                                              List<RecipeIngredientDto> ingredients,
                                              boolean isFavorited,
                                              boolean isInShoppingCart) {
        List<TagDto> tags = recipe.getTags().stream()
                .sorted(Comparator.comparing(Tag::getId))
                .map(TagMapper::toDto)
                .toList();

        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .tags(tags)
                .author(author)
                .ingredients(ingredients)
                .isFavorited(isFavorited)
                .isInShoppingCart(isInShoppingCart)
                .name(recipe.getName())
                .image(recipe.getImage())
                .text(recipe.getText())
                .cookingTime(recipe.getCookingTime())
                .build();
    }

    public static RecipeMinifiedDto toMinifiedDto(Recipe recipe) {
        if (recipe == null) return null;
        return RecipeMinifiedDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .image(recipe.getImage())
                .cookingTime(recipe.getCookingTime())
                .build();
    }
}
