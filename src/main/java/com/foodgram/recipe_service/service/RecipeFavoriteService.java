package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.RecipeFavorite;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.RecipeFavoriteRepository;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RecipeFavoriteService {

    private final RecipeFavoriteRepository favoriteRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeMinifiedDto addFavorite(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (favoriteRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        favoriteRepository.save(RecipeFavorite.builder().user(user).recipe(recipe).build());
        return RecipeMapper.toMinifiedDto(recipe);
    }

    @Transactional
    public void removeFavorite(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        RecipeFavorite favorite = favoriteRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.FAVORITE_NOT_FOUND));
        favoriteRepository.delete(favorite);
    }
}
