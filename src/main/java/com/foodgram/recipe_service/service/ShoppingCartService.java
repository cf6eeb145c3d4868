package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.ShoppingCartEntry;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.domain.repository.ShoppingCartRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ShoppingCartService {

    private final ShoppingCartRepository shoppingCartRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    // повторное добавление отклоняется, а не игнорируется
    @Transactional
    public RecipeMinifiedDto addToCart(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (shoppingCartRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        shoppingCartRepository.save(ShoppingCartEntry.builder().user(user).recipe(recipe).build());
        return RecipeMapper.toMinifiedDto(recipe);
    }

    @Transactional
    public void removeFromCart(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        ShoppingCartEntry entry = shoppingCartRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_IN_SHOPPING_CART));
        shoppingCartRepository.delete(entry);
    }
}
