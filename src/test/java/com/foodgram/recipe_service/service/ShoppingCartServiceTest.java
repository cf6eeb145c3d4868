package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.ShoppingCartEntry;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.domain.repository.ShoppingCartRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShoppingCartServiceTest {

    @Mock
    private ShoppingCartRepository shoppingCartRepository;
    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private ShoppingCartService shoppingCartService;

    private User user;
    private Recipe recipe;

    @BeforeEach
    void setUp() {
        user = User.builder().id(1L).build();
        recipe = Recipe.builder().id(10L).name("Суп").cookingTime(40).build();
    }

    @Test
    @DisplayName("addToCart: рецепт добавляется в корзину")
    void addToCart_saves() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(shoppingCartRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        assertEquals(10L, shoppingCartService.addToCart(1L, 10L).getId());
        verify(shoppingCartRepository, times(1)).save(any(ShoppingCartEntry.class));
    }

    @Test
    @DisplayName("addToCart: повторное добавление отклоняется, а не игнорируется")
    void addToCart_duplicate_rejected() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(shoppingCartRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> shoppingCartService.addToCart(1L, 10L));

        assertEquals(ErrorCode.ALREADY_IN_SHOPPING_CART, ex.getErrorCode());
        assertEquals(400, ex.getErrorCode().getStatus().value());
        verify(shoppingCartRepository, never()).save(any());
    }

    @Test
    @DisplayName("removeFromCart: рецепта нет в корзине - NOT_IN_SHOPPING_CART")
    void removeFromCart_absent_throws() {
        when(recipeRepository.existsById(10L)).thenReturn(true);
        when(shoppingCartRepository.findByUserIdAndRecipeId(1L, 10L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> shoppingCartService.removeFromCart(1L, 10L));

        assertEquals(ErrorCode.NOT_IN_SHOPPING_CART, ex.getErrorCode());
    }

    @Test
    @DisplayName("removeFromCart: несуществующий рецепт - RECIPE_NOT_FOUND")
    void removeFromCart_unknownRecipe_throws() {
        when(recipeRepository.existsById(99L)).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class, () -> shoppingCartService.removeFromCart(1L, 99L));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(shoppingCartRepository);
    }
}
