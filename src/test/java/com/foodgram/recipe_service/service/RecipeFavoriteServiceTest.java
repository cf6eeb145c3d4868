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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeFavoriteServiceTest {

    @Mock
    private RecipeFavoriteRepository favoriteRepository;
    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private RecipeFavoriteService favoriteService;

    private User user;
    private Recipe recipe;

    @BeforeEach
    void setUp() {
        user = User.builder().id(1L).build();
        recipe = Recipe.builder().id(10L).name("Блины").cookingTime(20).image("pancakes.png").build();
    }

    @Test
    @DisplayName("addFavorite: новый рецепт сохраняется и возвращается в кратком виде")
    void addFavorite_savesAndReturnsMinified() {
        when(recipeRepository.findById(recipe.getId())).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(user.getId(), recipe.getId())).thenReturn(false);
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

        RecipeMinifiedDto result = favoriteService.addFavorite(user.getId(), recipe.getId());

        ArgumentCaptor<RecipeFavorite> captor = ArgumentCaptor.forClass(RecipeFavorite.class);
        verify(favoriteRepository, times(1)).save(captor.capture());
        assertSame(user, captor.getValue().getUser());
        assertSame(recipe, captor.getValue().getRecipe());

        assertEquals(10L, result.getId());
        assertEquals("Блины", result.getName());
        assertEquals("pancakes.png", result.getImage());
        assertEquals(20, result.getCookingTime());
    }

    @Test
    @DisplayName("addFavorite: повторное добавление дает ALREADY_FAVORITED_RECIPE")
    void addFavorite_duplicate_throws() {
        when(recipeRepository.findById(recipe.getId())).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(user.getId(), recipe.getId())).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> favoriteService.addFavorite(user.getId(), recipe.getId()));

        assertEquals(ErrorCode.ALREADY_FAVORITED_RECIPE, ex.getErrorCode());
        verify(favoriteRepository, never()).save(any());
    }

    @Test
    @DisplayName("addFavorite: несуществующий рецепт дает RECIPE_NOT_FOUND")
    void addFavorite_unknownRecipe_throws() {
        when(recipeRepository.findById(99L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> favoriteService.addFavorite(user.getId(), 99L));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(favoriteRepository, userRepository);
    }

    @Test
    @DisplayName("removeFavorite: существующая запись удаляется")
    void removeFavorite_deletes() {
        RecipeFavorite existing = RecipeFavorite.builder().id(100L).user(user).recipe(recipe).build();
        when(recipeRepository.existsById(recipe.getId())).thenReturn(true);
        when(favoriteRepository.findByUserIdAndRecipeId(user.getId(), recipe.getId()))
                .thenReturn(Optional.of(existing));

        favoriteService.removeFavorite(user.getId(), recipe.getId());

        verify(favoriteRepository, times(1)).delete(existing);
    }

    @Test
    @DisplayName("removeFavorite: рецепта нет в избранном - FAVORITE_NOT_FOUND")
    void removeFavorite_absent_throws() {
        when(recipeRepository.existsById(recipe.getId())).thenReturn(true);
        when(favoriteRepository.findByUserIdAndRecipeId(user.getId(), recipe.getId()))
                .thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> favoriteService.removeFavorite(user.getId(), recipe.getId()));

        assertEquals(ErrorCode.FAVORITE_NOT_FOUND, ex.getErrorCode());
        verify(favoriteRepository, never()).delete(any());
    }
}
