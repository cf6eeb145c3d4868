package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeDetailDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeIngredientRequestDto;
import com.foodgram.recipe_service.domain.dto.recipe.RecipeUpdateRequestDto;
import com.foodgram.recipe_service.domain.entity.*;
import com.foodgram.recipe_service.domain.repository.*;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.util.ShortLinkGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeServiceTest {

    @Mock private RecipeRepository recipeRepository;
    @Mock private RecipeIngredientRepository recipeIngredientRepository;
    @Mock private IngredientRepository ingredientRepository;
    @Mock private TagRepository tagRepository;
    @Mock private UserRepository userRepository;
    @Mock private RecipeFavoriteRepository favoriteRepository;
    @Mock private ShoppingCartRepository shoppingCartRepository;
    @Mock private SubscriptionRepository subscriptionRepository;
    @Mock private ShortLinkGenerator shortLinkGenerator;

    @InjectMocks
    private RecipeService recipeService;

    private User author;
    private Ingredient flour;
    private Tag breakfast;

    @BeforeEach
    void setUp() {
        author = User.builder().id(1L).username("author").build();
        flour = Ingredient.builder().id(3L).name("мука").measurementUnit("г").build();
        breakfast = Tag.builder().id(5L).name("Завтрак").slug("breakfast").build();
    }

    @Test
    @DisplayName("createRecipe: рецепт сохраняется с токеном от генератора")
    void createRecipe_assignsShortLink() {
        RecipeCreateRequestDto dto = createDto(List.of(new RecipeIngredientRequestDto(3L, 200)));
        when(userRepository.findById(1L)).thenReturn(Optional.of(author));
        when(ingredientRepository.findAllById(anyIterable())).thenReturn(List.of(flour));
        when(tagRepository.findAllById(anyIterable())).thenReturn(List.of(breakfast));
        when(shortLinkGenerator.generateUnique()).thenReturn("Ab3dE9");
        when(recipeRepository.saveAndFlush(any(Recipe.class))).thenAnswer(invocation -> {
            Recipe toSave = invocation.getArgument(0);
            Field idField = Recipe.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(toSave, 100L);
            return toSave;
        });
        when(recipeIngredientRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        RecipeDetailDto result = recipeService.createRecipe(1L, dto);

        ArgumentCaptor<Recipe> captor = ArgumentCaptor.forClass(Recipe.class);
        verify(recipeRepository, times(1)).saveAndFlush(captor.capture());
        assertEquals("Ab3dE9", captor.getValue().getShortLink());

        assertEquals(100L, result.getId());
        assertEquals(1, result.getIngredients().size());
        assertEquals(200, result.getIngredients().get(0).getAmount());
        assertEquals("мука", result.getIngredients().get(0).getName());
        assertFalse(result.getIsFavorited());
        assertFalse(result.getIsInShoppingCart());
    }

    @Test
    @DisplayName("createRecipe: повторяющиеся ингредиенты отклоняются до генерации токена")
    void createRecipe_duplicateIngredients_throws() {
        RecipeCreateRequestDto dto = createDto(List.of(
                new RecipeIngredientRequestDto(3L, 200),
                new RecipeIngredientRequestDto(3L, 100)
        ));
        when(userRepository.findById(1L)).thenReturn(Optional.of(author));

        CustomException ex = assertThrows(CustomException.class, () -> recipeService.createRecipe(1L, dto));

        assertEquals(ErrorCode.DUPLICATE_RECIPE_INGREDIENT, ex.getErrorCode());
        verifyNoInteractions(shortLinkGenerator);
        verify(recipeRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("createRecipe: несуществующий ингредиент дает 400, а не ошибку базы")
    void createRecipe_unknownIngredient_throws() {
        RecipeCreateRequestDto dto = createDto(List.of(new RecipeIngredientRequestDto(99L, 1)));
        when(userRepository.findById(1L)).thenReturn(Optional.of(author));
        when(ingredientRepository.findAllById(anyIterable())).thenReturn(List.of());

        CustomException ex = assertThrows(CustomException.class, () -> recipeService.createRecipe(1L, dto));

        assertEquals(ErrorCode.UNKNOWN_INGREDIENT, ex.getErrorCode());
        verify(recipeRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("updateRecipe: короткая ссылка не меняется при обновлении")
    void updateRecipe_keepsShortLink() {
        Recipe recipe = existingRecipe();
        when(recipeRepository.findWithAuthorById(10L)).thenReturn(Optional.of(recipe));

        RecipeUpdateRequestDto dto = RecipeUpdateRequestDto.builder()
                .name("Новое название")
                .cookingTime(25)
                .build();

        RecipeDetailDto result = recipeService.updateRecipe(1L, 10L, dto);

        assertEquals("Новое название", result.getName());
        assertEquals(25, result.getCookingTime());
        assertEquals("Xy12Ab", recipe.getShortLink());
        verifyNoInteractions(shortLinkGenerator);
    }

    @Test
    @DisplayName("updateRecipe: чужой рецепт менять нельзя")
    void updateRecipe_notAuthor_throws() {
        when(recipeRepository.findWithAuthorById(10L)).thenReturn(Optional.of(existingRecipe()));

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeService.updateRecipe(2L, 10L, new RecipeUpdateRequestDto()));

        assertEquals(ErrorCode.RECIPE_ACCESS_DENIED, ex.getErrorCode());
    }

    @Test
    @DisplayName("deleteRecipe: автор удаляет рецепт вместе со связанными записями")
    void deleteRecipe_byAuthor() {
        when(recipeRepository.findWithAuthorById(10L)).thenReturn(Optional.of(existingRecipe()));

        recipeService.deleteRecipe(1L, 10L);

        verify(favoriteRepository, times(1)).deleteByRecipeId(10L);
        verify(shoppingCartRepository, times(1)).deleteByRecipeId(10L);
        verify(recipeIngredientRepository, times(1)).deleteByRecipeId(10L);
        verify(recipeRepository, times(1)).deleteById(10L);
    }

    @Test
    @DisplayName("deleteRecipe: чужой рецепт удалить нельзя")
    void deleteRecipe_notAuthor_throws() {
        when(recipeRepository.findWithAuthorById(10L)).thenReturn(Optional.of(existingRecipe()));

        CustomException ex = assertThrows(CustomException.class, () -> recipeService.deleteRecipe(2L, 10L));

        assertEquals(ErrorCode.RECIPE_ACCESS_DENIED, ex.getErrorCode());
        verify(recipeRepository, never()).deleteById(anyLong());
    }

    @Test
    @DisplayName("resolveShortLink: неизвестный токен дает SHORT_LINK_NOT_FOUND")
    void resolveShortLink_unknown_throws() {
        when(recipeRepository.findIdByShortLink("nope00")).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> recipeService.resolveShortLink("nope00"));

        assertEquals(ErrorCode.SHORT_LINK_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("getShortLinkToken: существующий токен возвращается без генерации нового")
    void getShortLinkToken_existing() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(existingRecipe()));

        assertEquals("Xy12Ab", recipeService.getShortLinkToken(10L));
        verifyNoInteractions(shortLinkGenerator);
    }

    @Test
    @DisplayName("getShortLinkToken: рецепту без токена токен выдается один раз")
    void getShortLinkToken_backfillsMissing() {
        Recipe legacy = Recipe.builder().id(11L).author(author).name("Каша").text("Сварить").cookingTime(15).build();
        when(recipeRepository.findById(11L)).thenReturn(Optional.of(legacy));
        when(shortLinkGenerator.generateUnique()).thenReturn("Nw7Tok");
        when(recipeRepository.assignShortLinkIfAbsent(11L, "Nw7Tok")).thenReturn(1);

        assertEquals("Nw7Tok", recipeService.getShortLinkToken(11L));
        verify(recipeRepository, never()).saveAndFlush(any());
    }

    private RecipeCreateRequestDto createDto(List<RecipeIngredientRequestDto> ingredients) {
        return RecipeCreateRequestDto.builder()
                .ingredients(ingredients)
                .tags(List.of(5L))
                .name("Блины")
                .text("Смешать и пожарить")
                .cookingTime(20)
                .build();
    }

    private Recipe existingRecipe() {
        return Recipe.builder()
                .id(10L)
                .author(author)
                .name("Блины")
                .text("Смешать и пожарить")
                .cookingTime(20)
                .shortLink("Xy12Ab")
                .build();
    }
}
