package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.user.UserWithRecipesDto;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.foodgram.recipe_service.domain.entity.Subscription;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.domain.repository.SubscriptionRepository;
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
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private RecipeRepository recipeRepository;

    @InjectMocks
    private SubscriptionService subscriptionService;

    private User reader;
    private User author;

    @BeforeEach
    void setUp() {
        reader = User.builder().id(1L).username("reader").build();
        author = User.builder().id(2L).username("author").email("author@example.com").build();
    }

    @Test
    @DisplayName("subscribe: подписка создается, рецепты автора обрезаются по recipes_limit")
    void subscribe_success() {
        Recipe recipe = Recipe.builder().id(7L).name("Суп").cookingTime(30).build();
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));
        when(userRepository.findById(1L)).thenReturn(Optional.of(reader));
        when(subscriptionRepository.existsByUserIdAndAuthorId(1L, 2L)).thenReturn(false);
        when(recipeRepository.findByAuthorIdOrderByIdDesc(eq(2L), eq(PageRequest.of(0, 1)))).thenReturn(List.of(recipe));
        when(recipeRepository.countByAuthorId(2L)).thenReturn(3L);

        UserWithRecipesDto result = subscriptionService.subscribe(1L, 2L, 1);

        verify(subscriptionRepository, times(1)).save(any(Subscription.class));
        assertEquals(2L, result.getId());
        assertTrue(result.getIsSubscribed());
        assertEquals(1, result.getRecipes().size());
        assertEquals(3L, result.getRecipesCount());
    }

    @Test
    @DisplayName("subscribe: на себя подписаться нельзя")
    void subscribe_self_throws() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(reader));

        CustomException ex = assertThrows(CustomException.class, () -> subscriptionService.subscribe(1L, 1L, null));

        assertEquals(ErrorCode.SELF_SUBSCRIPTION, ex.getErrorCode());
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    @DisplayName("subscribe: повторная подписка отклоняется")
    void subscribe_duplicate_throws() {
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));
        when(subscriptionRepository.existsByUserIdAndAuthorId(1L, 2L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> subscriptionService.subscribe(1L, 2L, null));

        assertEquals(ErrorCode.ALREADY_SUBSCRIBED, ex.getErrorCode());
    }

    @Test
    @DisplayName("unsubscribe: без подписки - NOT_SUBSCRIBED")
    void unsubscribe_notSubscribed_throws() {
        when(userRepository.existsById(2L)).thenReturn(true);
        when(subscriptionRepository.findByUserIdAndAuthorId(1L, 2L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> subscriptionService.unsubscribe(1L, 2L));

        assertEquals(ErrorCode.NOT_SUBSCRIBED, ex.getErrorCode());
    }

    @Test
    @DisplayName("getSubscriptions: отрицательный recipes_limit отклоняется")
    void getSubscriptions_negativeLimit_throws() {
        CustomException ex = assertThrows(CustomException.class,
                () -> subscriptionService.getSubscriptions(1L, PageRequest.of(0, 6), -1));

        assertEquals(ErrorCode.INVALID_INPUT_VALUE, ex.getErrorCode());
        verifyNoInteractions(subscriptionRepository);
    }
}
