package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.domain.dto.user.UserWithRecipesDto;
import com.foodgram.recipe_service.domain.entity.Subscription;
import com.foodgram.recipe_service.domain.entity.User;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.domain.repository.SubscriptionRepository;
import com.foodgram.recipe_service.domain.repository.UserRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.RecipeMapper;
import com.foodgram.recipe_service.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;

    @Transactional
    public UserWithRecipesDto subscribe(Long userId, Long authorId, @Nullable Integer recipesLimit) {
        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        if (userId.equals(authorId)) {
            throw new CustomException(ErrorCode.SELF_SUBSCRIPTION);
        }
        if (subscriptionRepository.existsByUserIdAndAuthorId(userId, authorId)) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        subscriptionRepository.save(Subscription.builder().user(user).author(author).build());
        return toWithRecipes(author, recipesLimit);
    }

    @Transactional
    public void unsubscribe(Long userId, Long authorId) {
        if (!userRepository.existsById(authorId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        Subscription subscription = subscriptionRepository.findByUserIdAndAuthorId(userId, authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_SUBSCRIBED));
        subscriptionRepository.delete(subscription);
    }

    @Transactional(readOnly = true)
    public Page<UserWithRecipesDto> getSubscriptions(Long userId, Pageable pageable, @Nullable Integer recipesLimit) {
        validateLimit(recipesLimit);
        return subscriptionRepository.findByUserIdOrderByIdDesc(userId, pageable)
                .map(subscription -> toWithRecipes(subscription.getAuthor(), recipesLimit));
    }

    private UserWithRecipesDto toWithRecipes(User author, @Nullable Integer recipesLimit) {
        validateLimit(recipesLimit);
        List<RecipeMinifiedDto> recipes;
        if (recipesLimit != null && recipesLimit == 0) {
            recipes = List.of();
        } else {
            Pageable limit = recipesLimit != null ? PageRequest.of(0, recipesLimit) : Pageable.unpaged();
            recipes = recipeRepository.findByAuthorIdOrderByIdDesc(author.getId(), limit).stream()
                    .map(RecipeMapper::toMinifiedDto)
                    .toList();
        }
        long recipesCount = recipeRepository.countByAuthorId(author.getId());
        return UserMapper.toWithRecipesDto(author, true, recipes, recipesCount);
    }

    private void validateLimit(@Nullable Integer recipesLimit) {
        if (recipesLimit != null && recipesLimit < 0) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "recipes_limit не может быть отрицательным.");
        }
    }
}
