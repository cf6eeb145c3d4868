package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.recipe.*;
import com.foodgram.recipe_service.domain.entity.*;
import com.foodgram.recipe_service.domain.repository.*;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.RecipeIngredientMapper;
import com.foodgram.recipe_service.mapper.RecipeMapper;
import com.foodgram.recipe_service.mapper.UserMapper;
import com.foodgram.recipe_service.util.ShortLinkGenerator;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    static final String SHORT_LINK_SAVE_RETRY = "shortLinkSave";

    private final RecipeRepository recipeRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;
    private final IngredientRepository ingredientRepository;
    private final TagRepository tagRepository;
    private final UserRepository userRepository;
    private final RecipeFavoriteRepository favoriteRepository;
    private final ShoppingCartRepository shoppingCartRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ShortLinkGenerator shortLinkGenerator;

    /**
     * Создает рецепт и сразу выдает ему короткую ссылку.
     * <p>
     * Токен проверяется генератором, но гонку двух параллельных сохранений
     * ловит только уникальный индекс. Все прочие ограничения проверяются
     * заранее, поэтому {@link DataIntegrityViolationException} здесь означает
     * занятый токен: попытка повторяется в новой транзакции с новым токеном.
     * Если все попытки исчерпаны, исключение уходит клиенту как 409.
     */
    @Retry(name = SHORT_LINK_SAVE_RETRY)
    @Transactional
    public RecipeDetailDto createRecipe(Long userId, RecipeCreateRequestDto dto) {
        User author = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        Map<Long, Ingredient> ingredients = loadIngredients(dto.getIngredients());
        Set<Tag> tags = loadTags(dto.getTags());

        Recipe recipe = RecipeMapper.toEntity(dto, author, tags);
        recipe.assignShortLink(shortLinkGenerator.generateUnique());
        recipeRepository.saveAndFlush(recipe);

        List<RecipeIngredient> rows = saveIngredients(recipe, dto.getIngredients(), ingredients);
        log.info("Создан рецепт id={} автором id={}", recipe.getId(), userId);

        return RecipeMapper.toDetailDto(
                recipe,
                UserMapper.toDto(author, false),
                rows.stream().map(RecipeIngredientMapper::toDto).toList(),
                false,
                false
        );
    }

    @Transactional
    public RecipeDetailDto updateRecipe(Long userId, Long recipeId, RecipeUpdateRequestDto dto) {
        Recipe recipe = getOwnedRecipe(userId, recipeId);

        Map<Long, Ingredient> ingredients = dto.getIngredients() != null
                ? loadIngredients(dto.getIngredients())
                : null;

        recipe.update(dto.getName(), dto.getText(), dto.getCookingTime(), dto.getImage());
        if (dto.getTags() != null) {
            recipe.replaceTags(loadTags(dto.getTags()));
        }

        if (ingredients != null) {
            // удаление сбрасывает контекст, поэтому рецепт берется заново
            recipeIngredientRepository.deleteByRecipeId(recipeId);
            Recipe managed = recipeRepository.getReferenceById(recipeId);
            saveIngredients(managed, dto.getIngredients(), ingredients);
        }

        log.info("Обновлен рецепт id={}", recipeId);
        return getRecipe(recipeId, userId);
    }

    @Transactional
    public void deleteRecipe(Long userId, Long recipeId) {
        getOwnedRecipe(userId, recipeId);

        favoriteRepository.deleteByRecipeId(recipeId);
        shoppingCartRepository.deleteByRecipeId(recipeId);
        recipeIngredientRepository.deleteByRecipeId(recipeId);
        recipeRepository.deleteById(recipeId);

        log.info("Удален рецепт id={} автором id={}", recipeId, userId);
    }

    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipe(Long recipeId, @Nullable Long currentUserId) {
        Recipe recipe = recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        List<RecipeIngredientDto> ingredients = recipeIngredientRepository.findByRecipeIdWithIngredient(recipeId)
                .stream()
                .map(RecipeIngredientMapper::toDto)
                .toList();

        boolean isFavorited = false;
        boolean isInShoppingCart = false;
        boolean isSubscribed = false;
        if (currentUserId != null) {
            isFavorited = favoriteRepository.existsByUserIdAndRecipeId(currentUserId, recipeId);
            isInShoppingCart = shoppingCartRepository.existsByUserIdAndRecipeId(currentUserId, recipeId);
            isSubscribed = subscriptionRepository.existsByUserIdAndAuthorId(currentUserId, recipe.getAuthor().getId());
        }

        return RecipeMapper.toDetailDto(recipe, UserMapper.toDto(recipe.getAuthor(), isSubscribed),
                ingredients, isFavorited, isInShoppingCart);
    }

    @Transactional(readOnly = true)
    public Page<RecipeDetailDto> searchRecipes(RecipeSearchCondition cond, Pageable pageable,
                                               @Nullable Long currentUserId) {
        Page<Recipe> page = recipeRepository.search(cond, pageable, currentUserId);

        Set<Long> favorited = Collections.emptySet();
        Set<Long> inCart = Collections.emptySet();
        Set<Long> subscribed = Collections.emptySet();
        if (currentUserId != null && page.hasContent()) {
            List<Long> recipeIds = page.getContent().stream().map(Recipe::getId).toList();
            Set<Long> authorIds = page.getContent().stream()
                    .map(r -> r.getAuthor().getId())
                    .collect(Collectors.toSet());
            favorited = favoriteRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
            inCart = shoppingCartRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
            subscribed = subscriptionRepository.findAuthorIdsByUserIdAndAuthorIdIn(currentUserId, authorIds);
        }

        Set<Long> favoritedIds = favorited;
        Set<Long> cartIds = inCart;
        Set<Long> subscribedIds = subscribed;
        return page.map(recipe -> RecipeMapper.toDetailDto(
                recipe,
                UserMapper.toDto(recipe.getAuthor(), subscribedIds.contains(recipe.getAuthor().getId())),
                recipe.getIngredients().stream()
                        .sorted(Comparator.comparing(RecipeIngredient::getId))
                        .map(RecipeIngredientMapper::toDto)
                        .toList(),
                favoritedIds.contains(recipe.getId()),
                cartIds.contains(recipe.getId())
        ));
    }

    /**
     * Возвращает токен короткой ссылки рецепта. Рецептам без токена
     * (созданным до появления коротких ссылок) токен выдается при первом запросе.
     */
    @Transactional
    public String getShortLinkToken(Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (recipe.getShortLink() != null) {
            return recipe.getShortLink();
        }
        String token = shortLinkGenerator.generateUnique();
        if (recipeRepository.assignShortLinkIfAbsent(recipeId, token) == 0) {
            // токен успел выдать параллельный запрос
            return recipeRepository.findShortLinkById(recipeId)
                    .orElseThrow(() -> new CustomException(ErrorCode.SHORT_LINK_GENERATION_FAILED));
        }
        log.info("Рецепту id={} выдана короткая ссылка", recipeId);
        return token;
    }

    @Transactional(readOnly = true)
    public Long resolveShortLink(String token) {
        return recipeRepository.findIdByShortLink(token)
                .orElseThrow(() -> new CustomException(ErrorCode.SHORT_LINK_NOT_FOUND));
    }

    private Recipe getOwnedRecipe(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (!recipe.isAuthoredBy(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
        return recipe;
    }

    private Map<Long, Ingredient> loadIngredients(List<RecipeIngredientRequestDto> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new CustomException(ErrorCode.INGREDIENTS_REQUIRED);
        }
        Set<Long> ids = requested.stream()
                .map(RecipeIngredientRequestDto::getId)
                .collect(Collectors.toSet());
        if (ids.size() != requested.size()) {
            throw new CustomException(ErrorCode.DUPLICATE_RECIPE_INGREDIENT);
        }

        Map<Long, Ingredient> found = ingredientRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));
        if (found.size() != ids.size()) {
            throw new CustomException(ErrorCode.UNKNOWN_INGREDIENT);
        }
        return found;
    }

    private Set<Tag> loadTags(List<Long> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new CustomException(ErrorCode.TAGS_REQUIRED);
        }
        Set<Long> ids = new HashSet<>(requested);
        if (ids.size() != requested.size()) {
            throw new CustomException(ErrorCode.DUPLICATE_RECIPE_TAG);
        }

        List<Tag> found = tagRepository.findAllById(ids);
        if (found.size() != ids.size()) {
            throw new CustomException(ErrorCode.UNKNOWN_TAG);
        }
        return new HashSet<>(found);
    }

    private List<RecipeIngredient> saveIngredients(Recipe recipe,
                                                   List<RecipeIngredientRequestDto> requested,
                                                   Map<Long, Ingredient> ingredients) {
        List<RecipeIngredient> rows = requested.stream()
                .map(dto -> RecipeIngredientMapper.toEntity(dto, recipe, ingredients.get(dto.getId())))
                .toList();
        return recipeIngredientRepository.saveAll(rows);
    }
}
