package com.foodgram.recipe_service.util;

import com.foodgram.recipe_service.config.ShortLinkProperties;
import com.foodgram.recipe_service.domain.repository.RecipeRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Генерирует короткий токен рецепта из символов [A-Za-z0-9].
 * <p>
 * Каждый кандидат проверяется на занятость; число проверок ограничено
 * {@code app.short-link.max-attempts}. Генератор ничего не пишет в базу,
 * окончательную уникальность обеспечивает ограничение на колонке short_link.
 */
@Slf4j
@Component
public class ShortLinkGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final RecipeRepository recipeRepository;
    private final ShortLinkProperties properties;
    private final Random random;

    @Autowired
    public ShortLinkGenerator(RecipeRepository recipeRepository, ShortLinkProperties properties) {
        this(recipeRepository, properties, new SecureRandom());
    }

    ShortLinkGenerator(RecipeRepository recipeRepository, ShortLinkProperties properties, Random random) {
        this.recipeRepository = recipeRepository;
        this.properties = properties;
        this.random = random;
    }

    public String generateUnique() {
        int maxAttempts = properties.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = randomToken();
            if (!recipeRepository.existsByShortLink(candidate)) {
                return candidate;
            }
            log.debug("Токен {} уже занят, попытка {}/{}", candidate, attempt, maxAttempts);
        }
        log.warn("Не удалось подобрать свободный токен за {} попыток", maxAttempts);
        throw new CustomException(ErrorCode.SHORT_LINK_GENERATION_FAILED);
    }

    String randomToken() {
        int length = properties.getLength();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
