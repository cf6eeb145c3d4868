package com.foodgram.recipe_service.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "Пользователь не найден."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "102", "Пользователь с таким email уже существует."),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "103", "Пользователь с таким username уже существует."),
    FORBIDDEN_USERNAME(HttpStatus.BAD_REQUEST, "104", "Использовать имя 'me' в качестве username запрещено."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "105", "Учетные данные не были предоставлены."),
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST, "106", "Невозможно войти с предоставленными учетными данными."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "107", "Неверный текущий пароль."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "Рецепт не найден."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "Изменять и удалять рецепт может только его автор."),
    INGREDIENTS_REQUIRED(HttpStatus.BAD_REQUEST, "203", "Нужно указать хотя бы один ингредиент."),
    DUPLICATE_RECIPE_INGREDIENT(HttpStatus.BAD_REQUEST, "204", "Ингредиенты не должны повторяться."),
    TAGS_REQUIRED(HttpStatus.BAD_REQUEST, "205", "Нужно указать хотя бы один тег."),
    DUPLICATE_RECIPE_TAG(HttpStatus.BAD_REQUEST, "206", "Теги не должны повторяться."),
    ALREADY_FAVORITED_RECIPE(HttpStatus.BAD_REQUEST, "207", "Рецепт уже в избранном."),
    FAVORITE_NOT_FOUND(HttpStatus.BAD_REQUEST, "208", "Рецепта нет в избранном."),

    // --- Short link (300) ---
    SHORT_LINK_NOT_FOUND(HttpStatus.NOT_FOUND, "301", "Короткая ссылка не найдена."),
    SHORT_LINK_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "302", "Не удалось сгенерировать короткую ссылку."),

    // --- Ingredient / Tag (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "Ингредиент не найден."),
    UNKNOWN_INGREDIENT(HttpStatus.BAD_REQUEST, "402", "Указан несуществующий ингредиент."),
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "403", "Тег не найден."),
    UNKNOWN_TAG(HttpStatus.BAD_REQUEST, "404", "Указан несуществующий тег."),

    // --- Shopping cart (500) ---
    ALREADY_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "501", "Рецепт уже в списке покупок."),
    NOT_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "502", "Рецепта нет в списке покупок."),
    SHOPPING_CART_EMPTY(HttpStatus.BAD_REQUEST, "503", "Список покупок пуст."),

    // --- Subscription (600) ---
    SELF_SUBSCRIPTION(HttpStatus.BAD_REQUEST, "601", "Нельзя подписаться на самого себя."),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST, "602", "Вы уже подписаны на этого пользователя."),
    NOT_SUBSCRIBED(HttpStatus.BAD_REQUEST, "603", "Вы не подписаны на этого пользователя."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "Некорректные входные данные."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "Метод не поддерживается."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "Внутренняя ошибка сервера."),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "904", "Страница не найдена."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "905", "Нарушено ограничение целостности данных."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "906", "Неподдерживаемый Content-Type."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
