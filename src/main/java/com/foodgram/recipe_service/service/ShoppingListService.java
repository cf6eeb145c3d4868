package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.cart.ShoppingListDto;
import com.foodgram.recipe_service.domain.dto.cart.ShoppingListItemDto;
import com.foodgram.recipe_service.domain.repository.ShoppingCartRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Сводный список покупок пользователя.
 * <p>
 * Ингредиенты всех рецептов корзины суммируются по паре
 * (название, единица измерения) и сортируются по названию, затем по единице.
 * Сервис только читает данные: повторный вызов без изменений корзины
 * дает тот же результат побайтно.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ShoppingListService {

    static final String HEADER = "Список покупок:";

    private final ShoppingCartRepository shoppingCartRepository;

    public ShoppingListDto buildShoppingList(Long userId) {
        if (!shoppingCartRepository.existsByUserId(userId)) {
            return ShoppingListDto.empty();
        }
        return new ShoppingListDto(shoppingCartRepository.sumIngredientsByUserId(userId));
    }

    public String render(ShoppingListDto list) {
        StringBuilder sb = new StringBuilder(HEADER).append("\n\n");
        for (ShoppingListItemDto item : list.getItems()) {
            sb.append(item.getName())
                    .append(" (").append(item.getMeasurementUnit()).append("): ")
                    .append(item.getTotalAmount())
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * @throws CustomException {@link ErrorCode#SHOPPING_CART_EMPTY}, если в корзине нет рецептов
     */
    public String downloadShoppingList(Long userId) {
        ShoppingListDto list = buildShoppingList(userId);
        if (list.isEmpty()) {
            throw new CustomException(ErrorCode.SHOPPING_CART_EMPTY);
        }
        log.debug("Список покупок пользователя id={}: {} позиций", userId, list.getItems().size());
        return render(list);
    }
}
