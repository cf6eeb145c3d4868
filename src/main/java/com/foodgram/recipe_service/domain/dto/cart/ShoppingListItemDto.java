package com.foodgram.recipe_service.domain.dto.cart;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Одна строка списка покупок: суммарное количество ингредиента
 * по всем рецептам корзины.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ShoppingListItemDto {

    private final String name;
    private final String measurementUnit;
    private final long totalAmount;

    public ShoppingListItemDto(String name, String measurementUnit, Long totalAmount) {
        this.name = name;
        this.measurementUnit = measurementUnit;
        this.totalAmount = totalAmount != null ? totalAmount : 0L;
    }
}
