package com.foodgram.recipe_service.domain.dto.cart;

import lombok.Getter;

import java.util.List;

@Getter
public class ShoppingListDto {

    private final List<ShoppingListItemDto> items;

    public ShoppingListDto(List<ShoppingListItemDto> items) {
        this.items = List.copyOf(items);
    }

    public static ShoppingListDto empty() {
        return new ShoppingListDto(List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
