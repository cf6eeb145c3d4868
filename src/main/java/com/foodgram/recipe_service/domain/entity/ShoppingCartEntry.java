package com.foodgram.recipe_service.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Рецепт, добавленный пользователем в список покупок.
 * Пара (user, recipe) уникальна: повторное добавление отклоняется.
 */
@Entity
@Table(name = "shopping_cart", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"user_id", "recipe_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ShoppingCartEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id", nullable = false)
    private Recipe recipe;
}
