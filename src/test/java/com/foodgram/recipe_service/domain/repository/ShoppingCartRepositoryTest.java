package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.config.QuerydslConfig;
import com.foodgram.recipe_service.domain.dto.cart.ShoppingListItemDto;
import com.foodgram.recipe_service.domain.entity.*;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(QuerydslConfig.class)
@ActiveProfiles("test")
class ShoppingCartRepositoryTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private ShoppingCartRepository shoppingCartRepository;

    private User user;
    private Ingredient flour;
    private Ingredient egg;

    @BeforeEach
    void setUp() {
        user = em.persist(user("cook@example.com", "cook"));
        flour = em.persist(Ingredient.builder().name("flour").measurementUnit("g").build());
        egg = em.persist(Ingredient.builder().name("egg").measurementUnit("pcs").build());
    }

    @Test
    @DisplayName("Один ингредиент из разных рецептов суммируется в одну строку")
    void sumIngredientsByUserId_sumsAcrossRecipes() {
        Recipe a = recipe("A");
        Recipe b = recipe("B");
        addIngredient(a, flour, 200);
        addIngredient(b, flour, 300);
        addIngredient(b, egg, 2);
        addToCart(user, a);
        addToCart(user, b);
        em.flush();
        em.clear();

        List<ShoppingListItemDto> items = shoppingCartRepository.sumIngredientsByUserId(user.getId());

        assertThat(items).containsExactly(
                new ShoppingListItemDto("egg", "pcs", 2L),
                new ShoppingListItemDto("flour", "g", 500L)
        );
    }

    @Test
    @DisplayName("Одинаковое название с разными единицами дает разные строки")
    void sumIngredientsByUserId_groupsByNameAndUnit() {
        Ingredient flourKg = em.persist(Ingredient.builder().name("flour").measurementUnit("kg").build());
        Recipe a = recipe("A");
        Recipe b = recipe("B");
        addIngredient(a, flour, 200);
        addIngredient(b, flourKg, 1);
        addToCart(user, a);
        addToCart(user, b);
        em.flush();

        List<ShoppingListItemDto> items = shoppingCartRepository.sumIngredientsByUserId(user.getId());

        assertThat(items).extracting(ShoppingListItemDto::getMeasurementUnit).containsExactly("g", "kg");
    }

    @Test
    @DisplayName("Рецепты чужой корзины не попадают в список")
    void sumIngredientsByUserId_ignoresOtherUsers() {
        User other = em.persist(user("other@example.com", "other"));
        Recipe a = recipe("A");
        addIngredient(a, flour, 200);
        addToCart(other, a);
        em.flush();

        assertThat(shoppingCartRepository.existsByUserId(user.getId())).isFalse();
        assertThat(shoppingCartRepository.sumIngredientsByUserId(user.getId())).isEmpty();
    }

    @Test
    @DisplayName("Повторное добавление рецепта в корзину нарушает уникальность")
    void duplicateCartEntry_violatesUniqueConstraint() {
        Recipe a = recipe("A");
        addToCart(user, a);
        em.flush();

        assertThatThrownBy(() -> {
            em.persist(ShoppingCartEntry.builder().user(user).recipe(a).build());
            em.flush();
        }).isInstanceOf(PersistenceException.class);
    }

    private User user(String email, String username) {
        return User.builder()
                .email(email)
                .username(username)
                .firstName("Имя")
                .lastName("Фамилия")
                .password("{noop}password")
                .build();
    }

    private Recipe recipe(String name) {
        return em.persist(Recipe.builder()
                .author(user)
                .name(name)
                .text("text")
                .cookingTime(10)
                .build());
    }

    private void addIngredient(Recipe recipe, Ingredient ingredient, int amount) {
        em.persist(RecipeIngredient.builder().recipe(recipe).ingredient(ingredient).amount(amount).build());
    }

    private void addToCart(User owner, Recipe recipe) {
        em.persist(ShoppingCartEntry.builder().user(owner).recipe(recipe).build());
    }
}
