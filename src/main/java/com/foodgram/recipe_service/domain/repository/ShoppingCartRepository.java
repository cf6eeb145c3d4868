package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.dto.cart.ShoppingListItemDto;
import com.foodgram.recipe_service.domain.entity.ShoppingCartEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface ShoppingCartRepository extends JpaRepository<ShoppingCartEntry, Long> {

    Optional<ShoppingCartEntry> findByUserIdAndRecipeId(Long userId, Long recipeId);

    boolean existsByUserIdAndRecipeId(Long userId, Long recipeId);

    boolean existsByUserId(Long userId);

    @Query("SELECT c.recipe.id FROM ShoppingCartEntry c WHERE c.user.id = :userId AND c.recipe.id IN :recipeIds")
    Set<Long> findRecipeIdsByUserIdAndRecipeIdIn(@Param("userId") Long userId,
                                                 @Param("recipeIds") Collection<Long> recipeIds);

    /**
     * Суммирует ингредиенты всех рецептов из корзины пользователя.
     * Строки группируются по паре (название, единица измерения), поэтому
     * один и тот же ингредиент из разных рецептов попадает в одну строку.
     */
    @Query("SELECT new com.foodgram.recipe_service.domain.dto.cart.ShoppingListItemDto("
            + "i.name, i.measurementUnit, SUM(ri.amount)) "
            + "FROM ShoppingCartEntry c "
            + "JOIN c.recipe r "
            + "JOIN r.ingredients ri "
            + "JOIN ri.ingredient i "
            + "WHERE c.user.id = :userId "
            + "GROUP BY i.name, i.measurementUnit "
            + "ORDER BY i.name ASC, i.measurementUnit ASC")
    List<ShoppingListItemDto> sumIngredientsByUserId(@Param("userId") Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ShoppingCartEntry c WHERE c.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
