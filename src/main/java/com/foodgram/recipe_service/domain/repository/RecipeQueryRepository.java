package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.recipe_service.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RecipeQueryRepository {

    Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId);
}
