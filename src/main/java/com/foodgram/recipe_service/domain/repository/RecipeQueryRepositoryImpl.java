package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.recipe_service.domain.entity.QRecipe;
import com.foodgram.recipe_service.domain.entity.QRecipeFavorite;
import com.foodgram.recipe_service.domain.entity.QShoppingCartEntry;
import com.foodgram.recipe_service.domain.entity.Recipe;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.JPAExpressions;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.util.StringUtils;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    @Override
    public Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId) {
        QRecipe recipe = QRecipe.recipe;

        BooleanExpression[] conditions = {
                authorEq(cond.getAuthor()),
                tagSlugIn(cond.getTags()),
                favoritedBy(cond.getIsFavorited(), currentUserId),
                inShoppingCartOf(cond.getIsInShoppingCart(), currentUserId),
                nameOrTextContains(cond.getSearch())
        };

        List<Recipe> content = queryFactory
                .selectFrom(recipe)
                .join(recipe.author).fetchJoin()
                .where(conditions)
                .orderBy(recipe.id.desc())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        Long total = queryFactory
                .select(recipe.count())
                .from(recipe)
                .where(conditions)
                .fetchOne();

        return new PageImpl<>(content, pageable, total != null ? total : 0L);
    }

    private BooleanExpression authorEq(Long authorId) {
        return authorId != null ? QRecipe.recipe.author.id.eq(authorId) : null;
    }

    private BooleanExpression tagSlugIn(List<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            return null;
        }
        return QRecipe.recipe.tags.any().slug.in(slugs);
    }

    private BooleanExpression favoritedBy(Boolean flag, Long userId) {
        if (flag == null || userId == null) {
            return null;
        }
        QRecipeFavorite favorite = QRecipeFavorite.recipeFavorite;
        BooleanExpression exists = JPAExpressions.selectOne()
                .from(favorite)
                .where(favorite.recipe.id.eq(QRecipe.recipe.id), favorite.user.id.eq(userId))
                .exists();
        return flag ? exists : exists.not();
    }

    private BooleanExpression inShoppingCartOf(Boolean flag, Long userId) {
        if (flag == null || userId == null) {
            return null;
        }
        QShoppingCartEntry cart = QShoppingCartEntry.shoppingCartEntry;
        BooleanExpression exists = JPAExpressions.selectOne()
                .from(cart)
                .where(cart.recipe.id.eq(QRecipe.recipe.id), cart.user.id.eq(userId))
                .exists();
        return flag ? exists : exists.not();
    }

    private BooleanExpression nameOrTextContains(String search) {
        if (!StringUtils.hasText(search)) {
            return null;
        }
        return QRecipe.recipe.name.containsIgnoreCase(search)
                .or(QRecipe.recipe.text.containsIgnoreCase(search));
    }
}
