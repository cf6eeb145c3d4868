package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.entity.Recipe;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    boolean existsByShortLink(String shortLink);

    @Query("SELECT r.id FROM Recipe r WHERE r.shortLink = :shortLink")
    Optional<Long> findIdByShortLink(@Param("shortLink") String shortLink);

    @EntityGraph(attributePaths = {"author"})
    @Query("SELECT r FROM Recipe r WHERE r.id = :id")
    Optional<Recipe> findWithAuthorById(@Param("id") Long id);

    @Query("SELECT r.shortLink FROM Recipe r WHERE r.id = :id")
    Optional<String> findShortLinkById(@Param("id") Long id);

    // short_link не обновляется через сущность, поэтому выдача токена старому рецепту идет отдельным запросом
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE recipes SET short_link = :shortLink WHERE id = :id AND short_link IS NULL", nativeQuery = true)
    int assignShortLinkIfAbsent(@Param("id") Long id, @Param("shortLink") String shortLink);

    List<Recipe> findByAuthorIdOrderByIdDesc(Long authorId, Pageable pageable);

    long countByAuthorId(Long authorId);
}
