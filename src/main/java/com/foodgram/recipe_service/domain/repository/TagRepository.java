package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.entity.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TagRepository extends JpaRepository<Tag, Long> {

    boolean existsBySlug(String slug);
}
