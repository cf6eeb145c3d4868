package com.foodgram.recipe_service.domain.repository;

import com.foodgram.recipe_service.domain.entity.Subscription;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByUserIdAndAuthorId(Long userId, Long authorId);

    boolean existsByUserIdAndAuthorId(Long userId, Long authorId);

    @EntityGraph(attributePaths = {"author"})
    Page<Subscription> findByUserIdOrderByIdDesc(Long userId, Pageable pageable);

    @Query("SELECT s.author.id FROM Subscription s WHERE s.user.id = :userId AND s.author.id IN :authorIds")
    Set<Long> findAuthorIdsByUserIdAndAuthorIdIn(@Param("userId") Long userId,
                                                 @Param("authorIds") Collection<Long> authorIds);
}
