package com.foodgram.recipe_service.domain.entity;

import com.foodgram.recipe_service.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(
        name = "recipes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_recipes_short_link", columnNames = {"short_link"})
        },
        indexes = {
                @Index(name = "idx_author_id", columnList = "author_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    public static final int NAME_MAX_LENGTH = 256;
    public static final int TEXT_MAX_LENGTH = 5000;
    public static final int MIN_COOKING_TIME = 1;
    public static final int MAX_COOKING_TIME = 32_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    private User author;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(nullable = false, length = TEXT_MAX_LENGTH)
    private String text;

    @Column(name = "cooking_time", nullable = false)
    private Integer cookingTime;

    @Column(length = 512)
    private String image;

    // выдаётся один раз при первом сохранении
    @Column(name = "short_link", length = 16, updatable = false)
    private String shortLink;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "recipe_tags",
            joinColumns = @JoinColumn(name = "recipe_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id")
    )
    @BatchSize(size = 20)
    @Builder.Default
    private Set<Tag> tags = new HashSet<>();

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @BatchSize(size = 20)
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    public void assignShortLink(String shortLink) {
        if (this.shortLink != null) {
            throw new IllegalStateException("Короткая ссылка уже назначена рецепту " + id);
        }
        this.shortLink = shortLink;
    }

    public void update(String name, String text, Integer cookingTime, String image) {
        if (name != null) this.name = name;
        if (text != null) this.text = text;
        if (cookingTime != null) this.cookingTime = cookingTime;
        if (image != null) this.image = image;
    }

    public void replaceTags(Set<Tag> tags) {
        this.tags.clear();
        this.tags.addAll(tags);
    }

    public boolean isAuthoredBy(Long userId) {
        return author != null && author.getId().equals(userId);
    }
}
