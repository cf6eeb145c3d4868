package com.foodgram.recipe_service.mapper;

import com.foodgram.recipe_service.domain.dto.tag.TagDto;
import com.foodgram.recipe_service.domain.entity.Tag;

public class TagMapper {

    public static TagDto toDto(Tag tag) {
        if (tag == null) return null;
        return TagDto.builder()
                .id(tag.getId())
                .name(tag.getName())
                .slug(tag.getSlug())
                .build();
    }
}
