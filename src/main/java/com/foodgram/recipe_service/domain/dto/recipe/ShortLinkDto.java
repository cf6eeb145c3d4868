package com.foodgram.recipe_service.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ShortLinkDto {

    @JsonProperty("short-link")
    private final String shortLink;
}
