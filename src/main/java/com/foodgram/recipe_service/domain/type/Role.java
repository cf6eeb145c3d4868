package com.foodgram.recipe_service.domain.type;

public enum Role {
    USER,
    ADMIN
}
