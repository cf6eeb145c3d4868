package com.foodgram.recipe_service.mapper;

import com.foodgram.recipe_service.domain.dto.recipe.RecipeMinifiedDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateRequestDto;
import com.foodgram.recipe_service.domain.dto.user.UserCreateResponseDto;
import com.foodgram.recipe_service.domain.dto.user.UserDto;
import com.foodgram.recipe_service.domain.dto.user.UserWithRecipesDto;
import com.foodgram.recipe_service.domain.entity.User;

import java.util.List;

public class UserMapper {

    // пароль передается уже закодированным
    public static User toEntity(UserCreateRequestDto dto, String encodedPassword) {
        if (dto == null) return null;
        return User.builder()
                .email(dto.getEmail())
                .username(dto.getUsername())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .password(encodedPassword)
                .build();
    }

    public static UserCreateResponseDto toCreateResponse(User user) {
        if (user == null) return null;
        return UserCreateResponseDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }

    public static UserDto toDto(User user, boolean isSubscribed) {
        if (user == null) return null;
        return UserDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(isSubscribed)
                .build();
    }

    public static UserWithRecipesDto toWithRecipesDto(User user, boolean isSubscribed,
                                                      List<RecipeMinifiedDto> recipes, long recipesCount) {
        if (user == null) return null;
        return UserWithRecipesDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(isSubscribed)
                .recipes(recipes)
                .recipesCount(recipesCount)
                .build();
    }
}
