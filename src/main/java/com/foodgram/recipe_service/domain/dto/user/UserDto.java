package com.foodgram.recipe_service.domain.dto.user;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Пользователь")
public class UserDto {

    private String email;
    private Long id;
    private String username;
    private String firstName;
    private String lastName;

    @Schema(description = "Подписан ли текущий пользователь на этого пользователя")
    private Boolean isSubscribed;
}
