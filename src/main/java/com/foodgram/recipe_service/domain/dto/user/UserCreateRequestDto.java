package com.foodgram.recipe_service.domain.dto.user;

import com.foodgram.recipe_service.domain.entity.User;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Регистрация пользователя")
public class UserCreateRequestDto {

    @NotBlank(message = "Email обязателен.")
    @Email(message = "Некорректный email.")
    @Size(max = User.EMAIL_MAX_LENGTH)
    private String email;

    @NotBlank(message = "Username обязателен.")
    @Size(max = User.NAME_MAX_LENGTH)
    @Pattern(regexp = "^[\\w.@+-]+$", message = "Username содержит недопустимые символы.")
    private String username;

    @NotBlank(message = "Имя обязательно.")
    @Size(max = User.NAME_MAX_LENGTH)
    private String firstName;

    @NotBlank(message = "Фамилия обязательна.")
    @Size(max = User.NAME_MAX_LENGTH)
    private String lastName;

    @NotBlank(message = "Пароль обязателен.")
    @Size(min = 8, max = 128, message = "Пароль должен содержать не менее 8 символов.")
    private String password;
}
