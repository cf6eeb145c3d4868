package com.foodgram.recipe_service.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.short-link")
@Getter @Setter
public class ShortLinkProperties {
    private int length = 6;
    // проверок занятости токена на одну генерацию
    private int maxAttempts = 10;
    private String recipePath = "/recipes/{id}/";

    public String recipePathFor(Long recipeId) {
        return recipePath.replace("{id}", String.valueOf(recipeId));
    }
}
