package com.foodgram.recipe_service.config;

import com.foodgram.recipe_service.service.IngredientService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
@ConditionalOnProperty(prefix = "app.ingredients", name = "import-path")
@RequiredArgsConstructor
public class IngredientImportRunner implements ApplicationRunner {

    private final IngredientService ingredientService;

    @Value("${app.ingredients.import-path}")
    private String importPath;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        ingredientService.importFromCsv(Path.of(importPath));
    }
}
