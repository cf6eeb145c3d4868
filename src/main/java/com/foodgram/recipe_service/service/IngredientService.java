package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.ingredient.IngredientDto;
import com.foodgram.recipe_service.domain.entity.Ingredient;
import com.foodgram.recipe_service.domain.repository.IngredientRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.IngredientMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngredientService {

    private final IngredientRepository ingredientRepository;

    @Transactional(readOnly = true)
    public List<IngredientDto> search(String namePrefix) {
        List<Ingredient> found = StringUtils.hasText(namePrefix)
                ? ingredientRepository.findByNameStartingWithIgnoreCaseOrderByNameAsc(namePrefix.trim())
                : ingredientRepository.findAll(Sort.by("name"));
        return found.stream()
                .map(IngredientMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public IngredientDto findById(Long id) {
        return ingredientRepository.findById(id)
                .map(IngredientMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }

    /**
     * Загружает справочник ингредиентов из CSV вида {@code название,единица}.
     * Название может содержать запятые, поэтому строка делится по последней.
     * Уже существующие пары пропускаются.
     *
     * @return количество добавленных ингредиентов
     */
    @Transactional
    public int importFromCsv(Path path) throws IOException {
        List<Ingredient> toSave = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comma = line.lastIndexOf(',');
                if (comma <= 0 || comma == line.length() - 1) {
                    if (StringUtils.hasText(line)) {
                        log.warn("Пропущена строка без единицы измерения: '{}'", line);
                    }
                    continue;
                }
                String name = unquote(line.substring(0, comma).trim());
                String unit = unquote(line.substring(comma + 1).trim());
                if (!seen.add(name + '\u0000' + unit)
                        || ingredientRepository.existsByNameAndMeasurementUnit(name, unit)) {
                    skipped++;
                    continue;
                }
                toSave.add(Ingredient.builder().name(name).measurementUnit(unit).build());
            }
        }

        ingredientRepository.saveAll(toSave);
        log.info("Импорт ингредиентов из {}: добавлено {}, пропущено {}", path, toSave.size(), skipped);
        return toSave.size();
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"");
        }
        return value;
    }
}
