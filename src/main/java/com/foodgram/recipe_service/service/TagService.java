package com.foodgram.recipe_service.service;

import com.foodgram.recipe_service.domain.dto.tag.TagDto;
import com.foodgram.recipe_service.domain.entity.Tag;
import com.foodgram.recipe_service.domain.repository.TagRepository;
import com.foodgram.recipe_service.exception.CustomException;
import com.foodgram.recipe_service.exception.ErrorCode;
import com.foodgram.recipe_service.mapper.TagMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TagService {

    private static final Map<String, String> DEFAULT_TAGS = new LinkedHashMap<>();

    static {
        DEFAULT_TAGS.put("breakfast", "Завтрак");
        DEFAULT_TAGS.put("lunch", "Обед");
        DEFAULT_TAGS.put("dinner", "Ужин");
    }

    private final TagRepository tagRepository;

    public List<TagDto> findAll() {
        return tagRepository.findAll(Sort.by("id")).stream()
                .map(TagMapper::toDto)
                .toList();
    }

    public TagDto findById(Long id) {
        return tagRepository.findById(id)
                .map(TagMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }

    @Transactional
    public void createDefaultTags() {
        DEFAULT_TAGS.forEach((slug, name) -> {
            if (!tagRepository.existsBySlug(slug)) {
                tagRepository.save(Tag.builder().name(name).slug(slug).build());
                log.info("Добавлен тег по умолчанию: {}", slug);
            }
        });
    }
}
