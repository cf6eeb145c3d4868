package com.foodgram.recipe_service.config;

import com.foodgram.recipe_service.service.TagService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DefaultTagRunner implements ApplicationRunner {

    private final TagService tagService;

    @Override
    public void run(ApplicationArguments args) {
        tagService.createDefaultTags();
    }
}
