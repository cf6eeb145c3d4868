package com.foodgram.recipe_service.controller;

import com.foodgram.recipe_service.domain.dto.tag.TagDto;
import com.foodgram.recipe_service.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tags")
@Tag(name = "Теги")
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "Список тегов")
    public ResponseEntity<List<TagDto>> getTags() {
        return ResponseEntity.ok(tagService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Тег по ID")
    public ResponseEntity<TagDto> getTag(@PathVariable Long id) {
        return ResponseEntity.ok(tagService.findById(id));
    }
}
