package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.request.TagFacetRequest;
import com.example.comicshelf.api.request.TagModificationRequest;
import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.TagCountResponse;
import com.example.comicshelf.api.response.TagFacetResponse;
import com.example.comicshelf.api.response.TagModificationResponse;
import com.example.comicshelf.application.service.TagModificationService;
import com.example.comicshelf.application.service.TagTaxonomyService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tags")
public class TagController {

    private final TagTaxonomyService tagTaxonomyService;
    private final TagModificationService tagModificationService;

    public TagController(TagTaxonomyService tagTaxonomyService, TagModificationService tagModificationService) {
        this.tagTaxonomyService = tagTaxonomyService;
        this.tagModificationService = tagModificationService;
    }

    @GetMapping
    public ApiResponse<List<TagCountResponse>> listTags() {
        return ApiResponse.success(tagTaxonomyService.listTags());
    }

    @PostMapping("/series")
    public ApiResponse<TagFacetResponse> seriesByTags(@Valid @RequestBody TagFacetRequest request) {
        return ApiResponse.success(tagTaxonomyService.findSeriesByTags(request.getTags()));
    }

    @GetMapping("/modifications")
    public ApiResponse<List<TagModificationResponse>> listModifications() {
        return ApiResponse.success(tagModificationService.list());
    }

    @PostMapping("/modifications")
    public ApiResponse<TagModificationResponse> saveModification(@Valid @RequestBody TagModificationRequest request) {
        return ApiResponse.success(tagModificationService.apply(request));
    }

    @DeleteMapping("/modifications")
    public ApiResponse<String> removeModification(@RequestParam("tag") String tag) {
        if (!tagModificationService.remove(tag)) {
            return ApiResponse.fail("404", "标签规则不存在");
        }
        return ApiResponse.success("REMOVED");
    }
}
