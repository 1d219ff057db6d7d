package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.integration.encoding.MediaService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/media")
@RequiredArgsConstructor
public class MediaController {

    private final MediaService mediaService;

    @PostMapping("/hero-video")
    public ResponseEntity<Map<String, Object>> createHeroVideo(@RequestBody HeroVideoRequest request) {
        return ResponseEntity.ok(mediaService.createHeroVideo(request.imageUrls(), request.audioUrl()));
    }

    @PostMapping("/product-images")
    public ResponseEntity<List<Map<String, Object>>> optimizeProductImages(@Valid @RequestBody ImageBatchRequest request) {
        return ResponseEntity.ok(mediaService.optimizeProductImages(request.imageUrls()));
    }

    @PostMapping("/products/{productId}/video")
    public ResponseEntity<Map<String, Object>> createProductVideo(
            @PathVariable UUID productId,
            @RequestParam(name = "template", defaultValue = "sports") String template) {
        return ResponseEntity.ok(mediaService.createProductVideo(productId, template));
    }

    @PostMapping("/marketing/{contentType}")
    public ResponseEntity<Map<String, Object>> createMarketingContent(
            @PathVariable String contentType,
            @RequestBody(required = false) Map<String, String> assets) {
        return ResponseEntity.ok(mediaService.createMarketingContent(contentType, assets));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<Map<String, Object>> getJobStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(mediaService.getJobStatus(jobId));
    }

    public record HeroVideoRequest(List<String> imageUrls, String audioUrl) {}

    public record ImageBatchRequest(@NotEmpty(message = "image_urls is required") List<String> imageUrls) {}
}
