package com.tbmerch.backoffice.integration.encoding;

import com.tbmerch.backoffice.config.EncodingProperties;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.integration.IntegrationException;
import com.tbmerch.backoffice.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Media jobs for the shop: hero banner video, product images, product showcase videos and
 * social-media cuts. Failures come back as {@code {"error": ...}} instead of exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaService {

    static final String DEFAULT_HERO_IMAGE = "https://images.unsplash.com/photo-1577223625816-7546f13df25d";
    static final String PRODUCT_PLACEHOLDER_IMAGE = "https://via.placeholder.com/800x800/333/fff?text=Product";

    private final EncodingClient encodingClient;
    private final EncodingProperties encodingProperties;
    private final ProductService productService;

    /** Builds the hero video from the first image; the rest are ignored for now. */
    public Map<String, Object> createHeroVideo(List<String> imageUrls, String audioUrl) {
        String input = imageUrls == null || imageUrls.isEmpty() ? DEFAULT_HERO_IMAGE : imageUrls.get(0);
        return submit("hero video", () -> encodingClient.createJob(input,
                EncodingPresets.heroVideo(audioUrl, encodingProperties.getWatermarkUrl())));
    }

    /** One job per image, in the given order. */
    public List<Map<String, Object>> optimizeProductImages(List<String> imageUrls) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (String imageUrl : imageUrls) {
            results.add(submit("product image", () -> encodingClient.createJob(imageUrl, EncodingPresets.productImage())));
        }
        return results;
    }

    /**
     * @throws com.tbmerch.backoffice.service.ProductNotFoundException when the product does not exist
     */
    public Map<String, Object> createProductVideo(UUID productId, String templateName) {
        Product product = productService.get(productId);
        ProductVideoTemplate template = ProductVideoTemplate.fromValue(templateName);
        String input = product.getImageUrl() == null ? PRODUCT_PLACEHOLDER_IMAGE : product.getImageUrl();
        return submit("product video", () -> encodingClient.createJob(input,
                EncodingPresets.productVideo(template, product.getSku(), product.getName())));
    }

    /** Unknown content types are rendered as an Instagram story. */
    public Map<String, Object> createMarketingContent(String contentType, Map<String, String> assets) {
        MarketingFormat format = MarketingFormat.fromValue(contentType).orElse(MarketingFormat.INSTAGRAM_STORY);
        String input = assets == null || assets.get("background_image") == null
                ? DEFAULT_HERO_IMAGE : assets.get("background_image");
        return submit("marketing " + format.value(), () -> encodingClient.createJob(input, EncodingPresets.marketing(format)));
    }

    public Map<String, Object> getJobStatus(String jobId) {
        return submit("job status", () -> encodingClient.getJob(jobId));
    }

    private Map<String, Object> submit(String action, Supplier<Map<String, Object>> call) {
        try {
            return call.get();
        } catch (IntegrationException e) {
            log.error("Media request failed | action={} | error={}", action, e.getMessage());
            return Map.of("error", e.getMessage());
        }
    }
}
