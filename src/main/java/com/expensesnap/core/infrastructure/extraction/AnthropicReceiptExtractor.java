package com.expensesnap.core.infrastructure.extraction;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.ExpenseCategory;
import com.expensesnap.core.domain.ExtractedReceipt;
import com.expensesnap.core.domain.NormalizedImage;
import com.expensesnap.core.domain.ports.ReceiptExtractor;
import com.expensesnap.core.exception.ExtractionParseFailedException;
import com.expensesnap.core.exception.ExtractionUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReceiptExtractor} backed by the Anthropic Messages API. All pages travel in one
 * request as base64 image blocks, followed by the instruction prompt.
 */
@Component
public class AnthropicReceiptExtractor implements ReceiptExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReceiptExtractor.class);

    static final String PROMPT = """
            Analyze this receipt/invoice (may be multiple pages) and extract ALL information.
            Look across ALL pages carefully.
            Return ONLY a valid JSON object with these exact keys:
            {
              "date": "YYYY-MM-DD format, or empty string if not found",
              "vendor": "Business/restaurant name",
              "location": "City, State/Province or City, Country",
              "category": "One of: %s",
              "subtotal": 0.00, "tax": 0.00, "tip": 0.00, "total": 0.00,
              "payment_method": "e.g. Visa ****1234, Cash, etc.",
              "currency": "3-letter code e.g. CAD, USD, EUR, INR, GBP",
              "items": "List EVERY line item with its price. Format: 'Item Name (price), Item Name (price), ...'. Include quantities if shown."
            }
            IMPORTANT:
            - List ALL individual items in the items field, not just the total
            - For tax: include the full tax amount. If there are multiple taxes (VAT, GST, CGST, SGST, service charge), add them all together
            - Use 0.00 for missing amounts
            - Return ONLY JSON, no other text.""".formatted(String.join(", ", ExpenseCategory.labels()));

    private final RestClient restClient;
    private final AppProperties.Extraction settings;
    private final ExtractionResponseParser parser;

    public AnthropicReceiptExtractor(@Qualifier("extractionRestClient") RestClient restClient,
                                     AppProperties props,
                                     ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.settings = props.getExtraction();
        this.parser = new ExtractionResponseParser(objectMapper);
    }

    @Override
    public ExtractedReceipt extract(List<NormalizedImage> pages) {
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("At least one page is required");
        }
        if (!StringUtils.hasText(settings.getApiKey())) {
            throw new ExtractionUnavailableException("Extraction service is not configured");
        }

        log.info("Requesting extraction for {} page(s) with model '{}'", pages.size(), settings.getModel());
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", settings.getApiKey())
                    .header("anthropic-version", settings.getAnthropicVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildRequest(pages))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Extraction request failed: {}", e.getMessage());
            throw new ExtractionUnavailableException("Failed to extract: " + e.getMessage(), e);
        }

        return parser.parse(replyText(response));
    }

    Map<String, Object> buildRequest(List<NormalizedImage> pages) {
        List<Map<String, Object>> content = new ArrayList<>();
        Base64.Encoder encoder = Base64.getEncoder();
        for (NormalizedImage page : pages) {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("type", "base64");
            source.put("media_type", page.mediaType());
            source.put("data", encoder.encodeToString(page.bytes()));
            content.add(Map.of("type", "image", "source", source));
        }
        content.add(Map.of("type", "text", "text", PROMPT));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", settings.getModel());
        request.put("max_tokens", settings.getMaxTokens());
        request.put("messages", List.of(Map.of("role", "user", "content", content)));
        return request;
    }

    private String replyText(JsonNode response) {
        if (response == null) {
            throw new ExtractionParseFailedException("Extraction service returned an empty body");
        }
        JsonNode blocks = response.path("content");
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                return block.get("text").asText();
            }
        }
        throw new ExtractionParseFailedException("Extraction service reply contained no text");
    }
}
