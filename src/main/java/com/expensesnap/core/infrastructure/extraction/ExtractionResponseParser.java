package com.expensesnap.core.infrastructure.extraction;

import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.ExpenseCategory;
import com.expensesnap.core.domain.ExtractedReceipt;
import com.expensesnap.core.exception.ExtractionParseFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the model's text reply into an {@link ExtractedReceipt}. Tolerates a markdown code
 * fence around the JSON and sanitises monetary fields; anything that is not a JSON object
 * after unwrapping is rejected.
 */
public class ExtractionResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ExtractionResponseParser.class);

    private static final String FENCE = "```";
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractedReceipt parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new ExtractionParseFailedException("Extraction service returned an empty reply");
        }
        String json = stripCodeFence(reply);

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable extraction reply: {}", reply);
            throw new ExtractionParseFailedException("Extraction service returned invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionParseFailedException("Extraction service did not return a JSON object");
        }

        return new ExtractedReceipt(
                text(root, "date"),
                text(root, "vendor"),
                text(root, "location"),
                ExpenseCategory.fromLabel(text(root, "category")),
                money(root, "subtotal"),
                money(root, "tax"),
                money(root, "tip"),
                money(root, "total"),
                text(root, "payment_method"),
                CurrencyCode.parseOrDefault(text(root, "currency"), CurrencyCode.USD),
                items(root.get("items")));
    }

    /**
     * Removes a leading {@code ```} line (with or without a language tag) and everything from
     * the last {@code ```} onwards.
     */
    static String stripCodeFence(String reply) {
        String text = reply.strip();
        if (!text.startsWith(FENCE)) {
            return text;
        }
        int newline = text.indexOf('\n');
        text = newline >= 0 ? text.substring(newline + 1) : text.substring(FENCE.length());
        int closing = text.lastIndexOf(FENCE);
        if (closing >= 0) {
            text = text.substring(0, closing);
        }
        return text.strip();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText().trim() : node.toString();
    }

    private static String items(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(item -> parts.add(item.isValueNode() ? item.asText() : item.toString()));
            return String.join(", ", parts);
        }
        return node.isValueNode() ? node.asText().trim() : node.toString();
    }

    static BigDecimal money(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return ZERO;
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else {
            String raw = node.asText().replaceAll("[^0-9.\\-]", "");
            if (raw.isEmpty()) {
                return ZERO;
            }
            try {
                value = new BigDecimal(raw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparsable {} value '{}'", field, node.asText());
                return ZERO;
            }
        }
        if (value.signum() < 0) {
            log.warn("Extracted {} was negative ({}), storing 0.00", field, value);
            return ZERO;
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
