package com.expensesnap.core.infrastructure.extraction;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.ExtractedReceipt;
import com.expensesnap.core.domain.NormalizedImage;
import com.expensesnap.core.exception.ExtractionParseFailedException;
import com.expensesnap.core.exception.ExtractionUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AnthropicReceiptExtractorTest {

    private static final String BASE = "http://extraction.test";

    private MockRestServiceServer server;
    private AppProperties props;
    private AnthropicReceiptExtractor extractor;

    private final List<NormalizedImage> pages = List.of(
            new NormalizedImage("page-one".getBytes(StandardCharsets.UTF_8), "image/png"),
            new NormalizedImage("page-two".getBytes(StandardCharsets.UTF_8), "image/png"));

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.getExtraction().setApiKey("secret-key");
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        extractor = new AnthropicReceiptExtractor(builder.build(), props, new ObjectMapper());
    }

    private static String reply(String text) throws Exception {
        return new ObjectMapper().writeValueAsString(Map.of(
                "id", "msg_1",
                "content", List.of(Map.of("type", "text", "text", text))));
    }

    @Test
    void sendsAllPagesInOneRequestAndParsesReply() throws Exception {
        String encodedFirst = Base64.getEncoder().encodeToString("page-one".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE + "/v1/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "secret-key"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.messages[0].content", hasSize(3)))
                .andExpect(jsonPath("$.messages[0].content[0].type").value("image"))
                .andExpect(jsonPath("$.messages[0].content[0].source.data").value(encodedFirst))
                .andExpect(jsonPath("$.messages[0].content[2].type").value("text"))
                .andRespond(withSuccess(reply("```json\n{\"vendor\": \"Cafe\", \"total\": 12.5, \"currency\": \"EUR\"}\n```"),
                        MediaType.APPLICATION_JSON));

        ExtractedReceipt receipt = extractor.extract(pages);

        assertThat(receipt.vendor()).isEqualTo("Cafe");
        assertThat(receipt.total()).isEqualByComparingTo("12.50");
        server.verify();
    }

    @Test
    void serverErrorMeansUnavailable() {
        server.expect(requestTo(BASE + "/v1/messages")).andRespond(withServerError());

        assertThatThrownBy(() -> extractor.extract(pages)).isInstanceOf(ExtractionUnavailableException.class);
    }

    @Test
    void proseReplyFailsToParse() throws Exception {
        server.expect(requestTo(BASE + "/v1/messages"))
                .andRespond(withSuccess(reply("I could not find a receipt."), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> extractor.extract(pages)).isInstanceOf(ExtractionParseFailedException.class);
    }

    @Test
    void missingApiKeyFailsWithoutCallingOut() {
        props.getExtraction().setApiKey("");

        assertThatThrownBy(() -> extractor.extract(pages))
                .isInstanceOf(ExtractionUnavailableException.class)
                .hasMessageContaining("not configured");
        server.verify();
    }

    @Test
    void promptNamesEveryCategory() {
        assertThat(AnthropicReceiptExtractor.PROMPT).contains("Food & Dining", "Fuel & Parking", "Other");
    }
}
