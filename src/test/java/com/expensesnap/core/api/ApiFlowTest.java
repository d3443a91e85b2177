package com.expensesnap.core.api;

import com.expensesnap.core.IntegrationTestSupport;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.ExpenseCategory;
import com.expensesnap.core.domain.ExtractedReceipt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ApiFlowTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String register(String name, String email, String inviteCode) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "name", name, "email", email, "password", "secret1",
                "invite_code", inviteCode == null ? "" : inviteCode));
        mvc.perform(post("/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
        return login(email);
    }

    private String login(String email) throws Exception {
        MvcResult result = mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"secret1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("Bearer"))
                .andReturn();
        return "Bearer " + json(result).get("access_token").asText();
    }

    @Test
    void protectedEndpointsRequireBearerToken() throws Exception {
        mvc.perform(get("/expenses"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.status").value(401));

        mvc.perform(get("/dashboard").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void badCredentialsGiveUnauthorizedPayload() throws Exception {
        mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ghost@example.com\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("Invalid email or password"));

        mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"email\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void companyInviteUploadAndDashboardFlow() throws Exception {
        String root = register("Root", "root@example.com", null);

        mvc.perform(get("/auth/whoami").header(HttpHeaders.AUTHORIZATION, root))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.role").value("super_admin"))
                .andExpect(jsonPath("$.company_name").value("All Companies"));

        MvcResult created = mvc.perform(post("/companies").header(HttpHeaders.AUTHORIZATION, root)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Acme\",\"home_currency\":\"USD\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.company.home_currency").value("USD"))
                .andReturn();
        String adminCode = json(created).get("invite_code").asText();

        String admin = register("Ann", "ann@acme.io", adminCode);
        MvcResult invite = mvc.perform(post("/invites").header(HttpHeaders.AUTHORIZATION, admin)
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("member"))
                .andReturn();
        String member = register("Bob", "bob@acme.io", json(invite).get("code").asText());

        when(receiptExtractor.extract(anyList())).thenReturn(new ExtractedReceipt("2024-03-02", "Cafe Mila",
                "Berlin", ExpenseCategory.FOOD_AND_DINING, new BigDecimal("10.50"), new BigDecimal("2.00"),
                BigDecimal.ZERO, new BigDecimal("12.50"), "Visa", CurrencyCode.of("EUR"), "Latte (4.50)"));
        BufferedImage image = new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream jpeg = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", jpeg);

        MvcResult uploaded = mvc.perform(multipart("/expenses/upload")
                        .file(new MockMultipartFile("receipt", "lunch.jpg", "image/jpeg", jpeg.toByteArray()))
                        .header(HttpHeaders.AUTHORIZATION, member))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.vendor").value("Cafe Mila"))
                .andExpect(jsonPath("$.total_usd").value(13.59))
                .andExpect(jsonPath("$.uploaded_by").value("Bob"))
                .andReturn();
        String expenseId = json(uploaded).get("id").asText();

        mvc.perform(get("/dashboard").header(HttpHeaders.AUTHORIZATION, member))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.currency").value("USD"))
                .andExpect(jsonPath("$.by_category['Food & Dining']").value(13.59));

        mvc.perform(delete("/expenses/" + expenseId).header(HttpHeaders.AUTHORIZATION, member))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("ACCESS_DENIED"))
                .andExpect(jsonPath("$.status").value(403));

        mvc.perform(put("/expenses/" + expenseId).header(HttpHeaders.AUTHORIZATION, member)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"total\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mvc.perform(get("/companies").header(HttpHeaders.AUTHORIZATION, admin))
                .andExpect(status().isForbidden());

        mvc.perform(get("/companies").header(HttpHeaders.AUTHORIZATION, root))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].user_count").value(2))
                .andExpect(jsonPath("$[0].expense_count").value(1));

        mvc.perform(delete("/expenses/" + expenseId).header(HttpHeaders.AUTHORIZATION, admin))
                .andExpect(status().isOk());
        mvc.perform(get("/expenses").header(HttpHeaders.AUTHORIZATION, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void uploadWithoutFileIsValidationError() throws Exception {
        String root = register("Root", "root@example.com", null);

        mvc.perform(multipart("/expenses/upload").header(HttpHeaders.AUTHORIZATION, root))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("No file uploaded"));
    }

    @Test
    void ratesReportFallbackWhenSourceIsDown() throws Exception {
        String root = register("Root", "root@example.com", null);

        mvc.perform(get("/rates").header(HttpHeaders.AUTHORIZATION, root))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.base").value("USD"))
                .andExpect(jsonPath("$.source").value("FALLBACK"))
                .andExpect(jsonPath("$.rates.EUR").value(0.92));
    }

    @Test
    void healthIsPublicAndShowsRateState() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.exchangeRates.details.state").value("DEGRADED"));
    }
}
