package com.example.poscore.promotion;

import com.example.poscore.security.JwtService;
import com.example.poscore.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class PromotionControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private JwtService jwtService;
    @Autowired
    private TestFixtures fixtures;
    @Autowired
    private PromotionRepository promotionRepository;

    private String adminToken;
    private String cashierToken;

    @BeforeEach
    void setUp() {
        fixtures.reset();
        adminToken = "Bearer " + jwtService.generateToken(fixtures.user("admin"));
        cashierToken = "Bearer " + jwtService.generateToken(fixtures.user("cashier"));
    }

    private static String percentageBody(String value) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return "{\"name\":\"Spring sale\",\"kind\":\"percentage\",\"value\":" + value
                + ",\"start_date\":\"" + now.minusDays(1) + "\",\"end_date\":\"" + now.plusDays(7) + "\"}";
    }

    @Test
    void cashierCannotCreatePromotions() throws Exception {
        mockMvc.perform(post("/api/promotions").header("Authorization", cashierToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content(percentageBody("15")))
                .andExpect(status().isForbidden());

        assertThat(promotionRepository.count()).isZero();
    }

    @Test
    void adminCreatesPromotionWithPreviewText() throws Exception {
        mockMvc.perform(post("/api/promotions").header("Authorization", adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content(percentageBody("15")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.kind").value("percentage"))
                .andExpect(jsonPath("$.value").value(15))
                .andExpect(jsonPath("$.current_uses").value(0))
                .andExpect(jsonPath("$.preview").isString());
    }

    @Test
    void invalidPromotionListsEveryProblem() throws Exception {
        mockMvc.perform(post("/api/promotions").header("Authorization", adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"percentage\",\"value\":150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors").isArray())
                .andExpect(jsonPath("$.errors", hasItem("Promotion name is required")))
                .andExpect(jsonPath("$.errors", hasItem("Percentage discount cannot exceed 100%")))
                .andExpect(jsonPath("$.errors", hasItem("Start date is required")));
    }

    @Test
    void updateDeactivateAndDelete() throws Exception {
        Promotion p = fixtures.promotion(PromotionKind.PERCENTAGE, "10");

        mockMvc.perform(put("/api/promotions/" + p.getId()).header("Authorization", adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content(percentageBody("20")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(20));

        mockMvc.perform(patch("/api/promotions/" + p.getId() + "/active").header("Authorization", adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/promotions/active").header("Authorization", cashierToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", not(hasItem(p.getId().intValue()))));

        mockMvc.perform(delete("/api/promotions/" + p.getId()).header("Authorization", adminToken))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/promotions/" + p.getId()).header("Authorization", cashierToken))
                .andExpect(status().isNotFound());
    }

    @Test
    void usedPromotionCannotBeDeleted() throws Exception {
        Promotion p = fixtures.promotion(PromotionKind.FIXED_AMOUNT, "5", b -> b.currentUses(2));

        mockMvc.perform(delete("/api/promotions/" + p.getId()).header("Authorization", adminToken))
                .andExpect(status().isBadRequest());
        assertThat(promotionRepository.existsById(p.getId())).isTrue();
    }

    @Test
    void activeListIsVisibleToCashiers() throws Exception {
        Promotion p = fixtures.promotion(PromotionKind.PERCENTAGE, "5");

        mockMvc.perform(get("/api/promotions/active").header("Authorization", cashierToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(p.getId()))
                .andExpect(jsonPath("$[0].name").value("percentage 5"));
    }

    @Test
    void roleDecidesWhoMayWrite() throws Exception {
        mockMvc.perform(post("/api/promotions").with(user("ops").roles("ADMIN"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(percentageBody("5")))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/promotions").with(user("till").roles("CASHIER"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(percentageBody("5")))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/promotions").with(user("till").roles("CASHIER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }
}
