package com.tokenledger.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenledger.security.JwtTokenProvider;
import com.tokenledger.support.MutableClock;
import com.tokenledger.support.TestClockConfig;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end API test: account creation → rewards → staking → spending.
 *
 * Uses @SpringBootTest with the full context, real transaction management and
 * H2 (application-test.yml). Tokens are minted with the application's own
 * JwtTokenProvider; the subject is the user id.
 *
 * Methods run in order and share one user.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ApiIntegrationTest {

    @Autowired private MockMvc          mockMvc;
    @Autowired private ObjectMapper     objectMapper;
    @Autowired private JwtTokenProvider tokenProvider;
    @Autowired private MutableClock     clock;

    // State shared across test methods (executed in order)
    private static final String USER = "scenario-" + UUID.randomUUID();
    private static String token;

    @BeforeEach
    void mintToken() {
        if (token == null) {
            token = tokenProvider.generateToken(USER);
        }
    }

    private String bearer() {
        return "Bearer " + token;
    }

    private String body(String type, String amount, String source, String referenceId) throws Exception {
        var node = objectMapper.createObjectNode()
                .put("type", type)
                .put("amount", new BigDecimal(amount))
                .put("source", source);
        if (referenceId != null) {
            node.put("referenceId", referenceId);
        }
        return objectMapper.writeValueAsString(node);
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    // ── 0. Authentication ────────────────────────────────────────────────────

    @Test
    @Order(0)
    @DisplayName("GET /accounts/me - Without token returns 401")
    void noToken() throws Exception {
        mockMvc.perform(get("/accounts/me"))
               .andExpect(status().isUnauthorized());
    }

    @Test
    @Order(0)
    @DisplayName("GET /accounts/me - Forged token returns 401")
    void forgedToken() throws Exception {
        mockMvc.perform(get("/accounts/me").header("Authorization", bearer() + "x"))
               .andExpect(status().isUnauthorized());
    }

    // ── 1. Lazy creation ─────────────────────────────────────────────────────

    @Test
    @Order(1)
    @DisplayName("Scenario 1: new account starts with the 1000 grant")
    void newAccount() throws Exception {
        mockMvc.perform(get("/accounts/me").header("Authorization", bearer()))
               .andExpect(status().isOk())
               .andExpect(header().exists("X-Request-Id"))
               .andExpect(jsonPath("$.userId").value(USER))
               .andExpect(jsonPath("$.balance").value(1000))
               .andExpect(jsonPath("$.totalEarned").value(1000))
               .andExpect(jsonPath("$.totalSpent").value(0))
               .andExpect(jsonPath("$.stakedAmount").value(0));
    }

    @Test
    @Order(2)
    @DisplayName("Scenario 2: earn 100 daily_reward → 1100, one earn entry")
    void earnDailyReward() throws Exception {
        mockMvc.perform(post("/accounts/me/transactions")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("earn", "100", "daily_reward", null)))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(1100))
               .andExpect(jsonPath("$.account.totalEarned").value(1100))
               .andExpect(jsonPath("$.account.totalSpent").value(0))
               .andExpect(jsonPath("$.transaction.type").value("earn"))
               .andExpect(jsonPath("$.transaction.amount").value(100));

        mockMvc.perform(get("/accounts/me/transactions").header("Authorization", bearer()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(1))
               .andExpect(jsonPath("$[0].source").value("daily_reward"));
    }

    @Test
    @Order(3)
    @DisplayName("Daily reward again in the same day → 409 ALREADY_CLAIMED_TODAY")
    void dailyRewardTwice() throws Exception {
        mockMvc.perform(post("/accounts/me/rewards/daily").header("Authorization", bearer()))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("ALREADY_CLAIMED_TODAY"));
    }

    @Test
    @Order(4)
    @DisplayName("Scenario 3: stake 50 → 409 BELOW_MINIMUM_STAKE, state unchanged")
    void stakeBelowMinimum() throws Exception {
        mockMvc.perform(post("/accounts/me/stakes")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":50}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("BELOW_MINIMUM_STAKE"));

        mockMvc.perform(get("/accounts/me").header("Authorization", bearer()))
               .andExpect(jsonPath("$.balance").value(1100))
               .andExpect(jsonPath("$.stakedAmount").value(0));
    }

    @Test
    @Order(5)
    @DisplayName("Scenario 4: stake 200 then unstake 200 → 900 then back to 1100")
    void stakeAndUnstake() throws Exception {
        mockMvc.perform(post("/accounts/me/stakes")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":200}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(900))
               .andExpect(jsonPath("$.account.stakedAmount").value(200))
               .andExpect(jsonPath("$.transaction.description").value("Staked 200 VDO tokens"));

        mockMvc.perform(post("/accounts/me/stakes/release")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":200}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(1100))
               .andExpect(jsonPath("$.account.stakedAmount").value(0));
    }

    @Test
    @Order(6)
    @DisplayName("Unstake with nothing staked → 409 EXCEEDS_STAKED_AMOUNT")
    void unstakeNothing() throws Exception {
        mockMvc.perform(post("/accounts/me/stakes/release")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":1}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("EXCEEDS_STAKED_AMOUNT"));
    }

    @Test
    @Order(7)
    @DisplayName("Scenario 5: spend 2000 on 1100 → 409 INSUFFICIENT_BALANCE, balance stays 1100")
    void spendTooMuch() throws Exception {
        mockMvc.perform(post("/accounts/me/transactions")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("spend", "2000", "purchase", null)))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("INSUFFICIENT_BALANCE"));

        mockMvc.perform(get("/accounts/me").header("Authorization", bearer()))
               .andExpect(jsonPath("$.balance").value(1100));
    }

    @Test
    @Order(8)
    @DisplayName("Invalid amounts → 400 INVALID_AMOUNT; unknown type → 400")
    void invalidInput() throws Exception {
        mockMvc.perform(post("/accounts/me/transactions")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("spend", "0.00001", "purchase", null)))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"));

        mockMvc.perform(post("/accounts/me/transactions")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"mint\",\"amount\":1,\"source\":\"x\"}"))
               .andExpect(status().isBadRequest());
    }

    // ── idempotency ──────────────────────────────────────────────────────────

    @Test
    @Order(9)
    @DisplayName("Referral with referenceId twice → credited once, second call replayed")
    void referralIdempotent() throws Exception {
        String content = "{\"referenceId\":\"invite-1\"}";

        MvcResult first = mockMvc.perform(post("/accounts/me/rewards/referral")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content(content))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(1600))
               .andExpect(jsonPath("$.replayed").value(false))
               .andReturn();

        MvcResult second = mockMvc.perform(post("/accounts/me/rewards/referral")
                .header("Authorization", bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .content(content))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(1600))
               .andExpect(jsonPath("$.replayed").value(true))
               .andReturn();

        assertThat(json(second).at("/transaction/transactionId").asLong())
            .isEqualTo(json(first).at("/transaction/transactionId").asLong());

        mockMvc.perform(get("/transactions/invite-1").header("Authorization", bearer()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.amount").value(500))
               .andExpect(jsonPath("$.source").value("referral"));
    }

    @Test
    @Order(10)
    @DisplayName("Another user cannot see this user's referenceId")
    void referenceIsPerAccount() throws Exception {
        String other = "Bearer " + tokenProvider.generateToken("other-" + UUID.randomUUID());

        mockMvc.perform(get("/transactions/invite-1").header("Authorization", other))
               .andExpect(status().isNotFound());
    }

    // ── reward window ────────────────────────────────────────────────────────

    @Test
    @Order(11)
    @DisplayName("Next day the daily reward is accepted again")
    void dailyRewardNextDay() throws Exception {
        clock.advance(Duration.ofDays(1));

        mockMvc.perform(post("/accounts/me/rewards/daily").header("Authorization", bearer()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.account.balance").value(1700))
               .andExpect(jsonPath("$.transaction.source").value("daily_reward"));
    }

    // ── history + reconciliation ─────────────────────────────────────────────

    @Test
    @Order(12)
    @DisplayName("History is newest first and honours limit")
    void historyOrder() throws Exception {
        MvcResult result = mockMvc.perform(get("/accounts/me/transactions")
                .header("Authorization", bearer())
                .param("limit", "2"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(2))
               .andReturn();

        JsonNode page = json(result);
        assertThat(page.get(0).get("source").asText()).isEqualTo("daily_reward");
        assertThat(page.get(0).get("createdAt").asText())
            .isGreaterThan(page.get(1).get("createdAt").asText());

        mockMvc.perform(get("/accounts/me/transactions")
                .header("Authorization", bearer())
                .param("limit", "0"))
               .andExpect(status().isBadRequest());
    }

    @Test
    @Order(13)
    @DisplayName("Reconciliation of the scenario account reports no drift")
    void reconciliation() throws Exception {
        mockMvc.perform(get("/accounts/me/reconciliation").header("Authorization", bearer()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.consistent").value(true))
               .andExpect(jsonPath("$.entryCount").value(5))
               .andExpect(jsonPath("$.stored.balance").value(1700))
               .andExpect(jsonPath("$.replayed.balance").value(1700));
    }

    @Test
    @Order(14)
    @DisplayName("Catalogue is public; health probe is up")
    void publicEndpoints() throws Exception {
        mockMvc.perform(get("/rewards/catalog"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.referral").value(500))
               .andExpect(jsonPath("$.content_completion").value(25));

        mockMvc.perform(get("/actuator/health"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("UP"));
    }
}
