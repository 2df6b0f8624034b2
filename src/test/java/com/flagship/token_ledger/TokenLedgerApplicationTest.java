package com.flagship.token_ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.TokenLedgerService;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end flow through the HTTP API on the in-memory store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TokenLedgerApplicationTest {

    private static final String ACCOUNT = "0xA11CE00000000000000000000000000000000001";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenLedgerService ledger;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        ledger.reset();
    }

    private JsonNode postJson(String path, String body, int expectedStatus) throws Exception {
        String response = mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().is(expectedStatus))
            .andReturn()
            .getResponse()
            .getContentAsString();
        return response.isEmpty() ? objectMapper.nullNode() : objectMapper.readTree(response);
    }

    @Test
    @DisplayName("Initialize, unlock, claim, contribute, stake and unstake over HTTP")
    void testFullFlow() throws Exception {
        printTestHeader("Full Flow");

        JsonNode state = postJson("/api/ledger/initialize", "{\"account_id\": \"" + ACCOUNT + "\"}", 200);
        assertTrue(state.path("initialized").asBoolean());
        assertEquals(ACCOUNT, state.path("accountId").asText());

        postJson("/api/ledger/progress", "{\"day\": 7}", 200);
        JsonNode claim = postJson("/api/ledger/rewards/day_7_milestone/claim", "", 200);
        assertEquals("claim_reward", claim.path("kind").asText());

        JsonNode contribution = postJson("/api/ledger/contributions",
            "{\"cause_id\": \"vegan_outreach\", \"amount\": 25}", 201);
        assertEquals("contribute", contribution.path("kind").asText());

        JsonNode stake = postJson("/api/ledger/stakes", "{\"amount\": 30}", 201);
        String stakeId = stake.path("metadata").path("stakeId").asText();
        printOutput("Stake id", stakeId);

        postJson("/api/ledger/stakes/" + stakeId + "/unstake", "", 200);

        mockMvc.perform(get("/api/ledger/balance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.primary.display").value("80.00"))
            .andExpect(jsonPath("$.secondary.display").value("0.50"));

        mockMvc.perform(get("/api/ledger/contributions").param("causeId", "vegan_outreach"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/ledger/transactions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(5));

        BigDecimal replayed = ledger.getTransactions().stream()
            .map(LedgerTransaction::getSignedAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, replayed.compareTo(ledger.getBalance().getPrimary()));
        printSuccess("Flow committed and the log replays to the balance");
    }

    @Test
    @DisplayName("Claiming twice over HTTP is rejected with 409")
    void testDoubleClaimConflict() throws Exception {
        printTestHeader("Double Claim");
        postJson("/api/ledger/initialize", "{\"account_id\": \"" + ACCOUNT + "\"}", 200);
        mockMvc.perform(post("/api/ledger/rewards/day_7_milestone/unlock"))
            .andExpect(jsonPath("$.unlocked").value(true));

        postJson("/api/ledger/rewards/day_7_milestone/claim", "", 200);
        JsonNode error = postJson("/api/ledger/rewards/day_7_milestone/claim", "", 409);

        assertEquals("ALREADY_CLAIMED", error.path("error").asText());
        printSuccess("Second claim rejected");
    }

    @Test
    @DisplayName("Health reports the store and whether the ledger is initialized")
    void testHealth() throws Exception {
        printTestHeader("Health");

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.store").value("memory"))
            .andExpect(jsonPath("$.storeStatus").value("UP"))
            .andExpect(jsonPath("$.initialized").value(false));

        printSuccess("Health endpoint up");
    }
}
