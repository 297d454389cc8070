package com.flagship.settlement_engine.withdrawal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.gateway.ResolvedAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class WithdrawalControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID organizerId;

    @BeforeEach
    void setUp() {
        organizerId = UUID.randomUUID();
        when(gateway.resolveAccount(anyString(), anyString()))
            .thenReturn(new ResolvedAccount("0123456789", "ADA OKAFOR EVENTS", "058"));
    }

    private MockHttpServletRequestBuilder asOrganizer(MockHttpServletRequestBuilder request, Map<String, ?> body) throws Exception {
        return request.header(Actor.ID_HEADER, organizerId.toString())
            .header(Actor.ROLE_HEADER, "ORGANIZER")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body));
    }

    private void registerAccount() throws Exception {
        mockMvc.perform(asOrganizer(put("/api/organizers/{id}/payout-account", organizerId),
                Map.of("bank_code", "058", "account_number", "0123456789")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_name").value("ADA OKAFOR EVENTS"));
    }

    @Test
    @DisplayName("Opening a withdrawal returns PENDING_OTP and never echoes the OTP")
    void openWithdrawal() throws Exception {
        registerAccount();
        fundAvailable(organizerId, "30000.00");

        String body = mockMvc.perform(asOrganizer(post("/api/organizers/{id}/withdrawals", organizerId),
                Map.of("amount", "10000.00")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING_OTP"))
            .andExpect(jsonPath("$.otp").doesNotExist())
            .andExpect(jsonPath("$.otp_expires_at").exists())
            .andReturn().getResponse().getContentAsString();
        String withdrawalId = objectMapper.readTree(body).path("id").asText();

        mockMvc.perform(get("/api/withdrawals/{id}", withdrawalId)
                .header(Actor.ID_HEADER, organizerId.toString()).header(Actor.ROLE_HEADER, "ORGANIZER"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_number").value("0123456789"));

        mockMvc.perform(asOrganizer(post("/api/withdrawals/{id}/confirm", withdrawalId), Map.of("otp", "12ab")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.otp").exists());
    }

    @Test
    @DisplayName("Withdrawing more than is available is rejected with the balance in details")
    void insufficientBalance() throws Exception {
        registerAccount();
        fundAvailable(organizerId, "5000.00");

        mockMvc.perform(asOrganizer(post("/api/organizers/{id}/withdrawals", organizerId), Map.of("amount", "8000.00")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_BALANCE"))
            .andExpect(jsonPath("$.details.available").value("5000.00"));
    }

    @Test
    @DisplayName("Payout account numbers must be ten digits")
    void invalidAccountNumber() throws Exception {
        mockMvc.perform(asOrganizer(put("/api/organizers/{id}/payout-account", organizerId),
                Map.of("bank_code", "058", "account_number", "12345")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.accountNumber").exists());
    }
}
