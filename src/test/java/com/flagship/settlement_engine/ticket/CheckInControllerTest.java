package com.flagship.settlement_engine.ticket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.common.actor.Actor;
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

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class CheckInControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID organizerId;
    private UUID eventId;
    private UUID tierId;

    @BeforeEach
    void setUp() {
        organizerId = UUID.randomUUID();
        eventId = createEventStartingSoon(organizerId);
        tierId = createTier(eventId, "5000.00", 100, false);
    }

    private MockHttpServletRequestBuilder asOrganizer(MockHttpServletRequestBuilder request) {
        return request.header(Actor.ID_HEADER, organizerId.toString()).header(Actor.ROLE_HEADER, "ORGANIZER");
    }

    private MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, Map<String, ?> body) throws Exception {
        return request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
    }

    private String createAgentCode(String label) throws Exception {
        String body = mockMvc.perform(json(asOrganizer(post("/api/events/{eventId}/agent-codes", eventId)),
                Map.of("label", label)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.is_active").value(true))
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).path("code").asText();
    }

    @Test
    @DisplayName("Organizer checks a ticket in; the second scan is a 409")
    void organizerCheckIn() throws Exception {
        Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());

        mockMvc.perform(json(asOrganizer(post("/api/events/{eventId}/check-in", eventId)),
                Map.of("ticket", ticket.getTicketNumber())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CHECKED_IN"));

        mockMvc.perform(json(asOrganizer(post("/api/events/{eventId}/check-in", eventId)),
                Map.of("ticket", ticket.getTicketNumber())))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("TICKET_ALREADY_CHECKED_IN"))
            .andExpect(jsonPath("$.details.checkedInAt").exists());
    }

    @Test
    @DisplayName("Door staff check in with an agent code and no identity headers")
    void agentCodeCheckIn() throws Exception {
        String code = createAgentCode("North gate");
        Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());

        mockMvc.perform(json(post("/api/agent-codes/activate"), Map.of("code", code)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event_id").value(eventId.toString()));

        mockMvc.perform(json(post("/api/events/{eventId}/check-in", eventId),
                Map.of("ticket", ticket.getId().toString(), "agent_code", code)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.checked_in_by").value("agent:North gate"));

        mockMvc.perform(asOrganizer(get("/api/events/{eventId}/agent-codes", eventId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].check_in_count").value(1));
    }

    @Test
    @DisplayName("Unused agent codes can be deleted, unknown ones are a 404")
    void deleteAgentCode() throws Exception {
        createAgentCode("Spare");
        String listed = mockMvc.perform(asOrganizer(get("/api/events/{eventId}/agent-codes", eventId)))
            .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(listed).get(0).path("id").asText();

        mockMvc.perform(asOrganizer(delete("/api/agent-codes/{id}", id)))
            .andExpect(status().isNoContent());

        mockMvc.perform(json(post("/api/agent-codes/activate"), Map.of("code", "NOSUCHCOD")))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Check-in without identity or agent code is refused")
    void anonymousCheckIn() throws Exception {
        Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());

        mockMvc.perform(json(post("/api/events/{eventId}/check-in", eventId), Map.of("ticket", ticket.getTicketNumber())))
            .andExpect(status().isForbidden());
    }
}
