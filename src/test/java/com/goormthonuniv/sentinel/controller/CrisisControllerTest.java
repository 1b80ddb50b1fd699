package com.goormthonuniv.sentinel.controller;

import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.Notification;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import com.goormthonuniv.sentinel.store.CrisisStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CrisisController.class)
class CrisisControllerTest {

    private static final Instant NOW = Instant.parse("2024-07-01T08:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CrisisStore store;

    private static Crisis crisis() {
        return Crisis.builder()
                .id(UUID.randomUUID())
                .name("Pune Dam Breach")
                .keywords("dam, flood")
                .severity(92)
                .location("Pune")
                .createdAt(NOW)
                .build();
    }

    @Test
    void listsCrisesWithKeywordArray() throws Exception {
        when(store.listCrises(20)).thenReturn(List.of(crisis()));

        mvc.perform(get("/api/v1/crises"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Pune Dam Breach"))
                .andExpect(jsonPath("$[0].keywords[1]").value("flood"))
                .andExpect(jsonPath("$[0].verdictStatus").value("PENDING"));
    }

    @Test
    void rejectsOutOfRangeLimit() throws Exception {
        mvc.perform(get("/api/v1/crises").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/v1/crises").param("limit", "many"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownCrisisIs404() throws Exception {
        when(store.findCrisis(any())).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/crises/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        mvc.perform(get("/api/v1/crises/{id}/timeline", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    void returnsTimeline() throws Exception {
        Crisis c = crisis();
        when(store.findCrisis(c.getId())).thenReturn(Optional.of(c));
        when(store.listTimeline(c.getId())).thenReturn(List.of(TimelineItem.builder()
                .id(UUID.randomUUID())
                .crisisId(c.getId())
                .claimText("Signal Detected: Pune Dam Breach")
                .status(VerificationStatus.UNCONFIRMED)
                .confidenceScore(10)
                .timestamp(NOW)
                .build()));

        mvc.perform(get("/api/v1/crises/{id}/timeline", c.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("UNCONFIRMED"))
                .andExpect(jsonPath("$[0].confidenceScore").value(10));
    }

    @Test
    void latestNotificationOrNoContent() throws Exception {
        when(store.latestNotification()).thenReturn(Optional.empty());
        mvc.perform(get("/api/v1/notifications/latest")).andExpect(status().isNoContent());

        when(store.latestNotification()).thenReturn(Optional.of(Notification.builder()
                .id(UUID.randomUUID())
                .content("NEW THREAT DETECTED")
                .notificationType(Notification.CATASTROPHIC_ALERT)
                .createdAt(NOW)
                .build()));
        mvc.perform(get("/api/v1/notifications/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificationType").value("CATASTROPHIC_ALERT"));
    }

    @Test
    void malformedIdIs400() throws Exception {
        mvc.perform(get("/api/v1/crises/not-a-uuid")).andExpect(status().isBadRequest());
    }
}
