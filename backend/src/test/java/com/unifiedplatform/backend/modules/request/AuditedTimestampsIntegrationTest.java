package com.unifiedplatform.backend.modules.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.unifiedplatform.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AuditedTimestampsIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final Instant FIXED_NOW = Instant.parse("2030-01-02T03:04:05Z");
    private static final String REVIEWER = "reviewer@example.org";

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void appendOnlyRecordsTakeCreationTimeFromSharedClock() throws Exception {
        postJson("/branches", """
                {"code": "RU-01", "name": "Riverside"}
                """);
        postJson("/users", """
                {"full_name": "Rae Viewer", "email": "%s", "branch_code": "RU-01", "role": "reviewer"}
                """.formatted(REVIEWER));
        String requestId = postJson("/program-requests", """
                {"branch_code": "RU-01", "program_title": "Campus clean-up", "program_type": "volunteering"}
                """).get("id").asText();
        postJson("/approvals", """
                {"request_id": "%s", "approved_by": "%s", "decision": "approved"}
                """.formatted(requestId, REVIEWER));
        postJson("/reports", """
                {"request_id": "%s", "summary": "Done"}
                """.formatted(requestId));

        assertCreatedAtIsFixedNow(getJson("/program-requests/" + requestId));
        assertCreatedAtIsFixedNow(getJson("/approvals?request_id=" + requestId).get(0));
        assertCreatedAtIsFixedNow(getJson("/reports?request_id=" + requestId).get(0));
    }

    private void assertCreatedAtIsFixedNow(JsonNode node) {
        OffsetDateTime createdAt = OffsetDateTime.parse(node.get("created_at").asText());
        assertThat(createdAt.toInstant()).isEqualTo(FIXED_NOW);
    }

    private JsonNode postJson(String path, String body) throws Exception {
        String response = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    private JsonNode getJson(String path) throws Exception {
        String response = mockMvc.perform(get(path))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }
}
