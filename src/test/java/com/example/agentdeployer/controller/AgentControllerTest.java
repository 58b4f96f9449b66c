package com.example.agentdeployer.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AgentControllerTest {

    private static final String TEMPLATE = """
            {"name": "Lead Enricher", "nodes": [
              {"name": "Lookup", "credentials": {"httpHeaderAuth": {"id": "1", "name": "Clearbit API Key"}}},
              {"name": "Notify", "credentials": {"slackApi": {"id": "2", "name": "Slack"}}}
            ], "connections": {}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createAgent(String name) throws Exception {
        String body = "{\"name\": \"" + name + "\", \"description\": \"Enriches inbound leads\", \"template\": " + TEMPLATE + "}";
        MvcResult result = mockMvc.perform(post("/api/agents").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value(name))
                .andExpect(jsonPath("$.active").value(true))
                .andReturn();
        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        return created.get("id").asText();
    }

    @Test
    void createdAgentExposesCredentialSchema() throws Exception {
        String id = createAgent("Lead Enricher");

        mockMvc.perform(get("/api/agents/" + id + "/credential-schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.simple[0].type").value("slackApi"))
                .andExpect(jsonPath("$.special[0].keyword").value("Clearbit"))
                .andExpect(jsonPath("$.special[0].fields[1].kind").value("secret"));
    }

    @Test
    void previewExtractsWithoutSaving() throws Exception {
        mockMvc.perform(post("/api/agents/extract-credentials").contentType(MediaType.APPLICATION_JSON).content(TEMPLATE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.special[0].displayName").value("Http Header: Clearbit API Key"));
    }

    @Test
    void duplicateNameIsConflict() throws Exception {
        createAgent("Duplicate Agent");
        String body = "{\"name\": \"duplicate agent\", \"template\": " + TEMPLATE + "}";

        mockMvc.perform(post("/api/agents").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void templateWithoutNodesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/agents").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Broken\", \"template\": {\"name\": \"x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid workflow JSON: missing 'nodes' array"));
    }

    @Test
    void deletedAgentIsNotFound() throws Exception {
        String id = createAgent("Short Lived");

        mockMvc.perform(delete("/api/agents/" + id)).andExpect(status().isOk());
        mockMvc.perform(get("/api/agents/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }
}
