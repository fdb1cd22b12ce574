package com.firesim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firesim.core.model.ViewPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "firesim.storage.type=memory",
        "firesim.generator.default-size=64x64",
        "firesim.progress.debounce-ms=10"
})
@AutoConfigureMockMvc
class FiresimApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode getJson(String path) throws Exception {
        var body = mockMvc.perform(get(path)).andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("a submitted run completes end to end and its images are downloadable")
    void endToEnd() throws Exception {
        var body = objectMapper.writeValueAsString(
                TestScenarios.request(ViewPoint.GROUND_NORTH, ViewPoint.HELICOPTER_EAST, ViewPoint.AERIAL));

        var accepted = mockMvc.perform(post("/api/v1/generations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();
        var runId = objectMapper.readTree(accepted).get("run_id").asText();

        JsonNode progress = getJson("/api/v1/generations/" + runId + "/status");
        long deadline = System.currentTimeMillis() + 30_000;
        while (!"completed".equals(progress.get("status").asText())
                && !"failed".equals(progress.get("status").asText())
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            progress = getJson("/api/v1/generations/" + runId + "/status");
        }

        assertEquals("completed", progress.get("status").asText(), progress.toString());
        assertEquals("3/3 images", progress.get("progress").asText());

        var results = getJson("/api/v1/generations/" + runId + "/results");
        assertEquals("ground_north", results.get("anchorImage").get("viewPoint").asText());
        assertEquals(3, results.get("images").size());

        var url = URI.create(results.get("images").get(0).get("url").asText());
        mockMvc.perform(get(URI.create(url.getRawPath() + "?" + url.getRawQuery())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG));
    }

    @Test
    @DisplayName("health reports the placeholder provider and in-memory store as UP")
    void health() throws Exception {
        var health = getJson("/api/v1/health");
        assertEquals("UP", health.get("status").asText());
        assertEquals("UP", health.get("components").get("storage").get("status").asText());
    }
}
