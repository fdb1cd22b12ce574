package com.firesim.dispatch.api;

import com.firesim.core.health.HealthCheckService;
import com.firesim.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when every component is UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("provider", HealthStatus.Status.UP, "Image provider available",
                        Map.of("model", "placeholder-renderer-1.0")),
                new HealthStatus("storage", HealthStatus.Status.UP, "Artifact store reachable", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.provider.metadata.model").value("placeholder-renderer-1.0"))
                .andExpect(jsonPath("$.components.storage.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health returns 503 when any component is DOWN")
    void anyDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("provider", HealthStatus.Status.DOWN, "not configured", Map.of()),
                new HealthStatus("storage", HealthStatus.Status.UP, "reachable", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.provider.status").value("DOWN"));
    }
}
