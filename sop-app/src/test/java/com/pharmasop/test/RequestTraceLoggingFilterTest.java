package com.pharmasop.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmasop.api.response.Response;
import com.pharmasop.config.HttpTraceLogProperties;
import com.pharmasop.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        HttpTraceLogProperties properties = new HttpTraceLogProperties();
        properties.setEnabled(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/api/test/echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.message").value("hello"));
    }

    @Test
    public void shouldReuseIncomingTraceId() throws Exception {
        mockMvc.perform(get("/api/test/ping").header("X-Trace-Id", "trace-from-gateway"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-from-gateway"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    public void shouldSkipExcludedActuatorPath() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @RestController
    private static class TestController {

        @PostMapping("/api/test/echo")
        public Response<Map<String, Object>> echo(@RequestBody(required = false) Map<String, Object> request) {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(request)
                    .build();
        }

        @GetMapping("/api/test/ping")
        public Response<String> ping() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("pong")
                    .build();
        }

        @GetMapping("/actuator/health")
        public Response<String> health() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("UP")
                    .build();
        }
    }
}
