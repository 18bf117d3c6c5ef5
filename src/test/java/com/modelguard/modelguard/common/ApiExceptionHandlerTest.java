package com.modelguard.modelguard.common;

import com.modelguard.modelguard.promotion.PromotionController;
import com.modelguard.modelguard.promotion.PromotionDecisionNotFoundException;
import com.modelguard.modelguard.promotion.PromotionRequest;
import com.modelguard.modelguard.promotion.PromotionService;
import com.modelguard.modelguard.registry.RegistryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.net.URI;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiExceptionHandlerTest {

    private PromotionService promotionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        promotionService = mock(PromotionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new PromotionController(promotionService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void missingDecisionIsNotFoundWithErrorCode() throws Exception {
        when(promotionService.getDecision(42L)).thenThrow(new PromotionDecisionNotFoundException(42L));

        mockMvc.perform(get("/api/promotion/decisions/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROMOTION_DECISION_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/promotion/decisions/42"));
    }

    @Test
    void registryOutageIsServiceUnavailable() throws Exception {
        WebClientRequestException cause = new WebClientRequestException(new IOException("connection refused"),
                HttpMethod.POST, URI.create("http://registry"),
                new HttpHeaders());
        when(promotionService.evaluateAndApply(any(PromotionRequest.class)))
                .thenThrow(new RegistryUnavailableException("get-latest-versions", cause));

        mockMvc.perform(post("/api/promotion/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelName\": \"classifier\", \"challengerVersion\": \"4\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("REGISTRY_UNAVAILABLE"));
    }

    @Test
    void invalidArgumentsAreBadRequests() throws Exception {
        when(promotionService.evaluateAndApply(any(PromotionRequest.class)))
                .thenThrow(new IllegalArgumentException("challengerVersion is required"));

        mockMvc.perform(post("/api/promotion/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelName\": \"classifier\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("challengerVersion is required"));

        mockMvc.perform(get("/api/promotion/decisions/not-a-number"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }
}
