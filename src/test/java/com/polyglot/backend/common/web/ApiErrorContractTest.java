package com.polyglot.backend.common.web;

import com.polyglot.backend.auth.security.AuthContext;
import com.polyglot.backend.auth.security.IdentityHeaderFilter;
import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.common.error.PersistenceUnavailableException;
import com.polyglot.backend.common.error.RateLimitedException;
import com.polyglot.backend.common.error.UpstreamUnavailableException;
import com.polyglot.backend.history.controller.HistoryController;
import com.polyglot.backend.history.service.HistoryService;
import com.polyglot.backend.syslog.web.SystemLogFilter;
import com.polyglot.backend.translation.controller.TranslationController;
import com.polyglot.backend.translation.language.SupportedLanguages;
import com.polyglot.backend.translation.service.TranslationGateway;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = { TranslationController.class, HistoryController.class },
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        },
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE,
                        classes = { IdentityHeaderFilter.class, SystemLogFilter.class })
        }
)
@Import({ApiExceptionHandler.class, RequestIdFilter.class, SupportedLanguages.class})
class ApiErrorContractTest {

    private static final String BODY = "{\"text\":\"Hello\",\"source_lang\":\"en\",\"target_lang\":\"es\"}";

    @Autowired MockMvc mvc;

    @MockitoBean AuthContext auth;
    @MockitoBean TranslationGateway gateway;
    @MockitoBean HistoryService historyService;

    @Test
    void cooldown_should_429_with_retry_after() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(gateway.translate(any()))
                .thenThrow(new RateLimitedException("Please wait 7 seconds before the next translation", 7, "RETRY_LATER"));

        mvc.perform(post("/api/v1/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY)
                        .header("X-Request-Id", "RID-429"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "7"))
                .andExpect(header().string("X-Request-Id", "RID-429"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.client_action").value("RETRY_LATER"))
                .andExpect(jsonPath("$.retry_after_sec").value(7))
                .andExpect(jsonPath("$.request_id").value("RID-429"));
    }

    @Test
    void invalid_input_should_400_with_fix_request() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(gateway.translate(any())).thenThrow(new InvalidInputException("TEXT_REQUIRED", "Text is required"));

        mvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("TEXT_REQUIRED"))
                .andExpect(jsonPath("$.error").value("Text is required"))
                .andExpect(jsonPath("$.client_action").value("FIX_REQUEST"))
                .andExpect(jsonPath("$.retry_after_sec").doesNotExist());
    }

    @Test
    void missing_identity_should_401() throws Exception {
        Mockito.when(auth.requireUserEmail())
                .thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"));

        mvc.perform(get("/api/v1/history").header("X-Request-Id", "RID-401"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("UNAUTHENTICATED"))
                .andExpect(jsonPath("$.error").value("User identity is required"))
                .andExpect(jsonPath("$.request_id").value("RID-401"));
    }

    @Test
    void provider_give_up_should_503() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(gateway.translate(any())).thenThrow(new UpstreamUnavailableException(
                "PROVIDER_GIVE_UP", "Translation service is temporarily unavailable, please try again later",
                5, "PROVIDER_UPSTREAM_5XX"));

        mvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("PROVIDER_GIVE_UP"))
                .andExpect(jsonPath("$.client_action").value("RETRY_LATER"));
    }

    @Test
    void unrecorded_translation_should_503() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(gateway.translate(any())).thenThrow(new PersistenceUnavailableException(
                "TRANSLATION_NOT_RECORDED", "Translation could not be recorded, please try again later",
                new RuntimeException("db")));

        mvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("TRANSLATION_NOT_RECORDED"));
    }

    @Test
    void missing_translation_should_404() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(historyService.get(eq("u@x.com"), eq(99L)))
                .thenThrow(new NotFoundException("TRANSLATION_NOT_FOUND", "Translation not found: 99"));

        mvc.perform(get("/api/v1/history/99").header("X-Request-Id", "RID-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("TRANSLATION_NOT_FOUND"))
                .andExpect(jsonPath("$.request_id").value("RID-404"));
    }

    @Test
    void non_numeric_id_should_400() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");

        mvc.perform(get("/api/v1/history/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("PARAMETER_INVALID"));
    }

    @Test
    void malformed_body_should_400() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");

        mvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BODY_INVALID"));
    }

    @Test
    void unexpected_error_should_500_without_leaking_message() throws Exception {
        Mockito.when(auth.requireUserEmail()).thenReturn("u@x.com");
        Mockito.when(gateway.translate(any())).thenThrow(new IllegalStateException("secret internals"));

        mvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"))
                .andExpect(content().string(not(containsString("secret internals"))));
    }

    @Test
    void languages_list_is_served() throws Exception {
        mvc.perform(get("/api/v1/languages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(107));
    }
}
