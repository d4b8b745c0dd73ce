package com.polyglot.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.backend.syslog.entity.SystemLogEntity;
import com.polyglot.backend.syslog.repo.SystemLogRepository;
import com.polyglot.backend.testsupport.BaseSpringTest;
import com.polyglot.backend.testsupport.MutableClock;
import com.polyglot.backend.testsupport.TestOverridesConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 完整 HTTP 流程：身分 header → 翻譯（含冷卻）→ 歷史 → 報表 → 清除。
 * 使用 stub provider + H2。
 */
@SpringBootTest
@AutoConfigureMockMvc
class TranslationFlowTest extends BaseSpringTest {

    private static final String ID_HEADER = "X-User-Email";

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired MutableClock clock;
    @Autowired SystemLogRepository systemLogs;

    private String email;

    @BeforeEach
    void setUp() throws Exception {
        clock.set(TestOverridesConfiguration.START);
        email = "flow-" + UUID.randomUUID() + "@x.com";

        mvc.perform(post("/api/v1/users/login")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"full_name\":\"Flow User\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.user.full_name").value("Flow User"))
                .andExpect(jsonPath("$.user.total_translations").value(0));
    }

    private String translateBody(String text) {
        return "{\"text\":\"" + text + "\",\"source_lang\":\"en\",\"target_lang_name\":\"Spanish\"}";
    }

    @Test
    void translate_then_cooldown_then_history_and_dashboard() throws Exception {
        String body = mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.translated_text").value("[es] Hello"))
                .andExpect(jsonPath("$.source_lang").value("en"))
                .andExpect(jsonPath("$.target_lang").value("es"))
                .andExpect(jsonPath("$.target_lang_name").value("spanish"))
                .andExpect(jsonPath("$.translation_type").value("text"))
                .andExpect(jsonPath("$.character_count").value(5))
                .andExpect(jsonPath("$.attempts").value(1))
                .andReturn().getResponse().getContentAsString();
        long id = om.readTree(body).get("translation_id").asLong();

        // 冷卻中
        clock.advance(Duration.ofSeconds(5));
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Again")))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "15"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.retry_after_sec").value(15));

        clock.advance(Duration.ofSeconds(15));
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Again")))
                .andExpect(status().isOk());

        mvc.perform(get("/api/v1/history").header(ID_HEADER, email).param("per_page", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translations.length()").value(1))
                .andExpect(jsonPath("$.translations[0].original_text").value("Again"))
                .andExpect(jsonPath("$.pagination.has_more").value(true));

        mvc.perform(get("/api/v1/history/{id}", id).header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translation.original_text").value("Hello"))
                .andExpect(jsonPath("$.translation.source_language_name").value("english"));

        mvc.perform(get("/api/v1/history/search").header(ID_HEADER, email).param("query", "hello"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        mvc.perform(get("/api/v1/dashboard").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_info.total_translations").value(2))
                .andExpect(jsonPath("$.today.translations").value(2))
                .andExpect(jsonPath("$.top_language_pairs[0].language_pair").value("en-es"));

        mvc.perform(get("/api/v1/statistics").header(ID_HEADER, email).param("period", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_statistics.total_translations").value(2))
                .andExpect(jsonPath("$.hourly_patterns.length()").value(24));

        mvc.perform(get("/api/v1/analytics/daily").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.period_days").value(30))
                .andExpect(jsonPath("$.summary.total_translations").value(2));

        mvc.perform(put("/api/v1/analytics/languages/favorite")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_language\":\"en\",\"target_language\":\"es\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pair.favorite").value(true));

        mvc.perform(get("/api/v1/analytics/languages").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.most_used_pair").value("en-es"))
                .andExpect(jsonPath("$.language_pairs[0].usage_count").value(2));
    }

    @Test
    void clear_requires_confirm_and_resets_profile() throws Exception {
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isOk());

        mvc.perform(post("/api/v1/history/clear").header(ID_HEADER, email))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("CONFIRMATION_REQUIRED"));

        mvc.perform(post("/api/v1/history/clear").header(ID_HEADER, email).param("confirm", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_count").value(1));

        mvc.perform(post("/api/v1/history/clear").header(ID_HEADER, email).param("confirm", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_count").value(0));

        mvc.perform(get("/api/v1/users/me").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.total_translations").value(0))
                .andExpect(jsonPath("$.user.total_characters").value(0));
    }

    @Test
    void invalid_input_does_not_start_cooldown() throws Exception {
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\",\"source_lang\":\"en\",\"target_lang\":\"klingon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_TARGET_LANGUAGE"));

        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isOk());
    }

    @Test
    void missing_identity_is_401_but_languages_are_public() throws Exception {
        mvc.perform(get("/api/v1/dashboard").header("X-Request-Id", "RID-401"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Request-Id", "RID-401"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("UNAUTHENTICATED"))
                .andExpect(jsonPath("$.request_id").value("RID-401"));

        mvc.perform(get("/api/v1/languages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(107))
                .andExpect(jsonPath("$.languages[0].code").value("af"));
    }

    @Test
    void user_preferences_are_validated() throws Exception {
        mvc.perform(patch("/api/v1/users/me/preferences")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"preferred_source_lang\":\"German\",\"preferred_target_lang\":\"ja\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.preferred_source_lang").value("de"))
                .andExpect(jsonPath("$.user.preferred_target_lang").value("ja"));

        mvc.perform(patch("/api/v1/users/me/preferences")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"preferred_target_lang\":\"elvish\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_TARGET_LANGUAGE"));
    }

    @Test
    void key_value_preferences_round_trip_over_http() throws Exception {
        mvc.perform(put("/api/v1/users/me/preferences/ui.theme")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":{\"mode\":\"dark\"},\"category\":\"ui\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.preference.key").value("ui.theme"))
                .andExpect(jsonPath("$.preference.category").value("ui"))
                .andExpect(jsonPath("$.preference.value.mode").value("dark"))
                .andExpect(jsonPath("$.preference.updated_at").exists());

        mvc.perform(get("/api/v1/users/me/preferences/ui.theme").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preference.value.mode").value("dark"));

        mvc.perform(get("/api/v1/users/me/preferences").header(ID_HEADER, email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preferences.ui['ui.theme'].mode").value("dark"));

        mvc.perform(get("/api/v1/users/me/preferences/missing").header(ID_HEADER, email))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("PREFERENCE_NOT_FOUND"));

        mvc.perform(put("/api/v1/users/me/preferences/volume")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":1,\"category\":\"video\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_PREFERENCE_CATEGORY"));
    }

    @Test
    void unknown_user_cannot_translate() throws Exception {
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, "never-logged-in-" + UUID.randomUUID() + "@x.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("USER_NOT_FOUND"));
    }

    @Test
    void api_calls_are_written_to_system_log() throws Exception {
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .header("User-Agent", "flow-test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isOk());
        mvc.perform(post("/api/v1/translate")
                        .header(ID_HEADER, email)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(translateBody("Hello")))
                .andExpect(status().isTooManyRequests());
        mvc.perform(get("/api/v1/history/{id}", 999_999_999L).header(ID_HEADER, email))
                .andExpect(status().isNotFound());

        // login + 3 個呼叫；寫入是非同步的
        List<SystemLogEntity> rows = awaitLogs(email, 4);

        assertThat(rows).extracting(SystemLogEntity::getAction)
                .contains("post_users_login", "post_translate", "get_history_id");

        SystemLogEntity ok = rows.stream()
                .filter(r -> r.getStatusCode() == 200 && r.getEndpoint().equals("/api/v1/translate"))
                .findFirst().orElseThrow();
        assertThat(ok.getUserAgent()).isEqualTo("flow-test");
        assertThat(ok.getMethod()).isEqualTo("POST");
        JsonNode data = om.readTree(ok.getRequestData());
        assertThat(data.get("request_id").asText()).isNotBlank();

        SystemLogEntity limited = rows.stream().filter(r -> r.getStatusCode() == 429).findFirst().orElseThrow();
        assertThat(limited.getErrorMessage()).startsWith("Please wait");

        SystemLogEntity missing = rows.stream().filter(r -> r.getStatusCode() == 404).findFirst().orElseThrow();
        assertThat(missing.getEndpoint()).isEqualTo("/api/v1/history/{id}");
    }

    @Test
    void request_id_is_echoed_or_generated() throws Exception {
        mvc.perform(get("/api/v1/users/me").header(ID_HEADER, email).header("X-Request-Id", "abc-123"))
                .andExpect(header().string("X-Request-Id", "abc-123"));

        mvc.perform(get("/api/v1/users/me").header(ID_HEADER, email).header("X-Request-Id", "bad\"id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(result -> assertThat(result.getResponse().getHeader("X-Request-Id")).doesNotContain("\""));
    }

    private List<SystemLogEntity> awaitLogs(String user, int atLeast) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        List<SystemLogEntity> rows = systemLogs.findByUserEmailOrderByIdAsc(user);
        while (rows.size() < atLeast && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            rows = systemLogs.findByUserEmailOrderByIdAsc(user);
        }
        assertThat(rows).hasSizeGreaterThanOrEqualTo(atLeast);
        return rows;
    }
}
