package com.polyglot.backend.translation.controller;

import com.polyglot.backend.auth.security.AuthContext;
import com.polyglot.backend.common.web.ClientAddress;
import com.polyglot.backend.translation.dto.TranslationDtos;
import com.polyglot.backend.translation.language.SupportedLanguages;
import com.polyglot.backend.translation.service.TranslationGateway;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Translation", description = "Rate-limited translation + supported languages")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1")
public class TranslationController {

    private final AuthContext auth;
    private final TranslationGateway gateway;
    private final SupportedLanguages languages;

    @PostMapping(value = "/translate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TranslationDtos.TranslateResponse translate(
            @RequestBody TranslationDtos.TranslateRequest body,
            HttpServletRequest req
    ) {
        String email = auth.requireUserEmail();

        // ✅ code 優先，沒給才用名稱
        String source = firstNonBlank(body.sourceLang(), body.sourceLangName());
        String target = firstNonBlank(body.targetLang(), body.targetLangName());

        var outcome = gateway.translate(new TranslationDtos.TranslateCommand(
                email,
                body.text(),
                source,
                target,
                body.translationType(),
                ClientAddress.of(req),
                req.getHeader(HttpHeaders.USER_AGENT)
        ));

        return new TranslationDtos.TranslateResponse(
                true,
                outcome.eventId(),
                outcome.originalText(),
                outcome.translatedText(),
                outcome.sourceLang(),
                outcome.targetLang(),
                languages.nameOf(outcome.sourceLang()),
                languages.nameOf(outcome.targetLang()),
                outcome.translationType(),
                outcome.characterCount(),
                outcome.elapsedMs(),
                outcome.confidence(),
                outcome.attempts()
        );
    }

    /** 不需要登入 */
    @GetMapping("/languages")
    public TranslationDtos.LanguagesResponse languages() {
        var items = languages.all().stream()
                .map(l -> new TranslationDtos.LanguageItem(l.code(), l.name()))
                .toList();
        return new TranslationDtos.LanguagesResponse(true, items, items.size());
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return b;
    }
}
