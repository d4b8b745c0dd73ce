package com.polyglot.backend.users.controller;

import com.polyglot.backend.auth.security.AuthContext;
import com.polyglot.backend.users.dto.UserDtos;
import com.polyglot.backend.users.service.UserAccountService;
import com.polyglot.backend.users.service.UserPreferenceService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Users", description = "Login touch, profile, language and key/value preferences")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final AuthContext auth;
    private final UserAccountService service;
    private final UserPreferenceService preferenceService;

    /** 登入後呼叫一次：沒有帳號就建立，並更新 last_login */
    @PostMapping("/login")
    public UserDtos.ProfileResponse login(@Valid @RequestBody(required = false) UserDtos.LoginRequest body) {
        String email = auth.requireUserEmail();
        return new UserDtos.ProfileResponse(true, service.touchLogin(email, body == null ? null : body.fullName()));
    }

    @GetMapping("/me")
    public UserDtos.ProfileResponse me() {
        return new UserDtos.ProfileResponse(true, service.profile(auth.requireUserEmail()));
    }

    @PatchMapping("/me/preferences")
    public UserDtos.ProfileResponse preferences(@RequestBody UserDtos.PreferencesRequest body) {
        String email = auth.requireUserEmail();
        return new UserDtos.ProfileResponse(true, service.updatePreferences(
                email, body.preferredSourceLang(), body.preferredTargetLang()));
    }

    /** 依 category 分組的全部 key/value 偏好 */
    @GetMapping("/me/preferences")
    public UserDtos.AllPreferencesResponse allPreferences() {
        return new UserDtos.AllPreferencesResponse(true, preferenceService.allPreferences(auth.requireUserEmail()));
    }

    @GetMapping("/me/preferences/{key}")
    public UserDtos.PreferenceResponse preference(@PathVariable("key") String key) {
        return new UserDtos.PreferenceResponse(true, preferenceService.getPreference(auth.requireUserEmail(), key));
    }

    @PutMapping("/me/preferences/{key}")
    public UserDtos.PreferenceResponse setPreference(
            @PathVariable("key") String key,
            @RequestBody UserDtos.PreferenceValueRequest body
    ) {
        String email = auth.requireUserEmail();
        return new UserDtos.PreferenceResponse(true, preferenceService.setPreference(email, key, body.value(), body.category()));
    }
}
