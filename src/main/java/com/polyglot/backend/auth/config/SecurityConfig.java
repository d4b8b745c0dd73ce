package com.polyglot.backend.auth.config;

import com.polyglot.backend.auth.security.IdentityHeaderFilter;
import com.polyglot.backend.common.web.ApiExceptionHandler;
import com.polyglot.backend.common.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

@Configuration
public class SecurityConfig {

    private final IdentityHeaderFilter identityHeaderFilter;

    public SecurityConfig(IdentityHeaderFilter identityHeaderFilter) {
        this.identityHeaderFilter = identityHeaderFilter;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/actuator/**", "/v3/api-docs/**", "/swagger-ui/**", "/error").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/v1/languages").permitAll()
                        .anyRequest().authenticated()
                )
                .addFilterBefore(identityHeaderFilter, UsernamePasswordAuthenticationFilter.class)
                // ✅ 401/403 也回統一的 JSON 格式
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) ->
                                writeError(req, res, HttpServletResponse.SC_UNAUTHORIZED,
                                        "UNAUTHENTICATED", "User identity is required"))
                        .accessDeniedHandler((req, res, e) ->
                                writeError(req, res, HttpServletResponse.SC_FORBIDDEN,
                                        "FORBIDDEN", "Access denied"))
                );

        return http.build();
    }

    private static void writeError(HttpServletRequest req, HttpServletResponse res, int status,
                                   String code, String message) throws IOException {
        req.setAttribute(ApiExceptionHandler.ERROR_ATTR, message);
        res.setStatus(status);
        res.setContentType("application/json");
        res.getWriter().write("{\"success\":false,\"error\":\"" + message
                              + "\",\"error_code\":\"" + code
                              + "\",\"request_id\":\"" + RequestIdFilter.getOrCreate(req) + "\"}");
    }
}
