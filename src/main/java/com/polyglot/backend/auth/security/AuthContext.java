package com.polyglot.backend.auth.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

/**
 * 取目前請求的使用者 email。
 * 身分驗證由上游處理，這裡只負責「拿得到 / 拿不到（401）」。
 */
@Component
public class AuthContext {

    public String requireUserEmail() {
        // 1) 優先從 SecurityContext 取 IdentityHeaderFilter 放的 principal
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof String s && s.contains("@")) {
            return s;
        }

        // 2) 相容：filter 也會把 email 放進 request attribute
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();
            Object v = req.getAttribute(IdentityHeaderFilter.ATTR);
            if (v instanceof String s && !s.isBlank()) return s;
        }

        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED");
    }
}
