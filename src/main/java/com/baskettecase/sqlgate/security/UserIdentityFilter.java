package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.store.AppUser;
import com.baskettecase.sqlgate.store.AppUserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * User Identity Filter
 *
 * Resolves the calling application user from the X-User-Id header set by the upstream gateway,
 * which has already authenticated the user. Administrators also receive ROLE_ADMIN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserIdentityFilter extends OncePerRequestFilter {

    static final String USER_ID_HEADER = "X-User-Id";

    private final AppUserRepository userRepository;

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String requestPath = request.getRequestURI();
        if (isPublicEndpoint(requestPath)) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<AppUser> user = resolveUser(request.getHeader(USER_ID_HEADER));
        if (user.isEmpty()) {
            log.debug("🚫 Returning 401 for {} {}", request.getMethod(), requestPath);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write(String.format(
                "{\"code\":\"UNAUTHENTICATED\",\"message\":\"A valid %s header for an active user is required\","
                    + "\"traceId\":%s}",
                USER_ID_HEADER, jsonString(MDC.get("trace_id"))));
            return;
        }

        AppUser appUser = user.get();
        request.setAttribute(RequestUserContext.USER_ATTRIBUTE, appUser);

        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (appUser.admin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        SecurityContextHolder.getContext().setAuthentication(
            new UsernamePasswordAuthenticationToken(appUser.username(), null, authorities));

        log.debug("✅ Request by {} (admin: {})", appUser.username(), appUser.admin());
        filterChain.doFilter(request, response);
    }

    private Optional<AppUser> resolveUser(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        long userId;
        try {
            userId = Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            log.warn("❌ Malformed {} header: {}", USER_ID_HEADER, header);
            return Optional.empty();
        }
        return userRepository.findById(userId).filter(AppUser::active);
    }

    private static String jsonString(String value) {
        return value == null ? "null" : "\"" + value.replace("\"", "") + "\"";
    }

    private boolean isPublicEndpoint(String path) {
        return path.startsWith("/actuator/health") ||
               path.startsWith("/actuator/info") ||
               path.startsWith("/actuator/prometheus");
    }
}
