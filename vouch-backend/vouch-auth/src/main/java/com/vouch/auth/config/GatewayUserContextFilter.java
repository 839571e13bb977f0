package com.vouch.auth.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static com.vouch.auth.domain.constants.TokenConstants.TRACE_ID_HEADER;
import static com.vouch.auth.domain.constants.TokenConstants.USER_ID_HEADER;
import static com.vouch.auth.domain.constants.TokenConstants.USER_ROLES_HEADER;

/**
 * Turns the identity headers forwarded by the API gateway into a Spring Security
 * authentication. The gateway validates bearer tokens; this service never does.
 * Requests without a well-formed X-User-Id stay anonymous.
 * Also copies X-Trace-Id into the logging MDC for the duration of the request.
 */
@Slf4j
public class GatewayUserContextFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String userIdHeader = request.getHeader(USER_ID_HEADER);

        if (StringUtils.hasText(userIdHeader)) {
            try {
                UUID userId = UUID.fromString(userIdHeader.trim());
                List<SimpleGrantedAuthority> authorities = parseRoles(request.getHeader(USER_ROLES_HEADER));

                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(
                        new UsernamePasswordAuthenticationToken(userId.toString(), null, authorities));
                SecurityContextHolder.setContext(context);
            } catch (IllegalArgumentException e) {
                log.warn("[GATEWAY_HEADER_INVALID] Ignoring malformed user id header | path={}",
                        request.getRequestURI());
            }
        }

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (StringUtils.hasText(traceId)) {
            MDC.put("traceId", traceId);
        }
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("traceId");
        }
    }

    private List<SimpleGrantedAuthority> parseRoles(String rolesHeader) {
        if (!StringUtils.hasText(rolesHeader)) {
            return List.of();
        }
        return Arrays.stream(rolesHeader.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)))
                .toList();
    }
}
