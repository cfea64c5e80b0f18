package com.itms.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.itms.backend.modules.auth.application.JwtTokenService;
import com.itms.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.itms.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.CapabilityTable;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Turns a bearer token into a {@link JwtAuthenticationPrincipal}. Granted authorities are the
 * {@code ROLE_*} of each role plus the capabilities that role holds, so URL rules can match either.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService,
                                   RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.jwtTokenService = jwtTokenService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                ParsedToken parsed = jwtTokenService.parseAccessToken(token);
                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        parsed.userId(),
                        parsed.loginId(),
                        parsed.roles()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, toAuthorities(parsed.roles()));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException("INVALID_ACCESS_TOKEN", ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/auth/") || path.startsWith("/health") || path.startsWith("/actuator/health");
    }

    private List<SimpleGrantedAuthority> toAuthorities(List<String> roles) {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        for (String roleCode : roles) {
            authorities.add(new SimpleGrantedAuthority("ROLE_" + roleCode));
            AccessRole.fromCode(roleCode).ifPresent(role ->
                    CapabilityTable.capabilitiesOf(role).forEach(capability ->
                            authorities.add(new SimpleGrantedAuthority(capability.name()))));
        }
        return authorities;
    }
}
