package com.codeheadsystems.warden.springboot.security;

import com.codeheadsystems.warden.server.auth.BearerTokenExtractor;
import com.codeheadsystems.warden.server.auth.SessionManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Populates the security context from a bearer token that maps to a live session. Requests
 * without one pass through unauthenticated.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private final SessionManager sessionManager;

  public JwtAuthenticationFilter(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
        .flatMap(sessionManager::verify)
        .ifPresent(result -> {
          WardenPrincipal principal = new WardenPrincipal(result.subject(), result.jti());
          UsernamePasswordAuthenticationToken auth =
              new UsernamePasswordAuthenticationToken(principal, null, List.of());
          SecurityContextHolder.getContext().setAuthentication(auth);
        });
    filterChain.doFilter(request, response);
  }
}
