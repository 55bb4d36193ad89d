package com.replyrelay.orchestrator.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Protects /internal/** operator endpoints with a shared token header. */
@Component
@Slf4j
public class InternalApiAuthFilter extends OncePerRequestFilter {

  private final String expectedToken;

  public InternalApiAuthFilter(@Value("${internal.auth.token:}") String expectedToken) {
    this.expectedToken = expectedToken == null ? "" : expectedToken.trim();
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getServletPath();
    return path == null || !path.startsWith("/internal/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (expectedToken.isBlank()) {
      reject(
          response,
          HttpServletResponse.SC_SERVICE_UNAVAILABLE,
          "internal.auth.token is not configured");
      return;
    }

    String provided = request.getHeader("X-Internal-Token");
    if (provided == null || !expectedToken.equals(provided)) {
      log.warn("Internal token mismatch for {} {}", request.getMethod(), request.getRequestURI());
      reject(response, HttpServletResponse.SC_UNAUTHORIZED, "unauthorized");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private static void reject(HttpServletResponse response, int status, String error)
      throws IOException {
    response.setStatus(status);
    response.setContentType("application/json");
    response.getWriter().write("{\"error\":\"" + error + "\"}");
  }
}
