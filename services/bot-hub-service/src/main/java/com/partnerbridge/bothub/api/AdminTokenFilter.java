package com.partnerbridge.bothub.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/** Protects /admin/** with a shared token header. No token configured means no admin access. */
@Component
@Slf4j
public class AdminTokenFilter extends OncePerRequestFilter {

  static final String HEADER = "X-Admin-Token";

  private static final UrlPathHelper PATHS = new UrlPathHelper();

  private final String expectedToken;

  public AdminTokenFilter(@Value("${bothub.admin.token:}") String expectedToken) {
    this.expectedToken = expectedToken == null ? "" : expectedToken.trim();
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !adminPath(request).startsWith("/admin/");
  }

  /** Request path below the context path and any prefix servlet mapping, decoded. */
  static String adminPath(HttpServletRequest request) {
    String path = PATHS.getPathWithinApplication(request);
    String pathInfo = request.getPathInfo();
    if (pathInfo != null && path.endsWith(pathInfo)) {
      return pathInfo;
    }
    return path;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (expectedToken.isBlank()) {
      reject(response, HttpServletResponse.SC_FORBIDDEN, "admin access is not configured");
      return;
    }

    String provided = request.getHeader(HEADER);
    if (provided == null || !matches(provided)) {
      log.warn("Admin token mismatch for {} {}", request.getMethod(), request.getRequestURI());
      reject(response, HttpServletResponse.SC_UNAUTHORIZED, "unauthorized");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private boolean matches(String provided) {
    return MessageDigest.isEqual(
        expectedToken.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
  }

  private static void reject(HttpServletResponse response, int status, String message)
      throws IOException {
    response.setStatus(status);
    response.setContentType("application/json");
    response.getWriter().write("{\"code\":\"" + status + "\",\"message\":\"" + message + "\"}");
  }
}
