package com.flock.server.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class AdminApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(AdminApiAuthenticationFilter.class);
  static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final FlockAdminApiProperties properties;

  public AdminApiAuthenticationFilter(FlockAdminApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith("/admin/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidAdminToken(request.getHeader(properties.headerName()))) {
      SecurityContextHolder.getContext()
          .setAuthentication(
              new UsernamePasswordAuthenticationToken(
                  "flock-admin", "N/A", List.of(new SimpleGrantedAuthority(ADMIN_ROLE))));
    } else {
      logger.debug("admin authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isValidAdminToken(String actualToken) {
    // a blank configured token disables the admin API entirely
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
