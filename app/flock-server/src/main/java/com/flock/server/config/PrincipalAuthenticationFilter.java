package com.flock.server.config;

import com.flock.server.service.CredentialGate;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the agent principal from HTTP Basic credentials (username + auth token).
 *
 * <p>Requests without valid credentials pass through unauthenticated; the authorization rules
 * decide whether that ends in a 401.
 */
public class PrincipalAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(PrincipalAuthenticationFilter.class);
  static final String AGENT_ROLE = "ROLE_AGENT";
  private static final String BASIC_PREFIX = "Basic ";

  private final CredentialGate credentialGate;

  public PrincipalAuthenticationFilter(CredentialGate credentialGate) {
    this.credentialGate = credentialGate;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/admin/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String[] credentials = decodeBasic(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (credentials != null && credentialGate.authenticate(credentials[0], credentials[1])) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              credentials[0], "N/A", List.of(new SimpleGrantedAuthority(AGENT_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else if (credentials != null) {
      logger.debug("agent authentication rejected path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private String[] decodeBasic(String header) {
    if (header == null || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
      return null;
    }
    final String decoded;
    try {
      decoded =
          new String(
              Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()),
              StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      logger.debug("malformed basic authorization header ignored");
      return null;
    }
    final int separator = decoded.indexOf(':');
    if (separator < 0) {
      return null;
    }
    return new String[] {decoded.substring(0, separator), decoded.substring(separator + 1)};
  }
}
