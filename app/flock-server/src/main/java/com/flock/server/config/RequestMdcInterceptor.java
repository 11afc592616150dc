/*
 * Where: Flock web layer
 * What: Tags every log line of a request with its id, route, caller address and agent
 * Why: Agent submissions are investigated per host, so the agent name must reach the logs
 */
package com.flock.server.config;

import com.flock.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String AGENT_KEY = "user_id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", TraceIds.orNew(request.getHeader(REQUEST_ID_HEADER)));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", firstForwardedAddress(request));
    put(keys, AGENT_KEY, authenticatedAgent());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  // left-most X-Forwarded-For hop
  private String firstForwardedAddress(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  // only HTTP Basic agents are tagged; admin token callers have no host identity
  @Nullable
  private String authenticatedAgent() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null || !authentication.isAuthenticated()) {
      return null;
    }
    final boolean agent =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch(PrincipalAuthenticationFilter.AGENT_ROLE::equals);
    return agent ? authentication.getName() : null;
  }

  private void put(List<String> keys, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      keys.add(key);
    }
  }
}
