package com.flock.server.config;

import com.flock.server.service.CredentialGate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties(FlockAdminApiProperties.class)
public class FlockSecurityConfig {

  @Bean
  PrincipalAuthenticationFilter principalAuthenticationFilter(CredentialGate credentialGate) {
    return new PrincipalAuthenticationFilter(credentialGate);
  }

  @Bean
  AdminApiAuthenticationFilter adminApiAuthenticationFilter(FlockAdminApiProperties properties) {
    return new AdminApiAuthenticationFilter(properties);
  }

  // both filters run inside the security chain only, not as servlet filters
  @Bean
  FilterRegistrationBean<PrincipalAuthenticationFilter> principalAuthenticationFilterRegistration(
      PrincipalAuthenticationFilter filter) {
    final FilterRegistrationBean<PrincipalAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  FilterRegistrationBean<AdminApiAuthenticationFilter> adminApiAuthenticationFilterRegistration(
      AdminApiAuthenticationFilter filter) {
    final FilterRegistrationBean<AdminApiAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      PrincipalAuthenticationFilter principalAuthenticationFilter,
      AdminApiAuthenticationFilter adminApiAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(principalAuthenticationFilter, AuthorizationFilter.class)
        .addFilterBefore(adminApiAuthenticationFilter, AuthorizationFilter.class)
        // agents only learn that they are unauthenticated: 401 with an empty body
        .exceptionHandling(
            exceptions ->
                exceptions
                    .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
                    .accessDeniedHandler(
                        (request, response, ex) ->
                            response.setStatus(HttpStatus.FORBIDDEN.value())))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/register")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .hasRole("ADMIN")
                    .anyRequest()
                    .hasRole("AGENT"));
    return http.build();
  }
}
