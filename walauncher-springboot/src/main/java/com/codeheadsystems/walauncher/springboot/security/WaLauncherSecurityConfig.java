package com.codeheadsystems.walauncher.springboot.security;

import com.codeheadsystems.walauncher.server.auth.SessionTokenVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class WaLauncherSecurityConfig {

  @Bean
  public SessionTokenAuthenticationFilter sessionTokenAuthenticationFilter(SessionTokenVerifier verifier,
                                                                           DevTenantFallback devTenantFallback,
                                                                           ObjectMapper objectMapper) {
    return new SessionTokenAuthenticationFilter(verifier, devTenantFallback, objectMapper);
  }

  /**
   * Keeps the filter out of the plain servlet chain; it only runs inside the security chain.
   */
  @Bean
  public FilterRegistrationBean<SessionTokenAuthenticationFilter> sessionTokenFilterRegistration(
      SessionTokenAuthenticationFilter filter) {
    FilterRegistrationBean<SessionTokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 SessionTokenAuthenticationFilter sessionTokenFilter) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        // framing is governed by the Content-Security-Policy set on embedded pages
        .headers(headers -> headers.frameOptions(frame -> frame.disable()))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/install", "/auth/callback", "/embedded", "/whatsapp-widget.js",
                "/webhooks/**", "/health", "/actuator/health", "/error").permitAll()
            .requestMatchers("/api/**").authenticated()
            .anyRequest().denyAll())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(sessionTokenFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
