package com.codeheadsystems.delegate.springboot.security;

import com.codeheadsystems.delegate.model.ErrorResponse;
import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import com.codeheadsystems.delegate.server.model.Identities;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.function.Supplier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless security for the session key API. Each {@code /accounts/{accountId}/**} path is open
 * only to the owner of that account; anything else needs an owner token. Rejections carry the
 * same {@link ErrorResponse} body as every other API error.
 */
@Configuration
@EnableWebSecurity
public class DelegateSecurityConfig {

  @Bean
  public JwtAuthenticationFilter jwtAuthenticationFilter(OwnerTokenManager tokenManager) {
    return new JwtAuthenticationFilter(tokenManager);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 JwtAuthenticationFilter jwtFilter,
                                                 ObjectMapper objectMapper) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
            .requestMatchers("/accounts/{accountId}/**").access(DelegateSecurityConfig::ownsAccount)
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint((request, response, e) -> writeError(response, objectMapper,
                HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required"))
            .accessDeniedHandler((request, response, e) -> writeError(response, objectMapper,
                HttpStatus.FORBIDDEN, "FORBIDDEN", "Not the owner of this account")))
        .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }

  /**
   * Grants access when the authenticated owner is the account named in the path.
   *
   * @param authentication the current authentication
   * @param context        the request, with the {@code accountId} path variable
   * @return the decision
   */
  static AuthorizationDecision ownsAccount(Supplier<Authentication> authentication,
                                           RequestAuthorizationContext context) {
    Authentication auth = authentication.get();
    if (auth == null || !(auth.getPrincipal() instanceof DelegatePrincipal principal)) {
      return new AuthorizationDecision(false);
    }
    String account = Identities.normalize(context.getVariables().get("accountId"));
    return new AuthorizationDecision(principal.accountId().equals(account));
  }

  private static void writeError(HttpServletResponse response, ObjectMapper objectMapper,
                                 HttpStatus status, String error, String message) throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(error, message));
  }
}
