package com.codeheadsystems.delegate.springboot.security;

import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Turns a valid owner bearer token into a {@link DelegatePrincipal} with the {@code ROLE_OWNER}
 * authority. An absent or invalid token leaves the request anonymous; the security chain decides
 * what that means for the path.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
  private static final String BEARER = "Bearer ";
  private static final List<SimpleGrantedAuthority> OWNER = List.of(new SimpleGrantedAuthority("ROLE_OWNER"));

  private final OwnerTokenManager tokenManager;
  private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

  /**
   * Instantiates a new Jwt authentication filter.
   *
   * @param tokenManager the owner token manager
   */
  public JwtAuthenticationFilter(OwnerTokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader != null && authHeader.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
      String token = authHeader.substring(BEARER.length()).trim();
      tokenManager.verify(token).ifPresentOrElse(result -> {
        DelegatePrincipal principal = new DelegatePrincipal(result.accountId(), result.jti());
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(principal, null, OWNER);
        auth.setDetails(detailsSource.buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(auth);
      }, () -> log.debug("Rejected owner token on {} {}", request.getMethod(), request.getRequestURI()));
    }
    filterChain.doFilter(request, response);
  }
}
