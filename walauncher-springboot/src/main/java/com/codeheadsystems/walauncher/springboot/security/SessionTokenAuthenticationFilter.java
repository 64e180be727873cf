package com.codeheadsystems.walauncher.springboot.security;

import com.codeheadsystems.walauncher.model.ErrorResponse;
import com.codeheadsystems.walauncher.server.auth.SessionTokenException;
import com.codeheadsystems.walauncher.server.auth.SessionTokenVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Attributes {@code /api/**} requests to a tenant from the session token in the
 * {@code Authorization: Bearer} header.
 * <p>
 * A presented token that fails verification ends the request with a generic 401; the reason is
 * only logged. Requests without a token fall through to the development fallback, and otherwise
 * to the security entry point.
 */
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final String BEARER = "Bearer ";

  private final SessionTokenVerifier verifier;
  private final DevTenantFallback devTenantFallback;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Session token authentication filter.
   *
   * @param verifier          the session token verifier
   * @param devTenantFallback the development fallback
   * @param objectMapper      the object mapper
   */
  public SessionTokenAuthenticationFilter(SessionTokenVerifier verifier,
                                          DevTenantFallback devTenantFallback,
                                          ObjectMapper objectMapper) {
    this.verifier = verifier;
    this.devTenantFallback = devTenantFallback;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith(request.getContextPath() + "/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith(BEARER)) {
      try {
        SessionTokenVerifier.VerifyResult result = verifier.verify(authHeader.substring(BEARER.length()).trim());
        authenticate(new ShopPrincipal(result.shop(), result.subject(), false));
      } catch (SessionTokenException e) {
        SecurityContextHolder.clearContext();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
            new ErrorResponse("unauthorized", "Authentication failed"));
        return;
      }
    } else {
      devTenantFallback.resolve(request.getParameter("shop"))
          .ifPresent(shop -> authenticate(new ShopPrincipal(shop, null, true)));
    }
    filterChain.doFilter(request, response);
  }

  private static void authenticate(ShopPrincipal principal) {
    UsernamePasswordAuthenticationToken auth =
        new UsernamePasswordAuthenticationToken(principal, null, List.of());
    SecurityContextHolder.getContext().setAuthentication(auth);
  }
}
