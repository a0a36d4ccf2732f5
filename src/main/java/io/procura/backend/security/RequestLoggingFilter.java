package io.procura.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Puts a per-request id and the authenticated subject into the MDC for the log pattern. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_ACTOR_ID = "actorId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth != null && auth.isAuthenticated()) {
        MDC.put(MDC_ACTOR_ID, auth.getName());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ACTOR_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
