package io.procura.backend.security;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * The identity performing an operation and the roles it holds (without the {@code ROLE_} prefix,
 * lower-cased, e.g. {@code contract_officer}).
 */
public record Actor(String id, Set<String> roles) {

  private static final String AUTHORITY_PREFIX = "ROLE_";

  public Actor {
    Objects.requireNonNull(id, "id must not be null");
    roles = roles == null ? Set.of() : Set.copyOf(roles);
  }

  public static Actor of(String id, String... roles) {
    return new Actor(id, Set.of(roles));
  }

  /**
   * The actor of the current request.
   *
   * @throws AuthenticationCredentialsNotFoundException if the request is not authenticated
   */
  public static Actor current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth == null || auth instanceof AnonymousAuthenticationToken || !auth.isAuthenticated()) {
      throw new AuthenticationCredentialsNotFoundException("No authenticated actor");
    }
    return from(auth);
  }

  public static Actor from(Authentication authentication) {
    var roles =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(authority -> authority != null && authority.startsWith(AUTHORITY_PREFIX))
            .map(
                authority ->
                    authority.substring(AUTHORITY_PREFIX.length()).toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    return new Actor(authentication.getName(), roles);
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  public boolean isAdmin() {
    return hasRole(Roles.ADMIN);
  }

  /** Admins may act on any approval step; everyone else needs the step's role. */
  public boolean canActAs(String approverRole) {
    return isAdmin() || hasRole(approverRole);
  }
}
