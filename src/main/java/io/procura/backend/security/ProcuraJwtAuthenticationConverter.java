package io.procura.backend.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class ProcuraJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLES_CLAIM = "roles";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.CONTRACT_OFFICER, Roles.AUTHORITY_CONTRACT_OFFICER,
          Roles.VIEWER, Roles.AUTHORITY_VIEWER,
          Roles.AUTOMATION, Roles.AUTHORITY_AUTOMATION);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
    if (roles == null) {
      return List.of();
    }
    // unknown role names grant nothing
    return roles.stream()
        .map(ROLE_MAPPING::get)
        .filter(Objects::nonNull)
        .distinct()
        .<GrantedAuthority>map(SimpleGrantedAuthority::new)
        .toList();
  }
}
