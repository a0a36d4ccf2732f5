package io.procura.backend.security;

/**
 * Centralized role constants used across authentication, authorization and approver checks.
 *
 * <p>Role names arrive in the JWT {@code roles} claim. Spring authorities are the {@code ROLE_}
 * prefixed, upper-cased versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "roles" claim values; also the approverRole of chain steps
  public static final String ADMIN = "admin";
  public static final String CONTRACT_OFFICER = "contract_officer";
  public static final String VIEWER = "viewer";
  public static final String AUTOMATION = "automation";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_CONTRACT_OFFICER = "ROLE_CONTRACT_OFFICER";
  public static final String AUTHORITY_VIEWER = "ROLE_VIEWER";
  public static final String AUTHORITY_AUTOMATION = "ROLE_AUTOMATION";

  private Roles() {}
}
