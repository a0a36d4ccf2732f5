package io.procura.backend.audit;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Signing keys for the audit ledger.
 *
 * @param activeKeyVersion version used to sign new entries
 * @param keys key version to Base64-encoded HMAC key; retired versions stay listed so that older
 *     entries keep verifying
 */
@ConfigurationProperties(prefix = "procura.audit.signing")
public record AuditSigningProperties(String activeKeyVersion, Map<String, String> keys) {

  public AuditSigningProperties {
    keys = keys == null ? Map.of() : Map.copyOf(keys);
  }
}
