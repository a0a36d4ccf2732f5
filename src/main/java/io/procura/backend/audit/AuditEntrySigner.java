package io.procura.backend.audit;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Digest and HMAC primitives for audit entries. Keys are decoded and validated once at start-up;
 * key material is never logged.
 */
@Component
@EnableConfigurationProperties(AuditSigningProperties.class)
public class AuditEntrySigner {

  private static final Logger log = LoggerFactory.getLogger(AuditEntrySigner.class);

  /** Prior hash of the first entry in every chain. */
  public static final String GENESIS_HASH = "0".repeat(64);

  static final int MIN_KEY_BYTES = 32;
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final HexFormat HEX = HexFormat.of();

  private final String activeKeyVersion;
  private final Map<String, SecretKeySpec> keys;

  public AuditEntrySigner(AuditSigningProperties properties) {
    if (properties.activeKeyVersion() == null || properties.activeKeyVersion().isBlank()) {
      throw new IllegalStateException("procura.audit.signing.active-key-version is not set");
    }
    var decoded = new HashMap<String, SecretKeySpec>();
    for (var entry : properties.keys().entrySet()) {
      byte[] material;
      try {
        material = Base64.getDecoder().decode(entry.getValue().trim());
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException(
            "Audit signing key '" + entry.getKey() + "' is not valid Base64", e);
      }
      if (material.length < MIN_KEY_BYTES) {
        throw new IllegalStateException(
            "Audit signing key '"
                + entry.getKey()
                + "' must be at least "
                + MIN_KEY_BYTES
                + " bytes");
      }
      decoded.put(entry.getKey(), new SecretKeySpec(material, HMAC_ALGORITHM));
    }
    if (!decoded.containsKey(properties.activeKeyVersion())) {
      throw new IllegalStateException(
          "No audit signing key configured for active version '"
              + properties.activeKeyVersion()
              + "'");
    }
    this.activeKeyVersion = properties.activeKeyVersion();
    this.keys = Map.copyOf(decoded);
    log.info(
        "Audit signing initialised: activeKeyVersion={}, configuredVersions={}",
        activeKeyVersion,
        keys.keySet());
  }

  public String activeKeyVersion() {
    return activeKeyVersion;
  }

  /** SHA-256 of the given canonical document, lower-case hex. */
  public String digest(String canonicalDocument) {
    try {
      var sha256 = MessageDigest.getInstance("SHA-256");
      return HEX.formatHex(sha256.digest(canonicalDocument.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * HMAC-SHA256 over {@code priorHash + "\n" + digest + "\n" + sequence} with the key of the given
   * version.
   *
   * @throws IllegalArgumentException if the key version is not configured
   */
  public String sign(String keyVersion, String priorHash, String digest, long sequence) {
    var key = keys.get(keyVersion);
    if (key == null) {
      throw new IllegalArgumentException("Unknown audit signing key version: " + keyVersion);
    }
    try {
      var mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(key);
      var message = priorHash + "\n" + digest + "\n" + sequence;
      return HEX.formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 signing failed", e);
    }
  }

  public boolean knowsKeyVersion(String keyVersion) {
    return keyVersion != null && keys.containsKey(keyVersion);
  }

  /** Constant-time comparison of two hex strings. */
  public static boolean hexEquals(String expected, String actual) {
    if (expected == null || actual == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII), actual.getBytes(StandardCharsets.US_ASCII));
  }
}
