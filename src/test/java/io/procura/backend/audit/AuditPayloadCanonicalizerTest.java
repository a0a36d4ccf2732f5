package io.procura.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AuditPayloadCanonicalizerTest {

  private final AuditPayloadCanonicalizer canonicalizer = new AuditPayloadCanonicalizer();

  @Test
  void canonicalize_sortsKeysRegardlessOfInsertionOrder() {
    var first = new LinkedHashMap<String, Object>();
    first.put("zeta", 1);
    first.put("alpha", "a");
    var second = new LinkedHashMap<String, Object>();
    second.put("alpha", "a");
    second.put("zeta", 1);

    assertThat(canonicalizer.canonicalize(first)).isEqualTo("{\"alpha\":\"a\",\"zeta\":1}");
    assertThat(canonicalizer.canonicalize(second)).isEqualTo(canonicalizer.canonicalize(first));
  }

  @Test
  void canonicalize_sortsNestedMapKeys() {
    var payload = Map.of("outer", Map.of("b", 2, "a", 1));

    assertThat(canonicalizer.canonicalize(payload)).isEqualTo("{\"outer\":{\"a\":1,\"b\":2}}");
  }

  @Test
  void canonicalize_writesEquivalentNumbersIdentically() {
    var asInt = canonicalizer.canonicalize(Map.of("value", 10000));
    var asDouble = canonicalizer.canonicalize(Map.of("value", 10000.0));
    var asDecimal = canonicalizer.canonicalize(Map.of("value", new BigDecimal("10000.00")));

    assertThat(asInt).isEqualTo("{\"value\":10000}");
    assertThat(asDouble).isEqualTo(asInt);
    assertThat(asDecimal).isEqualTo(asInt);
  }

  @Test
  void canonicalize_stripsTrailingZerosFromFractions() {
    assertThat(canonicalizer.canonicalize(Map.of("score", new BigDecimal("82.50"))))
        .isEqualTo("{\"score\":82.5}");
  }

  @Test
  void canonicalize_preservesListOrder() {
    assertThat(canonicalizer.canonicalize(Map.of("refs", List.of("b", "a", "c"))))
        .isEqualTo("{\"refs\":[\"b\",\"a\",\"c\"]}");
  }

  @Test
  void canonicalize_writesUuidsAndTemporalsAsStrings() {
    var id = UUID.fromString("5c1d2a0e-8f3b-4c6d-9e7a-1b2c3d4e5f60");
    var payload =
        Map.of(
            "id", id,
            "at", Instant.parse("2026-03-01T10:15:30.123456789Z"),
            "due", LocalDate.of(2026, 4, 1));

    assertThat(canonicalizer.canonicalize(payload))
        .isEqualTo(
            "{\"at\":\"2026-03-01T10:15:30.123456Z\",\"due\":\"2026-04-01\","
                + "\"id\":\"5c1d2a0e-8f3b-4c6d-9e7a-1b2c3d4e5f60\"}");
  }

  @Test
  void canonicalize_nullPayloadIsEmptyObject() {
    assertThat(canonicalizer.canonicalize(null)).isEqualTo("{}");
  }

  @Test
  void canonicalize_rejectsNonFiniteNumbers() {
    assertThatThrownBy(() -> canonicalizer.canonicalize(Map.of("x", Double.NaN)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> canonicalizer.canonicalize(Map.of("x", Double.POSITIVE_INFINITY)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void canonicalize_rejectsUnsupportedTypes() {
    assertThatThrownBy(() -> canonicalizer.canonicalize(Map.of("x", new Object())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported");
  }

  @Test
  void entryDocument_coversEveryHeaderFieldIncludingLinkAndKeyVersion() {
    var at = Instant.parse("2026-03-01T10:15:30.000001Z");
    var document = document(at, 1, "alice", "a.b", "{}", List.of(), "00", "v1");

    assertThat(document).contains("\"prior_hash\":\"00\"").contains("\"key_version\":\"v1\"");
    assertThat(
            List.of(
                document(at, 2, "alice", "a.b", "{}", List.of(), "00", "v1"),
                document(at, 1, "bob", "a.b", "{}", List.of(), "00", "v1"),
                document(at, 1, "alice", "a.c", "{}", List.of(), "00", "v1"),
                document(at, 1, "alice", "a.b", "{\"k\":1}", List.of(), "00", "v1"),
                document(at, 1, "alice", "a.b", "{}", List.of("run-1"), "00", "v1"),
                document(at.plusNanos(1000), 1, "alice", "a.b", "{}", List.of(), "00", "v1"),
                document(at, 1, "alice", "a.b", "{}", List.of(), "ff", "v1"),
                document(at, 1, "alice", "a.b", "{}", List.of(), "00", "v2")))
        .doesNotContain(document)
        .doesNotHaveDuplicates();
  }

  @Test
  void entryDocument_ignoresStoredDigestAndSignature() {
    var at = Instant.parse("2026-03-01T10:15:30Z");
    var header = header(at, 1, "alice", "a.b", "{}", List.of(), "00", "v1");
    var stored =
        new LedgerRecord(
            UUID.randomUUID(),
            header.submissionId(),
            1,
            at,
            "alice",
            "a.b",
            "{}",
            List.of(),
            "digest",
            "00",
            "signature",
            "v1");

    assertThat(canonicalizer.entryDocument(stored)).isEqualTo(canonicalizer.entryDocument(header));
  }

  private static final UUID SUBMISSION = UUID.fromString("6f1c1f1e-8c55-4c58-9a8e-0a3b7d1c2e10");

  private static LedgerRecord header(
      Instant at,
      long sequence,
      String actor,
      String action,
      String payload,
      List<String> refs,
      String priorHash,
      String keyVersion) {
    return new LedgerRecord(
        null,
        SUBMISSION,
        sequence,
        at,
        actor,
        action,
        payload,
        refs,
        null,
        priorHash,
        null,
        keyVersion);
  }

  private String document(
      Instant at,
      long sequence,
      String actor,
      String action,
      String payload,
      List<String> refs,
      String priorHash,
      String keyVersion) {
    return canonicalizer.entryDocument(
        header(at, sequence, actor, action, payload, refs, priorHash, keyVersion));
  }
}
