package io.procura.backend.audit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Produces the canonical JSON text that audit digests are computed over. Two payloads that carry
 * the same facts must canonicalize to the same bytes regardless of map ordering or how a number
 * was typed by the caller.
 *
 * <p>Rules: map keys are sorted; integral numbers are written as integers; decimals have trailing
 * zeros stripped (so {@code 10000}, {@code 10000.0} and {@code 10000.00} are identical); UUIDs,
 * temporals and enums are written as strings; collection order is preserved. NaN, infinities and
 * types without a canonical form are rejected with {@link IllegalArgumentException}.
 */
@Component
public class AuditPayloadCanonicalizer {

  static final DateTimeFormatter OCCURRED_AT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private final JsonMapper jsonMapper = JsonMapper.builder().build();

  /** Canonical JSON of a caller payload. A null payload canonicalizes to {@code {}}. */
  public String canonicalize(Map<String, ?> payload) {
    return write(normalize(payload == null ? Map.of() : payload));
  }

  /**
   * Canonical JSON of the document an entry's digest covers: the canonical payload plus every
   * header field of the entry, including the prior hash and the signing key version. The id,
   * digest and signature are not part of it.
   */
  public String entryDocument(LedgerRecord entry) {
    var document = new LinkedHashMap<String, Object>();
    document.put("submission_id", entry.submissionId());
    document.put("sequence", entry.sequence());
    document.put("occurred_at", OCCURRED_AT_FORMAT.format(entry.occurredAt()));
    document.put("actor", entry.actor());
    document.put("action", entry.action());
    document.put("payload", entry.payload());
    document.put("evidence_refs", entry.evidenceRefs());
    document.put("prior_hash", entry.priorHash());
    document.put("key_version", entry.keyVersion());
    return write(normalize(document));
  }

  private String write(Object normalized) {
    try {
      return jsonMapper.writeValueAsString(normalized);
    } catch (JacksonException e) {
      throw new IllegalArgumentException("Audit payload cannot be serialized", e);
    }
  }

  private Object normalize(Object value) {
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof CharSequence chars) {
      return chars.toString();
    }
    if (value instanceof Map<?, ?> map) {
      var sorted = new TreeMap<String, Object>();
      for (var entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("Audit payload map keys must not be null");
        }
        sorted.put(entry.getKey().toString(), normalize(entry.getValue()));
      }
      return sorted;
    }
    if (value instanceof Collection<?> collection) {
      var items = new ArrayList<Object>(collection.size());
      for (var item : collection) {
        items.add(normalize(item));
      }
      return items;
    }
    if (value instanceof Object[] array) {
      return normalize(List.of(array));
    }
    if (value instanceof Number number) {
      return normalizeNumber(number);
    }
    if (value instanceof UUID || value instanceof Enum<?>) {
      return value.toString();
    }
    if (value instanceof Instant instant) {
      return OCCURRED_AT_FORMAT.format(instant);
    }
    if (value instanceof Temporal) {
      return value.toString();
    }
    throw new IllegalArgumentException(
        "Unsupported audit payload value type: " + value.getClass().getName());
  }

  private Object normalizeNumber(Number number) {
    if (number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte) {
      return number.longValue();
    }
    if (number instanceof BigInteger) {
      return number;
    }
    BigDecimal decimal;
    if (number instanceof BigDecimal bigDecimal) {
      decimal = bigDecimal;
    } else if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Audit payload numbers must be finite");
      }
      decimal = new BigDecimal(number.toString());
    } else {
      throw new IllegalArgumentException(
          "Unsupported audit payload number type: " + number.getClass().getName());
    }
    var stripped = decimal.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      return stripped.toBigIntegerExact();
    }
    return stripped;
  }
}
