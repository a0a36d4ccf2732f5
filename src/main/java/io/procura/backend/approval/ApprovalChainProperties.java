package io.procura.backend.approval;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Approval chain template and approver directory, configured under {@code procura.approval}.
 * Role keys containing underscores must use bracket notation in YAML, e.g. {@code
 * "[contract_officer]"}.
 *
 * @param chain ordered step templates; defaults to legal, finance, executive
 * @param approvers role to ordered list of approver identities; the first is assigned, the next
 *     one in line receives escalations
 * @param escalationContact administrator notified when a role has nobody next in line
 */
@ConfigurationProperties(prefix = "procura.approval")
public record ApprovalChainProperties(
    List<StepTemplate> chain, Map<String, List<String>> approvers, String escalationContact) {

  static final List<StepTemplate> DEFAULT_CHAIN =
      List.of(
          new StepTemplate("legal", "contract_officer", Duration.ofHours(48), null),
          new StepTemplate("finance", "contract_officer", Duration.ofHours(48), null),
          new StepTemplate(
              "executive", "admin", Duration.ofHours(72), new BigDecimal("250000")));

  public ApprovalChainProperties {
    chain = chain == null || chain.isEmpty() ? DEFAULT_CHAIN : List.copyOf(chain);
    approvers = approvers == null ? Map.of() : Map.copyOf(approvers);
  }

  /**
   * One step of the template.
   *
   * @param name unique step name within a chain
   * @param role role required to decide the step
   * @param sla time allowed once the step becomes actionable
   * @param minValueUsd when set, the step is skipped for submissions below this value
   */
  public record StepTemplate(String name, String role, Duration sla, BigDecimal minValueUsd) {

    public StepTemplate {
      sla = sla == null ? Duration.ofHours(48) : sla;
    }

    /** Whether this step applies; unknown values keep conditional steps in the chain. */
    public boolean appliesTo(BigDecimal estimatedValue) {
      return minValueUsd == null
          || estimatedValue == null
          || estimatedValue.compareTo(minValueUsd) >= 0;
    }
  }
}
