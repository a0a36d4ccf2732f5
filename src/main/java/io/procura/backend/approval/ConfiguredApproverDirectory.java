package io.procura.backend.approval;

import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** {@link ApproverDirectory} backed by {@code procura.approval.approvers}. */
@Component
public class ConfiguredApproverDirectory implements ApproverDirectory {

  private final ApprovalChainProperties properties;

  public ConfiguredApproverDirectory(ApprovalChainProperties properties) {
    this.properties = properties;
  }

  @Override
  public List<String> approversFor(String role) {
    return properties.approvers().getOrDefault(role, List.of());
  }

  @Override
  public Optional<String> escalationContact() {
    return Optional.ofNullable(properties.escalationContact()).filter(s -> !s.isBlank());
  }
}
