package io.procura.backend.approval;

import java.util.List;
import java.util.Optional;

/** Maps approver roles to the people who hold them. */
public interface ApproverDirectory {

  /** Approvers for a role in assignment order; empty when nobody holds the role. */
  List<String> approversFor(String role);

  /** Administrator to escalate to when a role has nobody next in line. */
  Optional<String> escalationContact();
}
