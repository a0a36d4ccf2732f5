package io.procura.backend.autonomy;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/** {@link AutonomyPolicySource} backed by {@code procura.autonomy.*} configuration. */
@Component
@EnableConfigurationProperties(AutonomyProperties.class)
public class PropertiesAutonomyPolicySource implements AutonomyPolicySource {

  private final AutonomyPolicy policy;

  public PropertiesAutonomyPolicySource(AutonomyProperties properties) {
    this.policy = properties.toPolicy();
  }

  @Override
  public AutonomyPolicy currentPolicy() {
    return policy;
  }
}
