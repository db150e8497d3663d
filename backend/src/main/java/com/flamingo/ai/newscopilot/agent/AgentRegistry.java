package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.exception.UnknownAnalysisKindException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Immutable kind-to-agent lookup built once from every {@link AnalysisAgent} bean. */
@Component
@Slf4j
public class AgentRegistry {

  private final Map<AnalysisKind, AnalysisAgent> agents;

  public AgentRegistry(List<AnalysisAgent> agents) {
    Map<AnalysisKind, AnalysisAgent> byKind = new EnumMap<>(AnalysisKind.class);
    for (AnalysisAgent agent : agents) {
      AnalysisAgent previous = byKind.put(agent.kind(), agent);
      if (previous != null) {
        throw new IllegalStateException(
            "Two agents registered for " + agent.kind().getId() + ": "
                + previous.getClass().getSimpleName() + ", " + agent.getClass().getSimpleName());
      }
    }
    this.agents = Collections.unmodifiableMap(byKind);
    log.info("Registered analysis agents: {}", this.agents.keySet());
  }

  /**
   * Returns the agent for {@code kind}.
   *
   * @throws UnknownAnalysisKindException if no agent handles the kind
   */
  public AnalysisAgent get(AnalysisKind kind) {
    AnalysisAgent agent = agents.get(kind);
    if (agent == null) {
      throw new UnknownAnalysisKindException(
          String.valueOf(kind), "No agent registered for analysis kind " + kind);
    }
    return agent;
  }

  public Set<AnalysisKind> registeredKinds() {
    return agents.keySet();
  }
}
