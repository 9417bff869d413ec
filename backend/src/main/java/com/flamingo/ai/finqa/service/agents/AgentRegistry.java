package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Looks up the agent for a task category; unknown categories go to the general agent. */
@Component
@Slf4j
public class AgentRegistry {

  private final Map<TaskCategory, SpecializedAgent> agents = new EnumMap<>(TaskCategory.class);

  public AgentRegistry(List<SpecializedAgent> agents) {
    for (SpecializedAgent agent : agents) {
      SpecializedAgent previous = this.agents.put(agent.category(), agent);
      if (previous != null) {
        throw new IllegalStateException(
            "Two agents registered for "
                + agent.category()
                + ": "
                + previous.getClass().getSimpleName()
                + " and "
                + agent.getClass().getSimpleName());
      }
    }
    if (!this.agents.containsKey(TaskCategory.GENERAL)) {
      throw new IllegalStateException("No agent registered for " + TaskCategory.GENERAL);
    }
    log.info("Registered agents for categories {}", this.agents.keySet());
  }

  public SpecializedAgent forCategory(TaskCategory category) {
    return agents.getOrDefault(category, agents.get(TaskCategory.GENERAL));
  }
}
