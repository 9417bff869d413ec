package com.flamingo.ai.finqa.service.agents;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AgentRegistry Tests")
class AgentRegistryTest {

  @Test
  @DisplayName("Should route categories without a dedicated agent to the general agent")
  void shouldFallBackToGeneralAgent() {
    SpecializedAgent general = new StubAgent(TaskCategory.GENERAL);
    SpecializedAgent calculation = new StubAgent(TaskCategory.CALCULATION);

    AgentRegistry registry = new AgentRegistry(List.of(general, calculation));

    assertThat(registry.forCategory(TaskCategory.CALCULATION)).isSameAs(calculation);
    assertThat(registry.forCategory(TaskCategory.RISK_EXTRACTION)).isSameAs(general);
  }

  @Test
  @DisplayName("Should reject two agents for the same category")
  void shouldRejectDuplicateCategories() {
    List<SpecializedAgent> agents =
        List.of(new StubAgent(TaskCategory.GENERAL), new StubAgent(TaskCategory.GENERAL));

    assertThatThrownBy(() -> new AgentRegistry(agents))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Two agents registered for GENERAL");
  }

  @Test
  @DisplayName("Should require a general agent")
  void shouldRequireGeneralAgent() {
    assertThatThrownBy(() -> new AgentRegistry(List.of(new StubAgent(TaskCategory.CALCULATION))))
        .isInstanceOf(IllegalStateException.class);
  }

  private record StubAgent(TaskCategory category) implements SpecializedAgent {

    @Override
    public PartialAnswer answer(SubQuery subQuery) {
      throw new UnsupportedOperationException();
    }
  }
}
