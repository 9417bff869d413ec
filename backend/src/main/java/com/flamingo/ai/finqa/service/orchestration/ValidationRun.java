package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.domain.enums.ValidationState;
import java.util.ArrayList;
import java.util.List;

/** State machine of one question: GATHERING, then VALIDATING, then COMPOSED or DEGRADED. */
final class ValidationRun {

  private final List<ValidationState> history = new ArrayList<>();
  private ValidationState state;

  ValidationRun() {
    state = ValidationState.GATHERING;
    history.add(state);
  }

  ValidationState state() {
    return state;
  }

  List<ValidationState> history() {
    return List.copyOf(history);
  }

  void transitionTo(ValidationState next) {
    if (state.isTerminal()) {
      throw new IllegalStateException("Question already reached terminal state " + state);
    }
    boolean allowed =
        switch (state) {
          case GATHERING -> next == ValidationState.VALIDATING;
          case VALIDATING -> next.isTerminal();
          default -> false;
        };
    if (!allowed) {
      throw new IllegalStateException("Illegal transition " + state + " -> " + next);
    }
    state = next;
    history.add(next);
  }
}
