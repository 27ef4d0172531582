package com.electionlens.boothrecon.service.orchestration;

import com.electionlens.boothrecon.domain.ContestState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContestStateMachineTest {

    private ContestStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new ContestStateMachine("AC-42");
    }

    @Test
    void startsExtracted() {
        assertThat(machine.state()).isEqualTo(ContestState.EXTRACTED);
        assertThat(machine.isTerminal()).isFalse();
        assertThat(machine.history()).containsExactly(ContestState.EXTRACTED);
    }

    @Test
    void happyPathReachesReconciled() {
        machine.transition(ContestState.MAPPED);
        machine.transition(ContestState.VALIDATED);
        machine.transition(ContestState.RECONCILED);

        assertThat(machine.isTerminal()).isTrue();
        assertThat(machine.history()).containsExactly(
                ContestState.EXTRACTED, ContestState.MAPPED, ContestState.VALIDATED, ContestState.RECONCILED);
    }

    @Test
    void rejectedMappingReturnsToExtractedForRetry() {
        machine.transition(ContestState.MAPPED);
        machine.transition(ContestState.EXTRACTED);
        machine.transition(ContestState.MAPPED);

        assertThat(machine.state()).isEqualTo(ContestState.MAPPED);
    }

    @Test
    void exhaustedStrategiesFailFromExtracted() {
        for (int attempt = 0; attempt < 3; attempt++) {
            machine.transition(ContestState.MAPPED);
            machine.transition(ContestState.EXTRACTED);
        }
        machine.transition(ContestState.FAILED);

        assertThat(machine.history()).doesNotContain(ContestState.VALIDATED)
                .endsWith(ContestState.EXTRACTED, ContestState.FAILED);
    }

    @Test
    void cannotSkipValidation() {
        machine.transition(ContestState.MAPPED);

        assertThatThrownBy(() -> machine.transition(ContestState.RECONCILED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AC-42")
                .hasMessageContaining("illegal transition");
        assertThat(machine.state()).isEqualTo(ContestState.MAPPED);
    }

    @Test
    void terminalStatesHaveNoExits() {
        machine.transition(ContestState.FAILED);

        for (ContestState next : ContestState.values()) {
            assertThat(ContestStateMachine.isAllowed(ContestState.FAILED, next)).isFalse();
            assertThat(ContestStateMachine.isAllowed(ContestState.RECONCILED, next)).isFalse();
        }
        assertThatThrownBy(() -> machine.transition(ContestState.MAPPED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reconciliationFailureIsOnlyReachableAfterValidation() {
        assertThat(ContestStateMachine.isAllowed(ContestState.VALIDATED, ContestState.FAILED)).isTrue();
        assertThat(ContestStateMachine.isAllowed(ContestState.MAPPED, ContestState.FAILED)).isFalse();
    }
}
