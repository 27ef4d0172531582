package com.electionlens.boothrecon.service.orchestration;

import com.electionlens.boothrecon.domain.ContestState;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lifecycle of a single contest run.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * EXTRACTED → MAPPED      (a strategy produced a mapping)
 * MAPPED    → VALIDATED   (the mapped records passed validation)
 * MAPPED    → EXTRACTED   (validation failed; try the next strategy)
 * VALIDATED → RECONCILED  (booth sums agree with official totals)
 * VALIDATED → FAILED      (reconciliation impossible)
 * EXTRACTED → FAILED      (no booth rows, or every strategy rejected)
 * </pre>
 *
 * <p>Exhausting the strategies fails from EXTRACTED, not VALIDATED: a rejected mapping has
 * already returned to EXTRACTED, and VALIDATED is only entered by records that passed. A
 * FAILED contest reached from VALIDATED therefore always means reconciliation failed.
 *
 * <p>Not thread-safe: one instance belongs to one contest run on one thread.
 */
public final class ContestStateMachine {

    private static final Map<ContestState, Set<ContestState>> TRANSITIONS = new EnumMap<>(ContestState.class);

    static {
        TRANSITIONS.put(ContestState.EXTRACTED, EnumSet.of(ContestState.MAPPED, ContestState.FAILED));
        TRANSITIONS.put(ContestState.MAPPED, EnumSet.of(ContestState.VALIDATED, ContestState.EXTRACTED));
        TRANSITIONS.put(ContestState.VALIDATED, EnumSet.of(ContestState.RECONCILED, ContestState.FAILED));
        TRANSITIONS.put(ContestState.RECONCILED, EnumSet.noneOf(ContestState.class));
        TRANSITIONS.put(ContestState.FAILED, EnumSet.noneOf(ContestState.class));
    }

    private final String contestId;
    private final List<ContestState> history = new ArrayList<>();
    private ContestState state = ContestState.EXTRACTED;

    public ContestStateMachine(String contestId) {
        this.contestId = Objects.requireNonNull(contestId, "contestId");
        history.add(state);
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transition(ContestState next) {
        Objects.requireNonNull(next, "next");
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Contest " + contestId + ": illegal transition " + state + " → " + next);
        }
        state = next;
        history.add(next);
    }

    public static boolean isAllowed(ContestState from, ContestState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    public ContestState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Every state visited so far, starting with EXTRACTED.
     */
    public List<ContestState> history() {
        return List.copyOf(history);
    }
}
