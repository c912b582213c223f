package com.gravitychain.reconfiguration.state;

import com.gravitychain.reconfiguration.TransitionState;
import com.gravitychain.state.AbstractState;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Epoch metadata. Written only by {@link com.gravitychain.reconfiguration.Reconfiguration}; other
 * components read it, e.g. to refuse validator set changes while a transition is in flight.
 */
@Getter
@Component
public class ReconfigurationState extends AbstractState {

    private long currentEpoch;
    private long lastReconfigurationTime;
    private TransitionState transitionState = TransitionState.IDLE;
    private long transitionStartedAtEpoch;

    public boolean isTransitionInProgress() {
        return transitionState == TransitionState.DKG_IN_PROGRESS;
    }

    public void initialize(long genesisTimeMicros) {
        markInitialized();
        currentEpoch = 0;
        lastReconfigurationTime = genesisTimeMicros;
        transitionState = TransitionState.IDLE;
    }

    public void startDkg() {
        transitionState = TransitionState.DKG_IN_PROGRESS;
        transitionStartedAtEpoch = currentEpoch;
    }

    public void completeEpoch(long reconfigurationTimeMicros) {
        currentEpoch++;
        lastReconfigurationTime = reconfigurationTimeMicros;
        transitionState = TransitionState.IDLE;
    }

    public void ensureInitialized() {
        requireInitialized();
    }
}
