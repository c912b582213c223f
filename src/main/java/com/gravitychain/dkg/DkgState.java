package com.gravitychain.dkg;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.event.ChainEventPublisher;
import com.gravitychain.event.DkgStartEvent;
import com.gravitychain.exception.dkg.DkgSessionException;
import com.gravitychain.timestamp.Clock;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.apache.commons.lang3.ArrayUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;

@Log
@Component
@RequiredArgsConstructor
public class DkgState implements DkgCoordinator {

    private final AccessControl accessControl;
    private final Clock clock;
    private final ChainEventPublisher eventPublisher;

    private DkgSession incompleteSession;
    private DkgSession lastCompletedSession;

    @Override
    public void start(Address caller,
                      long dealerEpoch,
                      RandomnessConfigData randomnessConfig,
                      List<ValidatorConsensusInfo> dealers,
                      List<ValidatorConsensusInfo> targets) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        if (incompleteSession != null) {
            throw new DkgSessionException(String.format(
                    "DKG session for epoch %d is still in progress", incompleteSession.getDealerEpoch()));
        }

        var metadata = new DkgSessionMetadata(dealerEpoch, randomnessConfig, dealers, targets);
        long startTime = clock.nowMicros();
        incompleteSession = new DkgSession(metadata, startTime);

        log.log(Level.INFO, String.format("Started DKG session for epoch %d with %d dealers and %d targets",
                dealerEpoch, dealers.size(), targets.size()));
        eventPublisher.publish(new DkgStartEvent(this, metadata, startTime));
    }

    @Override
    public void finish(Address caller, byte[] transcript) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        if (incompleteSession == null) {
            throw new DkgSessionException("No DKG session in progress");
        }
        if (ArrayUtils.isEmpty(transcript)) {
            throw new DkgSessionException("DKG transcript must not be empty");
        }

        incompleteSession.complete(transcript);
        lastCompletedSession = incompleteSession;
        incompleteSession = null;

        log.log(Level.INFO, String.format("Finished DKG session for epoch %d", lastCompletedSession.getDealerEpoch()));
    }

    @Override
    public boolean discardStale(Address caller) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        if (incompleteSession == null) {
            return false;
        }

        log.log(Level.INFO, String.format("Discarding incomplete DKG session from epoch %d",
                incompleteSession.getDealerEpoch()));
        incompleteSession = null;
        return true;
    }

    @Override
    public Optional<DkgSession> getIncompleteSession() {
        return Optional.ofNullable(incompleteSession);
    }

    @Override
    public Optional<DkgSession> getLastCompletedSession() {
        return Optional.ofNullable(lastCompletedSession);
    }
}
