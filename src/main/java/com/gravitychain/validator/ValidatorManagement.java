package com.gravitychain.validator;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.config.ValidatorConfig;
import com.gravitychain.config.ValidatorConfigParams;
import com.gravitychain.event.ChainEventPublisher;
import com.gravitychain.event.PerformanceSnapshotMismatchEvent;
import com.gravitychain.event.ValidatorRegisteredEvent;
import com.gravitychain.event.ValidatorStatusChangedEvent;
import com.gravitychain.exception.reconfiguration.ReconfigurationInProgressException;
import com.gravitychain.exception.validator.ExcessiveBondException;
import com.gravitychain.exception.validator.InsufficientBondException;
import com.gravitychain.exception.validator.InvalidConsensusKeyException;
import com.gravitychain.exception.validator.InvalidMonikerException;
import com.gravitychain.exception.validator.InvalidValidatorStatusException;
import com.gravitychain.exception.validator.LastValidatorException;
import com.gravitychain.exception.validator.StakePoolNotFoundException;
import com.gravitychain.exception.validator.ValidatorAlreadyRegisteredException;
import com.gravitychain.exception.validator.ValidatorNotFoundException;
import com.gravitychain.exception.validator.ValidatorSetChangeDisabledException;
import com.gravitychain.exception.validator.ValidatorSetFullException;
import com.gravitychain.performance.ProposerPerformance;
import com.gravitychain.reconfiguration.state.ReconfigurationState;
import com.gravitychain.stake.StakePoolRegistry;
import com.gravitychain.state.AbstractState;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import com.gravitychain.validator.dto.ValidatorRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.apache.commons.collections4.map.ListOrderedMap;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

/**
 * Owns validator identity and set membership.
 * <p>
 * Operator requests only move validators between statuses; the active set itself, with its contiguous
 * indices and capped voting power, is rebuilt from scratch in {@link #onNewEpoch(Address)}.
 */
@Log
@Component
@RequiredArgsConstructor
public class ValidatorManagement extends AbstractState implements ValidatorRegistry {

    public static final int MAX_MONIKER_LENGTH = 31;
    // BLS12-381 G1 public key and G2 proof of possession
    public static final int CONSENSUS_KEY_LENGTH = 48;
    public static final int PROOF_OF_POSSESSION_LENGTH = 96;

    private final AccessControl accessControl;
    private final StakePoolRegistry stakePools;
    private final ValidatorConfig validatorConfig;
    private final ReconfigurationState reconfigurationState;
    private final ChainEventPublisher eventPublisher;

    // Registration order is the iteration order
    private final ListOrderedMap<Address, ValidatorRecord> validators = new ListOrderedMap<>();
    private final Set<Address> pendingActive = new LinkedHashSet<>();
    private final Set<Address> pendingInactive = new LinkedHashSet<>();

    private List<ValidatorConsensusInfo> activeSet = List.of();
    private BigInteger totalVotingPower = BigInteger.ZERO;

    /**
     * Registers and immediately activates the genesis validators. Consensus keys are taken as given.
     */
    public void initializeGenesisValidators(Address caller, List<ValidatorRegistration> registrations) {
        accessControl.requireCaller(caller, SystemRole.GENESIS);
        if (registrations.isEmpty()) {
            throw new IllegalArgumentException("Genesis requires at least one validator");
        }

        ValidatorConfigParams params = validatorConfig.getCurrent();
        if (registrations.size() > params.getMaxValidatorSetSize()) {
            throw new ValidatorSetFullException(params.getMaxValidatorSetSize());
        }
        Set<Address> seen = new HashSet<>();
        for (ValidatorRegistration registration : registrations) {
            if (!seen.add(registration.getPool())) {
                throw new ValidatorAlreadyRegisteredException(registration.getPool());
            }
            validateRegistration(registration, params, false);
        }

        markInitialized();
        for (ValidatorRegistration registration : registrations) {
            ValidatorRecord record = createRecord(registration);
            record.setStatus(ValidatorStatus.ACTIVE);
        }
        rebuildActiveSet(ValidatorSetCalculator.calculate(
                validators.values(), stakePools::getBondedAmount, params, BigInteger.ZERO));

        log.log(Level.INFO, String.format("Genesis validator set: %d validators, total voting power %s",
                activeSet.size(), totalVotingPower));
    }

    public void register(Address caller, ValidatorRegistration registration) {
        Address pool = registration.getPool();
        if (!stakePools.exists(pool)) {
            throw new StakePoolNotFoundException(pool);
        }
        accessControl.requireCaller(caller, stakePools.getOperator(pool));
        validateRegistration(registration, validatorConfig.getCurrent(), true);

        ValidatorRecord record = createRecord(registration);
        log.log(Level.INFO, String.format("Registered validator %s (%s)", pool, record.getMoniker()));
        eventPublisher.publish(new ValidatorRegisteredEvent(this, pool, caller, record.getMoniker()));
    }

    public void joinValidatorSet(Address caller, Address validator) {
        ValidatorRecord record = getOperatedRecord(caller, validator);
        ValidatorConfigParams params = validatorConfig.getCurrent();
        requireSetChangeAllowed(params);
        requireNoTransitionInProgress();
        requireStatus(record, ValidatorStatus.INACTIVE);
        requireBondWithinBounds(stakePools.getBondedAmount(validator), params);
        if (countWithStatus(ValidatorStatus.ACTIVE) + pendingActive.size() >= params.getMaxValidatorSetSize()) {
            throw new ValidatorSetFullException(params.getMaxValidatorSetSize());
        }

        pendingActive.add(validator);
        changeStatus(record, ValidatorStatus.PENDING_ACTIVE);
    }

    /**
     * Cancels a pending join, or schedules an active validator's departure for the next epoch boundary.
     */
    public void leaveValidatorSet(Address caller, Address validator) {
        ValidatorRecord record = getOperatedRecord(caller, validator);
        requireSetChangeAllowed(validatorConfig.getCurrent());
        requireNoTransitionInProgress();

        switch (record.getStatus()) {
            case PENDING_ACTIVE -> {
                pendingActive.remove(validator);
                changeStatus(record, ValidatorStatus.INACTIVE);
            }
            case ACTIVE -> markPendingInactive(record);
            default -> throw new InvalidValidatorStatusException(validator, record.getStatus(),
                    EnumSet.of(ValidatorStatus.PENDING_ACTIVE, ValidatorStatus.ACTIVE));
        }
    }

    /**
     * Emergency removal by governance. Works while a transition is in flight.
     */
    public void forceLeaveValidatorSet(Address caller, Address validator) {
        accessControl.requireCaller(caller, SystemRole.GOVERNANCE);
        ValidatorRecord record = getRecord(validator);
        requireStatus(record, ValidatorStatus.ACTIVE);

        markPendingInactive(record);
        log.log(Level.WARNING, String.format("Governance forced validator %s out of the set", validator));
    }

    public void rotateConsensusKey(Address caller, Address validator, byte[] consensusPublicKey,
                                   byte[] proofOfPossession) {
        ValidatorRecord record = getOperatedRecord(caller, validator);
        requireNoTransitionInProgress();
        validateConsensusKey(validator, consensusPublicKey, proofOfPossession);

        record.setConsensusPublicKey(Arrays.copyOf(consensusPublicKey, consensusPublicKey.length));
        record.setProofOfPossession(Arrays.copyOf(proofOfPossession, proofOfPossession.length));
        log.log(Level.INFO, String.format("Rotated consensus key of validator %s", validator));
    }

    /**
     * Stages a new fee recipient; it takes effect at the next epoch boundary.
     */
    public void setFeeRecipient(Address caller, Address validator, Address feeRecipient) {
        ValidatorRecord record = getOperatedRecord(caller, validator);
        requireNoTransitionInProgress();

        record.setPendingFeeRecipient(feeRecipient);
        log.fine(String.format("Staged fee recipient %s for validator %s", feeRecipient, validator));
    }

    @Override
    public void onNewEpoch(Address caller) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        requireInitialized();

        for (ValidatorRecord record : validators.values()) {
            if (record.getPendingFeeRecipient() != null) {
                record.setFeeRecipient(record.getPendingFeeRecipient());
                record.setPendingFeeRecipient(null);
            }
        }

        NextValidatorSet next = computeNextValidatorSet();

        for (Address validator : next.getDeactivated()) {
            ValidatorRecord record = validators.get(validator);
            pendingInactive.remove(validator);
            changeStatus(record, ValidatorStatus.INACTIVE);
        }
        for (Address validator : next.getActivated()) {
            ValidatorRecord record = validators.get(validator);
            pendingActive.remove(validator);
            changeStatus(record, ValidatorStatus.ACTIVE);
        }
        rebuildActiveSet(next);

        log.log(Level.INFO, String.format(
                "Validator set recomputed: %d active (%d joined, %d left, %d deferred), total voting power %s",
                activeSet.size(), next.getActivated().size(), next.getDeactivated().size(),
                next.getDeferred().size(), totalVotingPower));
    }

    @Override
    public List<Address> evictUnderperformingValidators(Address caller, List<ProposerPerformance> snapshot) {
        accessControl.requireCaller(caller, SystemRole.GOVERNANCE, SystemRole.RECONFIGURATION);

        if (snapshot.size() != activeSet.size()) {
            log.log(Level.WARNING, String.format(
                    "Skipping eviction: performance snapshot has %d entries, active set has %d",
                    snapshot.size(), activeSet.size()));
            eventPublisher.publish(new PerformanceSnapshotMismatchEvent(this, snapshot.size(), activeSet.size()));
            return List.of();
        }

        long threshold = validatorConfig.getCurrent().getAutoEvictThreshold();
        List<Address> evicted = new ArrayList<>();
        for (int i = 0; i < activeSet.size(); i++) {
            ProposerPerformance performance = snapshot.get(i);
            ValidatorRecord record = validators.get(activeSet.get(i).getValidator());
            boolean underperforming = performance.getTotalProposals() > 0
                    && performance.getSuccessfulProposals() < threshold;

            if (!underperforming || record.getStatus() != ValidatorStatus.ACTIVE) {
                continue;
            }
            if (countWithStatus(ValidatorStatus.ACTIVE) <= 1) {
                log.log(Level.WARNING, String.format("Not evicting %s, it is the last active validator",
                        record.getValidator()));
                break;
            }

            pendingInactive.add(record.getValidator());
            changeStatus(record, ValidatorStatus.PENDING_INACTIVE);
            evicted.add(record.getValidator());
        }

        if (!evicted.isEmpty()) {
            log.log(Level.INFO, String.format("Evicting underperforming validators: %s", evicted));
        }
        return evicted;
    }

    @Override
    public List<ValidatorConsensusInfo> getCurrentConsensusInfos() {
        return activeSet;
    }

    @Override
    public List<ValidatorConsensusInfo> getNextConsensusInfos() {
        NextValidatorSet next = computeNextValidatorSet();
        List<ValidatorConsensusInfo> infos = new ArrayList<>(next.size());
        for (int i = 0; i < next.size(); i++) {
            Address validator = next.getActiveValidators().get(i);
            infos.add(toConsensusInfo(validators.get(validator), next.getVotingPowers().get(validator), i));
        }
        return Collections.unmodifiableList(infos);
    }

    @Override
    public Optional<ValidatorConsensusInfo> getActiveValidatorAt(int index) {
        if (index < 0 || index >= activeSet.size()) {
            return Optional.empty();
        }
        return Optional.of(activeSet.get(index));
    }

    @Override
    public int getActiveCount() {
        return activeSet.size();
    }

    @Override
    public BigInteger getTotalVotingPower() {
        return totalVotingPower;
    }

    @Override
    public Optional<ValidatorStatus> getStatusOf(Address validator) {
        return Optional.ofNullable(validators.get(validator)).map(ValidatorRecord::getStatus);
    }

    public Optional<ValidatorRecord> getValidator(Address validator) {
        return Optional.ofNullable(validators.get(validator));
    }

    public List<ValidatorRecord> getValidators() {
        return List.copyOf(validators.values());
    }

    public Set<Address> getPendingActive() {
        return Collections.unmodifiableSet(pendingActive);
    }

    public Set<Address> getPendingInactive() {
        return Collections.unmodifiableSet(pendingInactive);
    }

    private NextValidatorSet computeNextValidatorSet() {
        return ValidatorSetCalculator.calculate(validators.values(), stakePools::getBondedAmount,
                validatorConfig.getCurrent(), totalVotingPower);
    }

    private void rebuildActiveSet(NextValidatorSet next) {
        for (ValidatorRecord record : validators.values()) {
            record.setValidatorIndex(null);
            record.setVotingPower(BigInteger.ZERO);
        }

        List<ValidatorConsensusInfo> infos = new ArrayList<>(next.size());
        for (int i = 0; i < next.size(); i++) {
            ValidatorRecord record = validators.get(next.getActiveValidators().get(i));
            BigInteger votingPower = next.getVotingPowers().get(record.getValidator());
            record.setValidatorIndex(i);
            record.setVotingPower(votingPower);
            infos.add(toConsensusInfo(record, votingPower, i));
        }

        activeSet = Collections.unmodifiableList(infos);
        totalVotingPower = next.getTotalVotingPower();
    }

    private ValidatorRecord createRecord(ValidatorRegistration registration) {
        ValidatorRecord record = new ValidatorRecord(
                registration.getPool(), stakePools.getOwner(registration.getPool()), validators.size());
        record.setMoniker(registration.getMoniker());
        record.setConsensusPublicKey(copy(registration.getConsensusPublicKey()));
        record.setProofOfPossession(copy(registration.getProofOfPossession()));
        record.setNetworkAddresses(copy(registration.getNetworkAddresses()));
        record.setFullnodeAddresses(copy(registration.getFullnodeAddresses()));
        record.setFeeRecipient(registration.getFeeRecipient() != null
                ? registration.getFeeRecipient()
                : registration.getPool());
        validators.put(record.getValidator(), record);
        return record;
    }

    private void validateRegistration(ValidatorRegistration registration,
                                      ValidatorConfigParams params,
                                      boolean checkConsensusKey) {
        Address pool = registration.getPool();
        if (!stakePools.exists(pool)) {
            throw new StakePoolNotFoundException(pool);
        }
        if (validators.containsKey(pool)) {
            throw new ValidatorAlreadyRegisteredException(pool);
        }
        requireBondWithinBounds(stakePools.getBondedAmount(pool), params);

        String moniker = registration.getMoniker();
        if (StringUtils.isBlank(moniker)) {
            throw new InvalidMonikerException("Moniker must not be blank");
        }
        if (moniker.getBytes(StandardCharsets.UTF_8).length > MAX_MONIKER_LENGTH) {
            throw new InvalidMonikerException(String.format(
                    "Moniker '%s' is longer than %d bytes", moniker, MAX_MONIKER_LENGTH));
        }

        if (checkConsensusKey) {
            validateConsensusKey(pool, registration.getConsensusPublicKey(), registration.getProofOfPossession());
        }
    }

    private void validateConsensusKey(Address owner, byte[] consensusPublicKey, byte[] proofOfPossession) {
        if (consensusPublicKey == null || consensusPublicKey.length != CONSENSUS_KEY_LENGTH) {
            throw new InvalidConsensusKeyException(
                    "Consensus public key must be " + CONSENSUS_KEY_LENGTH + " bytes");
        }
        if (proofOfPossession == null || proofOfPossession.length != PROOF_OF_POSSESSION_LENGTH) {
            throw new InvalidConsensusKeyException(
                    "Proof of possession must be " + PROOF_OF_POSSESSION_LENGTH + " bytes");
        }
        for (ValidatorRecord record : validators.values()) {
            if (!record.getValidator().equals(owner)
                    && Arrays.equals(record.getConsensusPublicKey(), consensusPublicKey)) {
                throw new InvalidConsensusKeyException(
                        "Consensus public key is already used by validator " + record.getValidator());
            }
        }
    }

    private void requireBondWithinBounds(BigInteger bond, ValidatorConfigParams params) {
        if (bond.compareTo(params.getMinimumBond()) < 0) {
            throw new InsufficientBondException(bond, params.getMinimumBond());
        }
        if (bond.compareTo(params.getMaximumBond()) > 0) {
            throw new ExcessiveBondException(bond, params.getMaximumBond());
        }
    }

    private void requireSetChangeAllowed(ValidatorConfigParams params) {
        if (!params.isAllowValidatorSetChange()) {
            throw new ValidatorSetChangeDisabledException();
        }
    }

    private void requireNoTransitionInProgress() {
        if (reconfigurationState.isTransitionInProgress()) {
            throw new ReconfigurationInProgressException(
                    "Validator changes are refused while an epoch transition is in progress");
        }
    }

    private void requireStatus(ValidatorRecord record, ValidatorStatus expected) {
        if (record.getStatus() != expected) {
            throw new InvalidValidatorStatusException(record.getValidator(), record.getStatus(), EnumSet.of(expected));
        }
    }

    private void markPendingInactive(ValidatorRecord record) {
        if (countWithStatus(ValidatorStatus.ACTIVE) <= 1) {
            throw new LastValidatorException(record.getValidator());
        }
        pendingInactive.add(record.getValidator());
        changeStatus(record, ValidatorStatus.PENDING_INACTIVE);
    }

    private ValidatorRecord getOperatedRecord(Address caller, Address validator) {
        ValidatorRecord record = getRecord(validator);
        accessControl.requireCaller(caller, stakePools.getOperator(validator));
        return record;
    }

    private ValidatorRecord getRecord(Address validator) {
        ValidatorRecord record = validators.get(validator);
        if (record == null) {
            throw new ValidatorNotFoundException(validator);
        }
        return record;
    }

    private long countWithStatus(ValidatorStatus status) {
        return validators.values().stream()
                .filter(record -> record.getStatus() == status)
                .count();
    }

    private void changeStatus(ValidatorRecord record, ValidatorStatus newStatus) {
        ValidatorStatus previous = record.getStatus();
        record.setStatus(newStatus);
        log.log(Level.INFO, String.format("Validator %s: %s -> %s", record.getValidator(), previous, newStatus));
        eventPublisher.publish(new ValidatorStatusChangedEvent(this, record.getValidator(), previous, newStatus));
    }

    private static ValidatorConsensusInfo toConsensusInfo(ValidatorRecord record, BigInteger votingPower, int index) {
        return new ValidatorConsensusInfo(
                record.getValidator(),
                copy(record.getConsensusPublicKey()),
                copy(record.getProofOfPossession()),
                votingPower,
                index,
                copy(record.getNetworkAddresses()),
                copy(record.getFullnodeAddresses()));
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
    }
}
