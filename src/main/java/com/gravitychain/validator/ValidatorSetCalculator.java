package com.gravitychain.validator;

import com.gravitychain.account.Address;
import com.gravitychain.config.ValidatorConfigParams;
import com.gravitychain.utils.BigIntegerUtils;
import lombok.experimental.UtilityClass;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes the validator set of the next epoch from the registry contents without mutating anything.
 * <p>
 * The steps, in order:
 * <ol>
 *     <li>PENDING_INACTIVE validators leave.</li>
 *     <li>ACTIVE validators whose bond fell below the minimum leave, unless that would empty the set.</li>
 *     <li>PENDING_ACTIVE validators are admitted in registration order while the voting power they add stays
 *     within {@code votingPowerIncreaseLimitPct} of the current total and the set stays within
 *     {@code maxValidatorSetSize}. A validator that does not fit is skipped and stays pending; later, smaller
 *     ones may still be admitted.</li>
 *     <li>The resulting members are ordered by registration and indexed {@code 0..n-1}; voting power is
 *     {@code min(bond, maximumBond)}.</li>
 * </ol>
 */
@UtilityClass
public class ValidatorSetCalculator {

    /**
     * @param validators            every registered validator, in registration order
     * @param bondOf                current bonded amount of a validator's stake pool
     * @param params                validator config in effect for the boundary
     * @param currentTotalVotingPower total voting power of the epoch that is ending
     */
    public NextValidatorSet calculate(Collection<ValidatorRecord> validators,
                                      Function<Address, BigInteger> bondOf,
                                      ValidatorConfigParams params,
                                      BigInteger currentTotalVotingPower) {
        Map<Address, BigInteger> bonds = new LinkedHashMap<>();
        for (ValidatorRecord record : validators) {
            if (record.getStatus() != ValidatorStatus.INACTIVE) {
                bonds.put(record.getValidator(), bondOf.apply(record.getValidator()));
            }
        }

        Set<Address> staying = new LinkedHashSet<>();
        Set<Address> underBonded = new LinkedHashSet<>();
        Set<Address> deactivated = new LinkedHashSet<>();
        for (ValidatorRecord record : validators) {
            Address validator = record.getValidator();
            switch (record.getStatus()) {
                case ACTIVE -> {
                    if (bonds.get(validator).compareTo(params.getMinimumBond()) < 0) {
                        underBonded.add(validator);
                    } else {
                        staying.add(validator);
                    }
                }
                case PENDING_INACTIVE -> deactivated.add(validator);
                default -> {
                    // INACTIVE records are untouched, PENDING_ACTIVE ones are handled below
                }
            }
        }

        if (staying.isEmpty()) {
            staying.addAll(underBonded);
        } else {
            deactivated.addAll(underBonded);
        }

        Set<Address> activated = new LinkedHashSet<>();
        Set<Address> deferred = new LinkedHashSet<>();
        BigInteger limit = currentTotalVotingPower.signum() == 0
                ? null
                : BigIntegerUtils.percentOf(currentTotalVotingPower, params.getVotingPowerIncreaseLimitPct());
        BigInteger added = BigInteger.ZERO;
        long size = staying.size();

        for (ValidatorRecord record : validators) {
            if (record.getStatus() != ValidatorStatus.PENDING_ACTIVE) {
                continue;
            }

            Address validator = record.getValidator();
            BigInteger bond = bonds.get(validator);
            BigInteger power = bond.min(params.getMaximumBond());
            boolean fitsBond = bond.compareTo(params.getMinimumBond()) >= 0;
            boolean fitsSize = size < params.getMaxValidatorSetSize();
            boolean fitsLimit = limit == null || added.add(power).compareTo(limit) <= 0;

            if (fitsBond && fitsSize && fitsLimit) {
                activated.add(validator);
                added = added.add(power);
                size++;
            } else {
                deferred.add(validator);
            }
        }

        List<Address> activeValidators = new ArrayList<>();
        Map<Address, BigInteger> votingPowers = new LinkedHashMap<>();
        BigInteger total = BigInteger.ZERO;
        for (ValidatorRecord record : validators) {
            Address validator = record.getValidator();
            if (staying.contains(validator) || activated.contains(validator)) {
                BigInteger power = bonds.get(validator).min(params.getMaximumBond());
                activeValidators.add(validator);
                votingPowers.put(validator, power);
                total = total.add(power);
            }
        }

        return new NextValidatorSet(
                Collections.unmodifiableList(activeValidators),
                Collections.unmodifiableMap(votingPowers),
                total,
                Collections.unmodifiableSet(activated),
                Collections.unmodifiableSet(deactivated),
                Collections.unmodifiableSet(deferred));
    }
}
