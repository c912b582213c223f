package com.gravitychain.validator;

import com.gravitychain.account.Address;
import com.gravitychain.config.ValidatorConfigParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidatorSetCalculatorTest {

    private final ValidatorConfigParams params = ValidatorConfigParams.builder()
            .minimumBond(BigInteger.valueOf(10))
            .maximumBond(BigInteger.valueOf(100))
            .allowValidatorSetChange(true)
            .votingPowerIncreaseLimitPct(50)
            .maxValidatorSetSize(4)
            .build();

    private List<ValidatorRecord> records;
    private Map<Address, BigInteger> bonds;

    @BeforeEach
    void setUp() {
        records = new ArrayList<>();
        bonds = new HashMap<>();
    }

    @Test
    void testVotingPowerIsCappedAtMaximumBond() {
        Address a = add(ValidatorStatus.ACTIVE, 500);
        Address b = add(ValidatorStatus.ACTIVE, 40);

        NextValidatorSet next = calculate(BigInteger.valueOf(140));

        assertEquals(List.of(a, b), next.getActiveValidators());
        assertEquals(BigInteger.valueOf(100), next.getVotingPowers().get(a));
        assertEquals(BigInteger.valueOf(140), next.getTotalVotingPower());
    }

    @Test
    void testPendingInactiveLeavesAndInactiveIsUntouched() {
        Address a = add(ValidatorStatus.ACTIVE, 50);
        Address b = add(ValidatorStatus.PENDING_INACTIVE, 50);
        add(ValidatorStatus.INACTIVE, 50);

        NextValidatorSet next = calculate(BigInteger.valueOf(100));

        assertEquals(List.of(a), next.getActiveValidators());
        assertEquals(Set.of(b), next.getDeactivated());
    }

    @Test
    void testAdmissionStopsAtVotingPowerLimitButSmallerJoinersStillFit() {
        add(ValidatorStatus.ACTIVE, 100);
        Address big = add(ValidatorStatus.PENDING_ACTIVE, 60);
        Address small = add(ValidatorStatus.PENDING_ACTIVE, 30);

        // limit is 50% of 100
        NextValidatorSet next = calculate(BigInteger.valueOf(100));

        assertEquals(Set.of(small), next.getActivated());
        assertEquals(Set.of(big), next.getDeferred());
        assertEquals(BigInteger.valueOf(130), next.getTotalVotingPower());
    }

    @Test
    void testNoLimitWhenPriorTotalIsZero() {
        Address a = add(ValidatorStatus.PENDING_ACTIVE, 100);
        Address b = add(ValidatorStatus.PENDING_ACTIVE, 100);

        NextValidatorSet next = calculate(BigInteger.ZERO);

        assertEquals(List.of(a, b), next.getActiveValidators());
    }

    @Test
    void testMaxSetSizeDefersJoiners() {
        add(ValidatorStatus.ACTIVE, 100);
        add(ValidatorStatus.ACTIVE, 100);
        add(ValidatorStatus.ACTIVE, 100);
        Address fourth = add(ValidatorStatus.PENDING_ACTIVE, 10);
        Address fifth = add(ValidatorStatus.PENDING_ACTIVE, 10);

        NextValidatorSet next = calculate(BigInteger.valueOf(300));

        assertEquals(4, next.size());
        assertEquals(Set.of(fourth), next.getActivated());
        assertEquals(Set.of(fifth), next.getDeferred());
    }

    @Test
    void testUnderBondedActiveValidatorLeaves() {
        Address healthy = add(ValidatorStatus.ACTIVE, 50);
        Address drained = add(ValidatorStatus.ACTIVE, 5);

        NextValidatorSet next = calculate(BigInteger.valueOf(100));

        assertEquals(List.of(healthy), next.getActiveValidators());
        assertTrue(next.getDeactivated().contains(drained));
    }

    @Test
    void testUnderBondedValidatorsStayWhenSetWouldBeEmpty() {
        Address drained = add(ValidatorStatus.ACTIVE, 5);

        NextValidatorSet next = calculate(BigInteger.valueOf(50));

        assertEquals(List.of(drained), next.getActiveValidators());
        assertTrue(next.getDeactivated().isEmpty());
    }

    @Test
    void testIndicesFollowRegistrationOrder() {
        Address first = add(ValidatorStatus.PENDING_ACTIVE, 20);
        Address second = add(ValidatorStatus.ACTIVE, 100);
        Address third = add(ValidatorStatus.PENDING_INACTIVE, 100);
        Address fourth = add(ValidatorStatus.ACTIVE, 100);

        NextValidatorSet next = calculate(BigInteger.valueOf(300));

        assertEquals(List.of(first, second, fourth), next.getActiveValidators());
        assertTrue(next.getDeactivated().contains(third));
    }

    private NextValidatorSet calculate(BigInteger currentTotal) {
        return ValidatorSetCalculator.calculate(records, bonds::get, params, currentTotal);
    }

    private Address add(ValidatorStatus status, long bond) {
        Address address = Address.fromHex(String.format("0xc%04x", records.size()));
        ValidatorRecord record = new ValidatorRecord(address, address, records.size());
        record.setStatus(status);
        records.add(record);
        bonds.put(address, BigInteger.valueOf(bond));
        return address;
    }
}
