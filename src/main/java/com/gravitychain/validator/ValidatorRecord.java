package com.gravitychain.validator;

import com.gravitychain.account.Address;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;

/**
 * A registered validator. Records are never removed; {@link ValidatorStatus#INACTIVE} is the resting state.
 * The index and voting power reflect the last epoch boundary and are only meaningful while ACTIVE.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString(onlyExplicitlyIncluded = true)
public class ValidatorRecord {

    @ToString.Include
    private final Address validator;
    private final Address owner;
    private final long registrationOrder;

    @ToString.Include
    private String moniker;
    @ToString.Include
    private ValidatorStatus status = ValidatorStatus.INACTIVE;
    private byte[] consensusPublicKey;
    private byte[] proofOfPossession;
    private byte[] networkAddresses;
    private byte[] fullnodeAddresses;
    private Address feeRecipient;
    @Nullable
    private Address pendingFeeRecipient;
    @Nullable
    @ToString.Include
    private Integer validatorIndex;
    private BigInteger votingPower = BigInteger.ZERO;

    ValidatorRecord(Address validator, Address owner, long registrationOrder) {
        this.validator = validator;
        this.owner = owner;
        this.registrationOrder = registrationOrder;
    }
}
