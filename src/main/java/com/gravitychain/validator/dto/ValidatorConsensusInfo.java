package com.gravitychain.validator.dto;

import com.gravitychain.account.Address;
import lombok.Value;

import java.math.BigInteger;

/**
 * What the consensus engine needs to know about one member of a validator set.
 */
@Value
public class ValidatorConsensusInfo {

    Address validator;
    byte[] consensusPublicKey;
    byte[] proofOfPossession;
    BigInteger votingPower;
    long validatorIndex;
    byte[] networkAddresses;
    byte[] fullnodeAddresses;
}
