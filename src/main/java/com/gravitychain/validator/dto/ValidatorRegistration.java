package com.gravitychain.validator.dto;

import com.gravitychain.account.Address;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ValidatorRegistration {

    Address pool;
    byte[] consensusPublicKey;
    byte[] proofOfPossession;
    String moniker;
    Address feeRecipient;
    @Builder.Default
    byte[] networkAddresses = new byte[0];
    @Builder.Default
    byte[] fullnodeAddresses = new byte[0];
}
