package com.gravitychain.stake;

import com.gravitychain.account.Address;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;

@Getter
@Setter
@AllArgsConstructor
public class StakePool {

    private final Address pool;
    private final Address owner;
    private Address operator;
    private BigInteger bondedAmount;
}
