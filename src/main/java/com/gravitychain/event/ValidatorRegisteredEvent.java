package com.gravitychain.event;

import com.gravitychain.account.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = false)
public class ValidatorRegisteredEvent extends ChainEvent {

    private final Address validator;
    private final Address operator;
    private final String moniker;

    public ValidatorRegisteredEvent(Object source, Address validator, Address operator, String moniker) {
        super(source);
        this.validator = validator;
        this.operator = operator;
        this.moniker = moniker;
    }
}
