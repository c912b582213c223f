package com.gravitychain.event;

import com.gravitychain.account.Address;
import com.gravitychain.validator.ValidatorStatus;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = false)
public class ValidatorStatusChangedEvent extends ChainEvent {

    private final Address validator;
    private final ValidatorStatus previousStatus;
    private final ValidatorStatus newStatus;

    public ValidatorStatusChangedEvent(Object source,
                                       Address validator,
                                       ValidatorStatus previousStatus,
                                       ValidatorStatus newStatus) {
        super(source);
        this.validator = validator;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
    }
}
