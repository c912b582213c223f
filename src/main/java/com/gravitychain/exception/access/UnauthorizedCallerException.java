package com.gravitychain.exception.access;

import com.gravitychain.account.Address;
import lombok.Getter;

import java.util.List;

@Getter
public class UnauthorizedCallerException extends RuntimeException {

    private final transient Address actual;
    private final transient List<Address> expected;

    public UnauthorizedCallerException(Address actual, List<Address> expected) {
        super(String.format("Unauthorized caller %s, expected one of %s", actual, expected));
        this.actual = actual;
        this.expected = List.copyOf(expected);
    }
}
