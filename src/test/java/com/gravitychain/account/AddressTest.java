package com.gravitychain.account;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AddressTest {

    @Test
    void testShortHexIsLeftPadded() {
        Address shortForm = Address.fromHex("0x1625F0000");
        Address longForm = Address.fromHex("0x00000000000000000000000000000001625f0000");

        assertEquals(longForm, shortForm);
        assertEquals("0x00000000000000000000000000000001625f0000", shortForm.toString());
    }

    @Test
    void testDifferentAddressesAreNotEqual() {
        assertNotEquals(Address.fromHex("0x01"), Address.fromHex("0x02"));
    }

    @Test
    void testTooLongHexIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Address.fromHex("0x" + "11".repeat(21)));
    }

    @Test
    void testWrapCopiesBytes() {
        byte[] bytes = new byte[Address.LENGTH];
        bytes[19] = 7;
        Address address = Address.wrap(bytes);
        bytes[19] = 8;

        assertEquals(7, address.getBytes()[19]);
        assertEquals(Address.fromHex("0x07"), address);
    }

    @Test
    void testWrapRequiresTwentyBytes() {
        assertThrows(IllegalArgumentException.class, () -> Address.wrap(new byte[19]));
    }
}
