// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RequestIdTest {

    @Test
    void accepts32ByteHex() {
        RequestId id = new RequestId("0x" + "Ab".repeat(32));
        assertEquals(32, id.toBytes().length);
        assertEquals("0x" + "ab".repeat(32), id.value());
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new RequestId("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> RequestId.fromBytes(new byte[20]));
    }

    @Test
    void zeroIdIsRepresentableButFlagged() {
        assertTrue(RequestId.fromBytes(new byte[32]).isZero());
        assertFalse(new RequestId("0x" + "0".repeat(63) + "1").isZero());
    }

    @Test
    void shortFormKeepsFirstFourBytes() {
        assertEquals("0x01020304", new RequestId("0x01020304" + "0".repeat(56)).shortForm());
    }
}
