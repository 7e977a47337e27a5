// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HexDataTest {

    @Test
    void emptyData() {
        assertTrue(new HexData("0x").isEmpty());
        assertEquals(HexData.EMPTY, new HexData("0x"));
        assertEquals(0, HexData.EMPTY.byteLength());
    }

    @Test
    void keepsOriginalCasingButComparesIgnoringIt() {
        HexData upper = new HexData("0xABCD");
        assertEquals("0xABCD", upper.value());
        assertEquals(new HexData("0xabcd"), upper);
        assertEquals(new HexData("0xabcd").hashCode(), upper.hashCode());
        assertEquals(2, upper.byteLength());
    }

    @Test
    void rejectsOddLengthAndMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new HexData("0x1"));
        assertThrows(IllegalArgumentException.class, () -> new HexData("abcd"));
    }
}
