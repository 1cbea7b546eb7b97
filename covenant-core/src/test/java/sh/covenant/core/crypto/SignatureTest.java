// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class SignatureTest {

    private static byte[] filled(int value) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    @Test
    void compactEncodingLayout() {
        Signature signature = new Signature(filled(0x11), filled(0x22), 28);

        byte[] compact = signature.toCompact();

        assertEquals(65, compact.length);
        assertEquals(0x11, compact[0]);
        assertEquals(0x22, compact[32]);
        assertEquals(28, compact[64]);
        assertEquals(signature, Signature.fromCompact(compact));
    }

    @Test
    void rejectsWrongComponentLengths() {
        assertThrows(IllegalArgumentException.class, () -> new Signature(new byte[31], filled(1), 0));
        assertThrows(IllegalArgumentException.class, () -> new Signature(filled(1), new byte[33], 0));
        assertThrows(IllegalArgumentException.class, () -> Signature.fromCompact(new byte[64]));
    }

    @Test
    void recoveryIdNormalizesLegacyV() {
        assertEquals(0, new Signature(filled(1), filled(2), 0).recoveryId());
        assertEquals(1, new Signature(filled(1), filled(2), 28).recoveryId());
        assertThrows(IllegalArgumentException.class, () -> new Signature(filled(1), filled(2), 37).recoveryId());
    }

    @Test
    void componentsAreDefensivelyCopied() {
        byte[] r = filled(7);
        Signature signature = new Signature(r, filled(8), 27);

        r[0] = 0;
        signature.r()[1] = 0;

        assertEquals(7, signature.r()[0]);
        assertEquals(7, signature.r()[1]);
    }
}
