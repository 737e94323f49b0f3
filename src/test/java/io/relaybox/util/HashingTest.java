package io.relaybox.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class HashingTest {

    @Test
    void shortLabelIsStableAndDoesNotExposeTheInput() {
        byte[] id = new byte[32];
        id[0] = (byte) 0xab;
        String label = Hashing.shortLabel(id);
        Assertions.assertEquals(8, label.length());
        Assertions.assertEquals(label, Hashing.shortLabel(id.clone()));
        Assertions.assertFalse(Hashing.hex(id).startsWith(label));
    }

    @Test
    void constantTimeEqualsHandlesNullsAndLengths() {
        Assertions.assertTrue(Hashing.constantTimeEquals("token", "token"));
        Assertions.assertFalse(Hashing.constantTimeEquals("token", "token2"));
        Assertions.assertFalse(Hashing.constantTimeEquals((String) null, "token"));
        Assertions.assertFalse(Hashing.constantTimeEquals("a".getBytes(StandardCharsets.UTF_8), null));
    }

    @Test
    void hmacMatchesKnownVector() {
        // RFC 4231 test case 2.
        Assertions.assertEquals(
                "5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843",
                Hashing.hmacSha256Hex("Jefe", "what do ya want for nothing?")
        );
    }
}
