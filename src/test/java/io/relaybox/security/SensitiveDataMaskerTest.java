package io.relaybox.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksCredentialKeysAndOpaqueValues() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "adminToken", "hunter2",
                "reason", "quota",
                "nested", Map.of("signature", "abc", "bytes_used", 600L),
                "items", List.of("x".repeat(64))
        ));

        Assertions.assertEquals("***", masked.get("adminToken"));
        Assertions.assertEquals("quota", masked.get("reason"));
        Map<?, ?> nested = (Map<?, ?>) masked.get("nested");
        Assertions.assertEquals("***", nested.get("signature"));
        Assertions.assertEquals(600L, nested.get("bytes_used"));
        Assertions.assertEquals(List.of("***"), masked.get("items"));
    }
}
