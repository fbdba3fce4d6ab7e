package br.edu.ifba.federated.shared;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class UuidUtilsTest {

    @Test
    @DisplayName("chunk ids are deterministic name-based v5 UUIDs")
    void deterministic() {
        final String first = UuidUtils.chunkId("batch-1", "/uploads/a.pdf", 0);
        final String second = UuidUtils.chunkId("batch-1", "/uploads/a.pdf", 0);

        assertEquals(first, second);
        assertEquals(5, UUID.fromString(first).version());
        assertEquals(2, UUID.fromString(first).variant());
    }

    @Test
    @DisplayName("chunk ids differ by path and by index")
    void distinct() {
        final String base = UuidUtils.chunkId("batch-1", "/uploads/a.pdf", 0);

        assertNotEquals(base, UuidUtils.chunkId("batch-1", "/uploads/b.pdf", 0));
        assertNotEquals(base, UuidUtils.chunkId("batch-1", "/uploads/a.pdf", 1));
        assertNotEquals(base, UuidUtils.chunkId("batch-2", "/uploads/a.pdf", 0));
    }

    @Test
    @DisplayName("matches a well-known DNS namespace v5 value")
    void rfcExample() {
        assertEquals("886313e1-3b8a-5372-9b90-0c9aee199e5d",
            UuidUtils.nameBasedV5(UuidUtils.NAMESPACE_DNS, "python.org").toString());
    }
}
