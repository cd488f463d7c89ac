package me.golemcore.runtime.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionKeyTest {

    @Test
    void parseSplitsOnFirstColonOnly() {
        SessionKey key = SessionKey.parse("matrix:@alice:example.org");

        assertEquals("matrix", key.channel());
        assertEquals("@alice:example.org", key.recipientId());
        assertEquals("matrix:@alice:example.org", key.toString());
    }

    @Test
    void parseRejectsMalformedValues() {
        assertThrows(OperationException.class, () -> SessionKey.parse("telegram"));
        assertThrows(OperationException.class, () -> SessionKey.parse(":42"));
        assertThrows(OperationException.class, () -> SessionKey.parse("telegram:"));
        assertThrows(OperationException.class, () -> SessionKey.parse(null));
    }

    @Test
    void convertsToDeliveryTarget() {
        assertEquals(new DeliveryTarget("cli", "direct"), new SessionKey("cli", "direct").toDeliveryTarget());
        assertEquals(new SessionKey("cli", "direct"), new DeliveryTarget("cli", "direct").toSessionKey());
    }
}
