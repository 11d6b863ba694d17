package com.khaounen.guard.security.identity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientIdentityTest {

    @Test
    void tokensAreNeverStoredInTheClear() {
        ClientIdentity identity = ClientIdentity.token("secret-token");

        assertTrue(identity.value().startsWith(ClientIdentity.TOKEN_PREFIX));
        assertFalse(identity.value().contains("secret-token"));
        assertEquals(identity, ClientIdentity.token(" secret-token "));
    }

    @Test
    void storedKeysRoundTripToTheirKind() {
        assertEquals(ClientIdentity.Kind.TOKEN, ClientIdentity.of(ClientIdentity.token("t").value()).kind());
        assertEquals(ClientIdentity.Kind.COMPOSITE, ClientIdentity.of(ClientIdentity.composite("a", "b").value()).kind());
        assertEquals(ClientIdentity.Kind.ADDRESS, ClientIdentity.of(" 10.0.0.1 ").kind());
        assertEquals("10.0.0.1", ClientIdentity.of(" 10.0.0.1 ").value());
    }

    @Test
    void emptyIdentitiesAreRejected() {
        assertThrows(InvalidIdentityException.class, () -> ClientIdentity.address(null));
        assertThrows(InvalidIdentityException.class, () -> ClientIdentity.address(""));
        assertThrows(InvalidIdentityException.class, () -> ClientIdentity.token(" "));
        assertThrows(InvalidIdentityException.class, () -> ClientIdentity.composite(null, ""));
    }
}
