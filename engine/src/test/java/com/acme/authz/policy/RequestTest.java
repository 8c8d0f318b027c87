package com.acme.authz.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestTest {

    @Test
    void shouldExposeFieldsWithoutContext() throws Exception {
        Request<Object> request = Request.of("alice", "read", "/docs/a.txt");
        assertEquals("alice", request.identity());
        assertEquals("read", request.operation());
        assertEquals("/docs/a.txt", request.resource());
        assertFalse(request.context().isPresent());
        assertEquals("alice", Field.IDENTITY.requestValue(request));
        assertEquals("read", Field.OPERATION.requestValue(request));
        assertEquals("/docs/a.txt", Field.RESOURCE.requestValue(request));
    }

    @Test
    void shouldRejectEmptyOrMissingFields() {
        InvalidRequestException identity = assertThrows(InvalidRequestException.class,
            () -> Request.of("", "read", "r"));
        assertEquals(Field.IDENTITY, identity.field());

        InvalidRequestException operation = assertThrows(InvalidRequestException.class,
            () -> Request.of("alice", null, "r"));
        assertEquals(Field.OPERATION, operation.field());

        InvalidRequestException resource = assertThrows(InvalidRequestException.class,
            () -> Request.of("alice", "read", ""));
        assertEquals(Field.RESOURCE, resource.field());
        assertTrue(resource.getMessage().contains("resource"));
    }

    @Test
    void shouldAttachContextWithoutChangingOriginal() throws Exception {
        Request<Object> plain = Request.of("alice", "read", "r");
        Request<String> withRole = plain.withContext("reviewer");

        assertEquals("reviewer", withRole.context().orElseThrow());
        assertFalse(plain.context().isPresent());
        assertEquals(plain.identity(), withRole.identity());

        Request<Integer> direct = Request.of("alice", "read", "r", 7);
        assertEquals(7, direct.context().orElseThrow());
    }
}
