package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QueryResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testMixedSlots() throws Exception {
        QueryResponse response = QueryResponse.fromJson(mapper.readTree(
            "[{\"time\":\"1.2ms\",\"status\":\"OK\",\"result\":[{\"id\":\"person:1\",\"name\":\"a\"}]},"
                + "{\"time\":\"0.1ms\",\"status\":\"ERR\",\"detail\":\"Database record already exists\"}]"));

        assertEquals(2, response.size());
        assertTrue(response.get(0).isOk());
        assertEquals("1.2ms", response.get(0).getTime());
        assertTrue(response.hasErrors());
        assertEquals("Database record already exists", response.firstError().get().getDetail());
    }

    @Test
    void testErrorTextFromResultField() throws Exception {
        QueryResponse response = QueryResponse.fromJson(mapper.readTree(
            "[{\"time\":\"0ns\",\"status\":\"ERR\",\"result\":\"The query was not executed due to a failed transaction\"}]"));

        QueryResult slot = response.get(0);
        assertEquals(QueryResult.Status.ERR, slot.getStatus());
        assertEquals("The query was not executed due to a failed transaction", slot.getDetail());
        assertTrue(slot.getResult().isNull());
    }

    @Test
    void testEmptyReplies() throws Exception {
        assertTrue(QueryResponse.fromJson(null).isEmpty());
        assertTrue(QueryResponse.fromJson(mapper.readTree("[]")).isEmpty());
        assertFalse(QueryResponse.empty().hasErrors());
        assertFalse(QueryResponse.empty().firstError().isPresent());
    }

    @Test
    void testNonArrayReplyIsRejected() throws Exception {
        assertThrows(IllegalArgumentException.class,
            () -> QueryResponse.fromJson(mapper.readTree("{\"status\":\"OK\"}")));
    }
}
