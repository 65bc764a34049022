package io.github.abcls.socket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.abcls.protocol.DocumentRegistry;
import io.github.abcls.protocol.EditingService;
import io.github.abcls.protocol.ErrorCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SocketRequestHandlerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String URI = "file:///tmp/song.abc";

    private SocketRequestHandler handler;

    @BeforeEach
    void setUp() {
        var documents = new DocumentRegistry();
        documents.open(URI, "X:1\nK:C\nCDE|\n");
        handler = new SocketRequestHandler(new EditingService(documents));
    }

    private JsonNode call(String line) throws Exception {
        var response = handler.handle(line);
        assertTrue(!response.contains("\n"), "responses are single lines");
        return MAPPER.readTree(response);
    }

    private static void assertError(JsonNode response, int id, int code) {
        assertEquals(id, response.get("id").asInt());
        assertEquals(code, response.get("error").get("code").asInt(), response.toString());
    }

    @Test
    void invalidJsonAnswersWithIdZero() throws Exception {
        var response = call("{not json");
        assertError(response, 0, ErrorCodes.INVALID_REQUEST);
        assertEquals("Invalid JSON", response.get("error").get("message").asText());
    }

    @Test
    void requestNeedsIdAndMethod() throws Exception {
        assertError(call("[1,2]"), 0, ErrorCodes.INVALID_REQUEST);
        assertError(call("{\"method\":\"abc.applySelector\"}"), 0, ErrorCodes.INVALID_REQUEST);
        assertError(call("{\"id\":4}"), 0, ErrorCodes.INVALID_REQUEST);
    }

    @Test
    void unknownMethod() throws Exception {
        var response = call("{\"id\":1,\"method\":\"abc.format\",\"params\":{}}");
        assertError(response, 1, ErrorCodes.UNKNOWN_METHOD);
        assertEquals("Unknown method: \"abc.format\"", response.get("error").get("message").asText());
    }

    @Test
    void applySelectorReturnsRanges() throws Exception {
        var response = call("{\"id\":7,\"method\":\"abc.applySelector\","
                + "\"params\":{\"uri\":\"" + URI + "\",\"selector\":\"selectNotes\"}}");
        assertEquals(7, response.get("id").asInt());
        var ranges = response.get("result").get("ranges");
        assertEquals(3, ranges.size());
        assertEquals(2, ranges.get(0).get("start").get("line").asInt());
        assertEquals(0, ranges.get(0).get("start").get("character").asInt());
        assertEquals(1, ranges.get(0).get("end").get("character").asInt());
    }

    @Test
    void applySelectorWithRanges() throws Exception {
        var response = call("{\"id\":2,\"method\":\"abc.applySelector\",\"params\":{\"uri\":\"" + URI
                + "\",\"selector\":\"selectNotes\",\"ranges\":[{\"start\":{\"line\":2,\"character\":2},"
                + "\"end\":{\"line\":2,\"character\":3}}]}}");
        assertEquals(1, response.get("result").get("ranges").size());
    }

    @Test
    void applyTransformReturnsEdits() throws Exception {
        var response = call("{\"id\":\"t1\",\"method\":\"abc.applyTransform\",\"params\":{\"uri\":\"" + URI
                + "\",\"transform\":\"transpose\",\"args\":[2]}}");
        assertEquals("t1", response.get("id").asText());
        var result = response.get("result");
        assertTrue(result.get("edits").size() > 0);
        assertTrue(result.get("edits").get(0).has("newText"));
        assertTrue(result.has("cursorRanges"));
    }

    @Test
    void paramsAreValidated() throws Exception {
        assertError(call("{\"id\":1,\"method\":\"abc.applySelector\"}"), 1, ErrorCodes.INVALID_PARAMS);
        assertError(
                call("{\"id\":1,\"method\":\"abc.applySelector\",\"params\":{\"uri\":\"" + URI
                        + "\",\"selector\":\"selectNotes\",\"args\":5}}"),
                1,
                ErrorCodes.INVALID_PARAMS);
        assertError(
                call("{\"id\":1,\"method\":\"abc.applySelector\",\"params\":{\"uri\":\"" + URI
                        + "\",\"selector\":\"selectNotes\",\"args\":[{\"x\":1}]}}"),
                1,
                ErrorCodes.INVALID_PARAMS);
        assertError(
                call("{\"id\":1,\"method\":\"abc.applySelector\",\"params\":{\"uri\":\"file:///a/../b.abc\","
                        + "\"selector\":\"selectNotes\"}}"),
                1,
                ErrorCodes.INVALID_PARAMS);
    }

    @Test
    void documentErrors() throws Exception {
        assertError(
                call("{\"id\":3,\"method\":\"abc.applySelector\",\"params\":{\"uri\":\"file:///tmp/none.abc\","
                        + "\"selector\":\"selectNotes\"}}"),
                3,
                ErrorCodes.DOCUMENT_NOT_FOUND);
    }
}
