package io.github.abcls.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.abcls.protocol.ApplySelectorParams;
import io.github.abcls.protocol.ApplyTransformParams;
import io.github.abcls.protocol.EditingService;
import io.github.abcls.protocol.ErrorCodes;
import io.github.abcls.protocol.ProtocolException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Answers one line of the socket protocol with one line of JSON. Every request gets a response, either
 * {@code {"id", "result"}} or {@code {"id", "error": {"code", "message"}}}. A line that is not a well-formed request
 * is answered with id {@code 0}.
 */
public final class SocketRequestHandler {
    private static final Logger logger = LogManager.getLogger(SocketRequestHandler.class);

    public static final String APPLY_SELECTOR = "abc.applySelector";
    public static final String APPLY_TRANSFORM = "abc.applyTransform";

    private final EditingService service;
    private final ObjectMapper mapper;

    public SocketRequestHandler(EditingService service) {
        this.service = service;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String handle(String line) {
        JsonNode request;
        try {
            request = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            logger.warn("Rejected socket request: invalid JSON");
            return error(null, ErrorCodes.INVALID_REQUEST, "Invalid JSON");
        }

        if (request == null || !request.isObject()) {
            return error(null, ErrorCodes.INVALID_REQUEST, "Request must be an object");
        }
        var id = request.get("id");
        if (id == null || id.isNull()) {
            return error(null, ErrorCodes.INVALID_REQUEST, "Request must have an id");
        }
        var method = request.get("method");
        if (method == null || !method.isTextual()) {
            return error(null, ErrorCodes.INVALID_REQUEST, "Request must have a method string");
        }

        try {
            var result = dispatch(method.asText(), request.get("params"));
            var response = mapper.createObjectNode();
            response.set("id", id);
            response.set("result", result);
            return write(response);
        } catch (ProtocolException e) {
            logger.warn("Rejected {}: {}", method.asText(), e.getMessage());
            return error(id, e.code(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure handling {}", method.asText(), e);
            return error(id, ErrorCodes.INVALID_REQUEST, String.valueOf(e.getMessage()));
        }
    }

    private JsonNode dispatch(String method, @Nullable JsonNode params) throws ProtocolException {
        logger.debug("Socket request {}", method);
        switch (method) {
            case APPLY_SELECTOR -> {
                var result = service.applySelector(readParams(params, ApplySelectorParams.class));
                return mapper.valueToTree(result);
            }
            case APPLY_TRANSFORM -> {
                var result = service.applyTransform(readParams(params, ApplyTransformParams.class));
                var node = mapper.createObjectNode();
                node.set("edits", mapper.valueToTree(result.getTextEdits()));
                node.set("cursorRanges", mapper.valueToTree(result.getCursorRanges()));
                return node;
            }
            default -> throw new ProtocolException(ErrorCodes.UNKNOWN_METHOD, "Unknown method: \"" + method + "\"");
        }
    }

    private <T> T readParams(@Nullable JsonNode params, Class<T> type) throws ProtocolException {
        if (params == null || !params.isObject()) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "Missing params");
        }
        requireArrayOrAbsent(params, "args");
        requireArrayOrAbsent(params, "ranges");
        requireArrayOrAbsent(params, "cursorNodeIds");
        try {
            return mapper.treeToValue(params, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "Malformed params: " + e.getMessage(), e);
        }
    }

    private static void requireArrayOrAbsent(JsonNode params, String field) throws ProtocolException {
        var value = params.get(field);
        if (value != null && !value.isNull() && !value.isArray()) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, field + " must be an array");
        }
    }

    private String error(@Nullable JsonNode id, int code, String message) {
        var response = mapper.createObjectNode();
        if (id == null) {
            response.put("id", 0);
        } else {
            response.set("id", id);
        }
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return write(response);
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize a JSON tree", e);
        }
    }
}
