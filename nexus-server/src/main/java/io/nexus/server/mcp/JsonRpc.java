package io.nexus.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/// JSON-RPC 2.0 helper for MCP protocol messages.
///
/// Creates and parses the messages the router exchanges with downstream MCP
/// servers. Outgoing messages are POSTed to the server's message endpoint;
/// incoming ones arrive as SSE `message` events.
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, `params` - expects a response
/// - **Notification**: Has `method`, `params` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// @see McpSseSession for message routing
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    private final ObjectMapper mapper;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Creates an empty params object.
    ///
    /// @return new mutable object node
    public ObjectNode params() {
        return mapper.createObjectNode();
    }

    /// Creates a JSON-RPC request (expects a response).
    ///
    /// @param id unique request identifier for response correlation
    /// @param method the method to invoke (e.g., "tools/call")
    /// @param params method parameters, may be null
    /// @return JSON-RPC request string
    public String createRequest(String id, String method, JsonNode params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", id);
        root.put("method", method);
        if (params != null) {
            root.set("params", params);
        }
        return root.toString();
    }

    /// Creates a JSON-RPC notification (no response expected).
    ///
    /// @param method the method to invoke
    /// @param params method parameters, may be null
    /// @return JSON-RPC notification string
    public String createNotification(String method, JsonNode params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("method", method);
        if (params != null) {
            root.set("params", params);
        }
        return root.toString();
    }

    /// Creates a JSON-RPC success response to a server-initiated request.
    ///
    /// @param id the request ID being responded to, as received
    /// @param result the result data
    /// @return JSON-RPC response string
    public String createResponse(JsonNode id, JsonNode result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        root.set("result", result != null ? result : mapper.createObjectNode());
        return root.toString();
    }

    /// Parses a raw message.
    ///
    /// @param json the message text, not null
    /// @return parsed tree, never null
    /// @throws McpException if the text is not a JSON object
    public JsonNode parse(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new McpException("JSON-RPC message is not an object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new McpException("Failed to parse JSON-RPC message: " + e.getOriginalMessage(), e);
        }
    }

    /// Extracts the ID from a parsed message.
    ///
    /// @param message the parsed message
    /// @return the ID as text, or null if not present
    public String extractId(JsonNode message) {
        JsonNode idNode = message.get("id");
        return idNode != null && !idNode.isNull() ? idNode.asText() : null;
    }

    /// Extracts the method from a parsed message.
    ///
    /// @param message the parsed message
    /// @return the method name, or null if not present
    public String extractMethod(JsonNode message) {
        JsonNode methodNode = message.get("method");
        return methodNode != null && methodNode.isTextual() ? methodNode.asText() : null;
    }

    /// Extracts the result of a response, failing on a JSON-RPC error.
    ///
    /// @param response the parsed response
    /// @return the result, or an empty object if absent
    /// @throws McpException carrying the error code if the response contains an error
    public JsonNode result(JsonNode response) {
        JsonNode errorNode = response.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String message =
                    errorNode.hasNonNull("message")
                            ? errorNode.get("message").asText()
                            : "Unknown error";
            int code = errorNode.has("code") ? errorNode.get("code").asInt() : -1;
            throw McpException.rpcError(code, message);
        }

        JsonNode resultNode = response.get("result");
        if (resultNode == null || resultNode.isNull()) {
            return mapper.createObjectNode();
        }
        return resultNode;
    }

    /// Checks if a message is a JSON-RPC response (has result or error, no method).
    ///
    /// @param message the parsed message
    /// @return true if this is a response
    public boolean isResponse(JsonNode message) {
        return (message.has("result") || message.has("error")) && !message.has("method");
    }

    /// Checks if a message is a request or notification (has method).
    ///
    /// @param message the parsed message
    /// @return true if this is a request or notification
    public boolean isRequest(JsonNode message) {
        return message.has("method");
    }
}
