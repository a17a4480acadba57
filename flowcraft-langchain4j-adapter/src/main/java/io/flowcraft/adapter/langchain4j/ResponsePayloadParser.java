package io.flowcraft.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcraft.core.output.OutputModel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Turns model text into a result payload keyed by output field name.
///
/// Models often wrap JSON in Markdown fences or surround it with prose; both
/// are stripped before parsing. Single-scalar results accept a bare value, a
/// `{"result": value}` object, or plain text. Object results take the first
/// `{...}` span of the text. Text that cannot be read yields an empty payload,
/// which output validation reports so the executor can ask again.
///
/// @implNote Package-private. Stateless and thread-safe.
final class ResponsePayloadParser {

    private static final Logger logger = Logger.getLogger(ResponsePayloadParser.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResponsePayloadParser() {}

    static Map<String, Object> parse(String text, OutputModel model) {
        String body = stripFences(text != null ? text.trim() : "");

        if (model.isScalar()) {
            Object value = readJson(body);
            Map<String, Object> payload = new LinkedHashMap<>();
            if (value instanceof Map<?, ?> map
                    && map.size() == 1
                    && map.containsKey(OutputModel.SCALAR_FIELD)) {
                payload.put(OutputModel.SCALAR_FIELD, map.get(OutputModel.SCALAR_FIELD));
            } else if (value != null && !(value instanceof Map)) {
                payload.put(OutputModel.SCALAR_FIELD, value);
            } else {
                payload.put(OutputModel.SCALAR_FIELD, body);
            }
            return payload;
        }

        Object value = readJson(objectSpan(body));
        Map<String, Object> payload = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> payload.put(String.valueOf(k), v));
        } else {
            logger.fine(
                    "Node '"
                            + model.getNodeId()
                            + "' response holds no JSON object: "
                            + abbreviate(body));
        }
        return payload;
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static String objectSpan(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : text;
    }

    private static Object readJson(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
