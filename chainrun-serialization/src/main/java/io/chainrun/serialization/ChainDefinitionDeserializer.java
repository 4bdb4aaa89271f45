package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.chain.StepDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Deserializes a `ChainDefinition`.
///
/// Accepts `execution_mode` as an alias of `mode` and `tool_chain` of `steps`. `enabled`
/// defaults to true. An empty step list is accepted here and rejected by the validator.
///
/// @see ChainDefinitionSerializer for the inverse operation
class ChainDefinitionDeserializer extends StdDeserializer<ChainDefinition> {

    @Serial private static final long serialVersionUID = 1862213440711279904L;

    ChainDefinitionDeserializer() {
        super(ChainDefinition.class);
    }

    @Override
    public ChainDefinition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Chain must be a JSON object");
        }

        JsonNode stepsNode = root.has(ChainFormat.STEPS)
                ? root.get(ChainFormat.STEPS)
                : root.get(ChainFormat.TOOL_CHAIN);
        if (stepsNode == null || !stepsNode.isArray()) {
            throw JsonMappingException.from(p, "Chain is missing a 'steps' array");
        }
        List<StepDefinition> steps = new ArrayList<>();
        for (JsonNode stepNode : stepsNode) {
            steps.add(mapper.treeToValue(stepNode, StepDefinition.class));
        }

        return new ChainDefinition(
                textOrNull(root, ChainFormat.NAME),
                textOrNull(root, ChainFormat.DESCRIPTION),
                readMode(p, root),
                !root.has(ChainFormat.ENABLED) || root.get(ChainFormat.ENABLED).asBoolean(true),
                steps);
    }

    private static ExecutionMode readMode(JsonParser p, JsonNode root) throws IOException {
        String mode = textOrNull(root, ChainFormat.MODE);
        if (mode == null) {
            mode = textOrNull(root, ChainFormat.EXECUTION_MODE);
        }
        if (mode == null) {
            return null;
        }
        try {
            return ExecutionMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Unknown execution mode: " + mode, e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
