package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chainrun.core.chain.FailurePolicy;
import io.chainrun.core.chain.InputBinding;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.chain.SuccessPolicy;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Deserializes a `StepDefinition` from the chain authoring format.
///
/// Accepts `tool` and `tool_name` as aliases of `operation`, `parameters` of `inputs`, and
/// `output_mappings` of `map_outputs`. A missing `on_failure` means STOP; a missing
/// `action` inside it means STOP as well. Semantic checks such as a RETRY without
/// `max_retries` are left to the chain validator.
///
/// @see StepDefinitionSerializer for the inverse operation
class StepDefinitionDeserializer extends StdDeserializer<StepDefinition> {

    @Serial private static final long serialVersionUID = -2297906606237018446L;

    StepDefinitionDeserializer() {
        super(StepDefinition.class);
    }

    @Override
    public StepDefinition deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Step must be a JSON object");
        }

        String operation = text(root, ChainFormat.OPERATION, ChainFormat.TOOL, ChainFormat.TOOL_NAME);
        if (operation == null) {
            throw JsonMappingException.from(p, "Step is missing 'operation'");
        }

        Map<String, InputBinding> inputs = new LinkedHashMap<>();
        JsonNode inputsNode = field(root, ChainFormat.INPUTS, ChainFormat.PARAMETERS);
        if (inputsNode != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = inputsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                InputBinding binding = mapper.treeToValue(entry.getValue(), InputBinding.class);
                inputs.put(entry.getKey(), binding != null ? binding : InputBinding.literal(null));
            }
        }

        return new StepDefinition(
                operation,
                inputs,
                readSuccess(root.get(ChainFormat.ON_SUCCESS)),
                readFailure(p, root.get(ChainFormat.ON_FAILURE)),
                text(root, ChainFormat.NAME, ChainFormat.STEP_NAME));
    }

    private static SuccessPolicy readSuccess(JsonNode node) {
        if (node == null || node.isNull()) {
            return SuccessPolicy.fallthrough();
        }
        Map<String, String> mappings = new LinkedHashMap<>();
        JsonNode mappingsNode = field(node, ChainFormat.MAP_OUTPUTS, ChainFormat.OUTPUT_MAPPINGS);
        if (mappingsNode != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = mappingsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                mappings.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return new SuccessPolicy(mappings, text(node, ChainFormat.NEXT));
    }

    private static FailurePolicy readFailure(JsonParser p, JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return FailurePolicy.stop();
        }
        String actionText = text(node, ChainFormat.ACTION);
        FailurePolicy.Action action;
        try {
            action =
                    actionText != null
                            ? FailurePolicy.Action.valueOf(actionText.toUpperCase(Locale.ROOT))
                            : FailurePolicy.Action.STOP;
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Unknown failure action: " + actionText, e);
        }
        JsonNode maxRetries = node.get(ChainFormat.MAX_RETRIES);
        JsonNode continueOnMax = node.get(ChainFormat.CONTINUE_ON_MAX_RETRIES);
        return new FailurePolicy(
                action,
                maxRetries != null && maxRetries.canConvertToInt() ? maxRetries.asInt() : null,
                continueOnMax != null && continueOnMax.asBoolean(),
                text(node, ChainFormat.NEXT));
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        return value != null ? value.asText() : null;
    }
}
