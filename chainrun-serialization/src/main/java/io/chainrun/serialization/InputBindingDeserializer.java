package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chainrun.core.chain.InputBinding;
import java.io.IOException;
import java.io.Serial;

/// Reads an authored input value and classifies it with {@link InputBinding#of(Object)}.
///
/// Objects and arrays become literal maps and lists.
///
/// @see InputBindingSerializer for the inverse operation
class InputBindingDeserializer extends StdDeserializer<InputBinding> {

    @Serial private static final long serialVersionUID = -6413389107021886125L;

    InputBindingDeserializer() {
        super(InputBinding.class);
    }

    @Override
    public InputBinding deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode node = mapper.readTree(p);
        return InputBinding.of(mapper.treeToValue(node, Object.class));
    }

    @Override
    public InputBinding getNullValue(DeserializationContext ctx) {
        return InputBinding.literal(null);
    }
}
