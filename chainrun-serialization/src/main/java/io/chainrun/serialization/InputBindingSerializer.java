package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chainrun.core.chain.InputBinding;
import io.chainrun.core.chain.InputBinding.Literal;
import io.chainrun.core.chain.InputBinding.Reference;
import io.chainrun.core.chain.InputBinding.Template;
import java.io.IOException;
import java.io.Serial;

/// Writes an `InputBinding` in its authored form.
///
/// - **`Literal`**: the value itself
/// - **`Reference`**: `"{{ state.key }}"`
/// - **`Template`**: the template text
///
/// @implNote Package-private. Registered by {@link ChainJacksonModule}.
/// @see InputBindingDeserializer for the inverse operation
class InputBindingSerializer extends StdSerializer<InputBinding> {

    @Serial private static final long serialVersionUID = 3018774453190527720L;

    InputBindingSerializer() {
        super(InputBinding.class);
    }

    @Override
    public void serialize(InputBinding binding, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (binding instanceof Reference reference) {
            gen.writeString(reference.expression());
        } else if (binding instanceof Template template) {
            gen.writeString(template.text());
        } else {
            provider.defaultSerializeValue(((Literal) binding).value(), gen);
        }
    }
}
