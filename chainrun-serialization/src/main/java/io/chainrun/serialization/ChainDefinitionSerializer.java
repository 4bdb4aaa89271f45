package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.StepDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Serializes a `ChainDefinition` as `{"name","description","mode","enabled","steps":[...]}`.
///
/// `mode` is written in lower case and omitted when the chain has none.
///
/// @see ChainDefinitionDeserializer for the inverse operation
class ChainDefinitionSerializer extends StdSerializer<ChainDefinition> {

    @Serial private static final long serialVersionUID = -4471937206645418102L;

    ChainDefinitionSerializer() {
        super(ChainDefinition.class);
    }

    @Override
    public void serialize(ChainDefinition chain, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (chain.name() != null) {
            gen.writeStringField(ChainFormat.NAME, chain.name());
        }
        if (chain.description() != null) {
            gen.writeStringField(ChainFormat.DESCRIPTION, chain.description());
        }
        if (chain.mode() != null) {
            gen.writeStringField(ChainFormat.MODE, chain.mode().name().toLowerCase(Locale.ROOT));
        }
        gen.writeBooleanField(ChainFormat.ENABLED, chain.enabled());
        gen.writeArrayFieldStart(ChainFormat.STEPS);
        for (StepDefinition step : chain.steps()) {
            provider.defaultSerializeValue(step, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
