package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chainrun.core.state.Undefined;
import java.io.IOException;
import java.io.Serial;

/// Writes the missing-key marker as JSON `null`.
class UndefinedSerializer extends StdSerializer<Undefined> {

    @Serial private static final long serialVersionUID = 2204657314398155321L;

    UndefinedSerializer() {
        super(Undefined.class);
    }

    @Override
    public void serialize(Undefined value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeNull();
    }
}
