package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chainrun.core.chain.FailurePolicy;
import io.chainrun.core.chain.InputBinding;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.chain.SuccessPolicy;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Map;

/// Serializes a `StepDefinition` in the chain authoring format.
///
/// Emitted JSON shape:
/// ```
/// {"name":"search","operation":"gmail_search","inputs":{...},
///  "on_success":{"map_outputs":{...},"next":"..."},
///  "on_failure":{"action":"retry","max_retries":3,"continue_on_max_retries":true,"next":"..."}}
/// ```
/// Absent optional fields are omitted. A default STOP failure policy is written out so
/// the file states the behavior explicitly.
///
/// @see StepDefinitionDeserializer for the inverse operation
class StepDefinitionSerializer extends StdSerializer<StepDefinition> {

    @Serial private static final long serialVersionUID = 8876103382297456191L;

    StepDefinitionSerializer() {
        super(StepDefinition.class);
    }

    @Override
    public void serialize(StepDefinition step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (step.stepName() != null) {
            gen.writeStringField(ChainFormat.NAME, step.stepName());
        }
        gen.writeStringField(ChainFormat.OPERATION, step.operationName());

        if (!step.inputs().isEmpty()) {
            gen.writeObjectFieldStart(ChainFormat.INPUTS);
            for (Map.Entry<String, InputBinding> input : step.inputs().entrySet()) {
                gen.writeFieldName(input.getKey());
                provider.defaultSerializeValue(input.getValue(), gen);
            }
            gen.writeEndObject();
        }

        SuccessPolicy onSuccess = step.onSuccess();
        if (!onSuccess.outputMappings().isEmpty() || onSuccess.next() != null) {
            gen.writeObjectFieldStart(ChainFormat.ON_SUCCESS);
            if (!onSuccess.outputMappings().isEmpty()) {
                gen.writeObjectFieldStart(ChainFormat.MAP_OUTPUTS);
                for (Map.Entry<String, String> mapping : onSuccess.outputMappings().entrySet()) {
                    gen.writeStringField(mapping.getKey(), mapping.getValue());
                }
                gen.writeEndObject();
            }
            if (onSuccess.next() != null) {
                gen.writeStringField(ChainFormat.NEXT, onSuccess.next());
            }
            gen.writeEndObject();
        }

        FailurePolicy onFailure = step.onFailure();
        gen.writeObjectFieldStart(ChainFormat.ON_FAILURE);
        gen.writeStringField(ChainFormat.ACTION, onFailure.action().name().toLowerCase(Locale.ROOT));
        if (onFailure.maxRetries() != null) {
            gen.writeNumberField(ChainFormat.MAX_RETRIES, onFailure.maxRetries());
        }
        if (onFailure.continueOnMaxRetries()) {
            gen.writeBooleanField(ChainFormat.CONTINUE_ON_MAX_RETRIES, true);
        }
        if (onFailure.next() != null) {
            gen.writeStringField(ChainFormat.NEXT, onFailure.next());
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }
}
