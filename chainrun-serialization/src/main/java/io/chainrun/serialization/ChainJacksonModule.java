package io.chainrun.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.InputBinding;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.execution.ChainResult;
import io.chainrun.core.execution.StepResult;
import io.chainrun.core.state.Undefined;
import io.chainrun.serialization.mixin.ChainResultMixin;
import io.chainrun.serialization.mixin.StepResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all chain serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs** for the authoring format:
/// - `ChainDefinition` - `ChainDefinitionSerializer` / `ChainDefinitionDeserializer`
/// - `StepDefinition` - `StepDefinitionSerializer` / `StepDefinitionDeserializer`
/// - `InputBinding` - `InputBindingSerializer` / `InputBindingDeserializer`, the JSON value
///   decides between literal, reference and template
///
/// **Mixins** for the result records, which are written but never read back:
/// - `ChainResult`
/// - `StepResult`
///
/// `Undefined` is written as `null`.
///
/// @see ChainSerializer for the convenience factory API
public class ChainJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5093316270129718462L;

    public ChainJacksonModule() {
        super("ChainJacksonModule");

        addSerializer(ChainDefinition.class, new ChainDefinitionSerializer());
        addDeserializer(ChainDefinition.class, new ChainDefinitionDeserializer());

        addSerializer(StepDefinition.class, new StepDefinitionSerializer());
        addDeserializer(StepDefinition.class, new StepDefinitionDeserializer());

        addSerializer(InputBinding.class, new InputBindingSerializer());
        addDeserializer(InputBinding.class, new InputBindingDeserializer());

        addSerializer(Undefined.class, new UndefinedSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ChainResult.class, ChainResultMixin.class);
        context.setMixInAnnotations(StepResult.class, StepResultMixin.class);
    }
}
