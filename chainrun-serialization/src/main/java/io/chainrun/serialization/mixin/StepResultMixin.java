package io.chainrun.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `StepResult`: omits the derived `success`/`failure` flags and null
/// error fields.
///
/// @see io.chainrun.serialization.ChainJacksonModule
@JsonIgnoreProperties({"success", "failure"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class StepResultMixin {}
