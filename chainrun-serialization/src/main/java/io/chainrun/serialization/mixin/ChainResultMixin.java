package io.chainrun.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `ChainResult`.
///
/// Drops the derived `completed` and `failed` flags so only record components are
/// written, and puts identity and status first.
///
/// @see io.chainrun.serialization.ChainJacksonModule
@JsonIgnoreProperties({"completed", "failed"})
@JsonPropertyOrder({"chainId", "chainName", "mode", "status", "stepsExecuted", "stepsSucceeded",
    "stepsFailed"})
public abstract class ChainResultMixin {}
