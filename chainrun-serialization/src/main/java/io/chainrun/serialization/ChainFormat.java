package io.chainrun.serialization;

/// Field names of the JSON chain authoring format.
final class ChainFormat {

    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String MODE = "mode";
    static final String EXECUTION_MODE = "execution_mode";
    static final String ENABLED = "enabled";
    static final String STEPS = "steps";
    static final String TOOL_CHAIN = "tool_chain";

    static final String STEP_NAME = "step_name";
    static final String OPERATION = "operation";
    static final String TOOL = "tool";
    static final String TOOL_NAME = "tool_name";
    static final String INPUTS = "inputs";
    static final String PARAMETERS = "parameters";

    static final String ON_SUCCESS = "on_success";
    static final String MAP_OUTPUTS = "map_outputs";
    static final String OUTPUT_MAPPINGS = "output_mappings";
    static final String NEXT = "next";

    static final String ON_FAILURE = "on_failure";
    static final String ACTION = "action";
    static final String MAX_RETRIES = "max_retries";
    static final String CONTINUE_ON_MAX_RETRIES = "continue_on_max_retries";

    private ChainFormat() {}
}
