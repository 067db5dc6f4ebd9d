package com.visprog.blueprint.config;

import com.visprog.blueprint.model.Port;
import com.visprog.common.IEnvGetter;

import java.util.Objects;

/**
 * Settings for one analyzer instance. Nothing in the analysis reads the environment directly;
 * build this once (usually with {@link #fromEnv(IEnvGetter)}) and pass it in.
 *
 * @param controlDataKind       port data kind that marks an execution pin
 * @param valueInputPortSuffix  port id (or {@code -suffix}) of an assignment's value input
 * @param resolveOnlyWhenValid  skip variable resolution when the graph has errors
 * @param nodeTypesResource     classpath resource with the node type name table
 */
public record AnalysisConfig(String controlDataKind,
                             String valueInputPortSuffix,
                             boolean resolveOnlyWhenValid,
                             String nodeTypesResource) {

    public static final String CONTROL_DATA_KIND_ENV = "BLUEPRINT_CONTROL_DATA_KIND";
    public static final String VALUE_INPUT_PORT_SUFFIX_ENV = "BLUEPRINT_VALUE_INPUT_PORT_SUFFIX";
    public static final String RESOLVE_ONLY_WHEN_VALID_ENV = "BLUEPRINT_RESOLVE_ONLY_WHEN_VALID";
    public static final String NODE_TYPES_RESOURCE_ENV = "BLUEPRINT_NODE_TYPES_RESOURCE";

    public static final String DEFAULT_VALUE_INPUT_PORT_SUFFIX = "value-in";
    public static final String DEFAULT_NODE_TYPES_RESOURCE = "blueprint/node-types.json";

    public AnalysisConfig {
        Objects.requireNonNull(controlDataKind, "controlDataKind");
        Objects.requireNonNull(valueInputPortSuffix, "valueInputPortSuffix");
        Objects.requireNonNull(nodeTypesResource, "nodeTypesResource");
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(Port.CONTROL_DATA_KIND, DEFAULT_VALUE_INPUT_PORT_SUFFIX, false, DEFAULT_NODE_TYPES_RESOURCE);
    }

    public static AnalysisConfig fromEnv(IEnvGetter env) {
        return new AnalysisConfig(
                IEnvGetter.getStringOr(env, CONTROL_DATA_KIND_ENV, Port.CONTROL_DATA_KIND),
                IEnvGetter.getStringOr(env, VALUE_INPUT_PORT_SUFFIX_ENV, DEFAULT_VALUE_INPUT_PORT_SUFFIX),
                IEnvGetter.getBooleanOr(env, RESOLVE_ONLY_WHEN_VALID_ENV, false),
                IEnvGetter.getStringOr(env, NODE_TYPES_RESOURCE_ENV, DEFAULT_NODE_TYPES_RESOURCE));
    }

    public AnalysisConfig withResolveOnlyWhenValid(boolean flag) {
        return new AnalysisConfig(controlDataKind, valueInputPortSuffix, flag, nodeTypesResource);
    }
}
