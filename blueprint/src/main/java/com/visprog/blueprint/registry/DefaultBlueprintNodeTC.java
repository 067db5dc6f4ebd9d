package com.visprog.blueprint.registry;

import com.visprog.blueprint.config.AnalysisConfig;
import com.visprog.blueprint.model.Port;

import java.util.Objects;

public final class DefaultBlueprintNodeTC implements BlueprintNodeTC {

    private final String controlDataKind;
    private final String valueInputPortSuffix;

    public DefaultBlueprintNodeTC(AnalysisConfig config) {
        Objects.requireNonNull(config, "config");
        this.controlDataKind = config.controlDataKind();
        this.valueInputPortSuffix = config.valueInputPortSuffix();
    }

    @Override
    public boolean isControlPort(Port port) {
        return controlDataKind.equals(port.dataKind());
    }

    @Override
    public boolean isValueInputPort(String portId) {
        return portId.equals(valueInputPortSuffix) || portId.endsWith("-" + valueInputPortSuffix);
    }
}
