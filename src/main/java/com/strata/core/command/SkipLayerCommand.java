package com.strata.core.command;

import java.util.ArrayList;
import java.util.List;

/**
 * Skip every task that would run in the given layer.
 *
 * @param layerIndex zero-based layer index
 * @param reason     why the layer is skipped
 */
public record SkipLayerCommand(Integer layerIndex, String reason) implements Command {

    @Override
    public CommandType type() {
        return CommandType.SKIP_LAYER;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (layerIndex == null || layerIndex < 0) {
            violations.add("skip_layer requires a non-negative layerIndex");
        }
        if (reason == null) {
            violations.add("skip_layer requires a reason");
        }
        return violations;
    }
}
