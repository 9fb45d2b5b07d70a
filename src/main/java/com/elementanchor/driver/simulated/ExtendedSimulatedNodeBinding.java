package com.elementanchor.driver.simulated;

import com.elementanchor.driver.SupportsExtended;
import com.elementanchor.model.ClickOptions;
import com.elementanchor.model.Operation;

import java.util.Map;

/**
 * Simulated binding that also accepts the extended click and set forms.
 *
 * Extended calls are logged under the operation name with an {@code _extended}
 * suffix and the options as detail. Set option {@code append=true} appends to the
 * current value instead of replacing it.
 */
@SupportsExtended({Operation.CLICK, Operation.RIGHT_CLICK, Operation.DOUBLE_CLICK, Operation.SET})
public class ExtendedSimulatedNodeBinding extends SimulatedNodeBinding {

    ExtendedSimulatedNodeBinding(SimulatedDriver driver, SimulatedNode node) {
        super(driver, node);
    }

    @Override
    public void set(String value, Map<String, Object> options) {
        driver.record("set_extended", node, value + " " + options);
        if (Boolean.TRUE.equals(options.get("append")) && node.getValue() != null) {
            applyValue(node.getValue() + value);
        } else {
            applyValue(value);
        }
    }

    @Override
    public void click(ClickOptions options) {
        driver.record("click_extended", node, options.toString());
        activate();
    }

    @Override
    public void rightClick(ClickOptions options) {
        driver.record("right_click_extended", node, options.toString());
    }

    @Override
    public void doubleClick(ClickOptions options) {
        driver.record("double_click_extended", node, options.toString());
    }
}
