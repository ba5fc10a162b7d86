package com.glassbox.calc.module;

import java.util.List;
import java.util.Map;

/**
 * Produces a template's outputs. Most templates ignore the bindings; some pick
 * between output sets by a mode input.
 */
@FunctionalInterface
public interface OutputFactory {

    /**
     * @param bindings module input bindings, defaults already applied
     * @return outputs in publication order
     */
    List<TemplateOutput> create(Map<String, String> bindings);
}
