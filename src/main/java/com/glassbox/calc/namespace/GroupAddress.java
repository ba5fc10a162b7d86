package com.glassbox.calc.namespace;

import java.util.Map;

/**
 * Where an input group landed in the namespace.
 *
 * @param groupId      group id from the recipe
 * @param mode         addressing mode that chose the prefix
 * @param authoringRef reference the recipe was authored with (may be null)
 * @param ref          positional reference in the namespace
 * @param inputRefs    recipe input id to its positional per-input reference
 */
public record GroupAddress(int groupId, InputMode mode, String authoringRef, String ref,
        Map<Integer, String> inputRefs) {
}
