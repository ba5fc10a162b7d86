package com.glassbox.calc.namespace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.timeline.Timeline;

/**
 * Immutable map from reference key to a typed period array.
 * <p>
 * Keys resolve to integer handles once; evaluation then works with the handle.
 * Every array has exactly {@link Timeline#periods()} entries.
 */
public final class ReferenceNamespace implements ValueSource {
    private final Timeline timeline;
    private final String[] keys;
    private final double[][] arrays;
    private final SeriesType[] types;
    private final Map<String, Integer> handles;
    private final List<GroupAddress> groups;

    private ReferenceNamespace(Timeline timeline, List<String> keys, List<double[]> arrays,
            List<SeriesType> types, Map<String, Integer> handles, List<GroupAddress> groups) {
        this.timeline = timeline;
        this.keys = keys.toArray(new String[0]);
        this.arrays = arrays.toArray(new double[0][]);
        this.types = types.toArray(new SeriesType[0]);
        this.handles = Collections.unmodifiableMap(handles);
        this.groups = List.copyOf(groups);
    }

    public static Builder builder(Timeline timeline) {
        return new Builder(timeline);
    }

    public Timeline timeline() {
        return timeline;
    }

    /** Handle of {@code key}, or -1. */
    public int handle(String key) {
        Integer h = handles.get(key);
        return h == null ? -1 : h;
    }

    public String key(int handle) {
        return keys[handle];
    }

    /** Shared array behind a handle. Callers must not modify it. */
    public double[] array(int handle) {
        return arrays[handle];
    }

    public SeriesType type(int handle) {
        return types[handle];
    }

    @Override
    public double[] lookup(String key) {
        Integer h = handles.get(key);
        return h == null ? null : arrays[h];
    }

    /** Copy of the values for {@code key}, or null when undefined. */
    public double[] values(String key) {
        double[] v = lookup(key);
        return v == null ? null : v.clone();
    }

    public SeriesType type(String key) {
        Integer h = handles.get(key);
        return h == null ? null : types[h];
    }

    public boolean contains(String key) {
        return handles.containsKey(key);
    }

    public int size() {
        return keys.length;
    }

    /** Keys in insertion order. */
    public List<String> keys() {
        return Collections.unmodifiableList(Arrays.asList(keys));
    }

    public List<GroupAddress> groups() {
        return groups;
    }

    @Override
    public String toString() {
        return "ReferenceNamespace[" + keys.length + " refs, " + timeline + "]";
    }

    public static final class Builder {
        private final Timeline timeline;
        private final List<String> keys = new ArrayList<>();
        private final List<double[]> arrays = new ArrayList<>();
        private final List<SeriesType> types = new ArrayList<>();
        private final Map<String, Integer> handles = new HashMap<>();
        private final List<GroupAddress> groups = new ArrayList<>();

        private Builder(Timeline timeline) {
            if (timeline == null)
                throw new IllegalArgumentException("timeline is required");
            this.timeline = timeline;
        }

        public Timeline timeline() {
            return timeline;
        }

        public Builder put(String key, double[] values, SeriesType type) {
            if (!Ref.isReference(key))
                throw new IllegalArgumentException("Not a reference key: " + key);
            if (values.length != timeline.periods())
                throw new IllegalArgumentException("Array for " + key + " has " + values.length
                        + " periods, timeline has " + timeline.periods());
            if (handles.containsKey(key))
                throw new IllegalArgumentException("Duplicate reference: " + key);
            handles.put(key, keys.size());
            keys.add(key);
            arrays.add(values);
            types.add(type == null ? SeriesType.FLOW : type);
            return this;
        }

        public boolean contains(String key) {
            return handles.containsKey(key);
        }

        public Builder group(GroupAddress address) {
            groups.add(address);
            return this;
        }

        public ReferenceNamespace build() {
            return new ReferenceNamespace(timeline, keys, arrays, types, handles, groups);
        }
    }
}
