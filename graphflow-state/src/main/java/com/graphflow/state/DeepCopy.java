package com.graphflow.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural deep copy of state values. Maps, lists, sets and arrays are copied recursively;
 * any other value (strings, numbers, user objects) is shared by reference and treated as immutable.
 */
public final class DeepCopy {

    private DeepCopy() {
    }

    /** Deep-copies a values map, preserving key order. Null → empty map. */
    public static Map<String, Object> copyMap(Map<String, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (source == null) return out;
        for (Map.Entry<String, ?> e : source.entrySet()) {
            out.put(e.getKey(), copyValue(e.getValue()));
        }
        return out;
    }

    public static Object copyValue(Object value) {
        if (value == null) return null;
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(e.getKey(), copyValue(e.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object o : list) out.add(copyValue(o));
            return out;
        }
        if (value instanceof Set<?> set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object o : set) out.add(copyValue(o));
            return out;
        }
        if (value instanceof Collection<?> coll) {
            List<Object> out = new ArrayList<>(coll.size());
            for (Object o : coll) out.add(copyValue(o));
            return out;
        }
        if (value instanceof Object[] arr) {
            // keeps the runtime component type, so a String[] stays a String[]
            Object[] out = arr.clone();
            Class<?> component = arr.getClass().getComponentType();
            for (int i = 0; i < arr.length; i++) {
                Object copied = copyValue(arr[i]);
                out[i] = copied == null || component.isInstance(copied) ? copied : arr[i];
            }
            return out;
        }
        if (value instanceof int[] a) return a.clone();
        if (value instanceof long[] a) return a.clone();
        if (value instanceof double[] a) return a.clone();
        if (value instanceof byte[] a) return a.clone();
        if (value instanceof boolean[] a) return a.clone();
        if (value instanceof char[] a) return a.clone();
        if (value instanceof short[] a) return a.clone();
        if (value instanceof float[] a) return a.clone();
        return value;
    }
}
