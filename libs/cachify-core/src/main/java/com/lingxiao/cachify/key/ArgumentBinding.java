package com.lingxiao.cachify.key;

import com.lingxiao.cachify.KeyResolutionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Call arguments addressed by parameter name, plus the positional aliases {@code a0}/{@code p0}.
 */
public final class ArgumentBinding {

    private static final Pattern POSITIONAL = Pattern.compile("[ap]\\d+");

    private final Map<String, Object> values;

    private ArgumentBinding(Map<String, Object> values) {
        this.values = values;
    }

    public static ArgumentBinding of(String[] parameterNames, Object[] args) {
        Object[] actual = args == null ? new Object[0] : args;
        Map<String, Object> values = new LinkedHashMap<>();
        if (parameterNames != null) {
            int bound = Math.min(parameterNames.length, actual.length);
            for (int i = 0; i < bound; i++) {
                values.put(parameterNames[i], actual[i]);
            }
        }
        for (int i = 0; i < actual.length; i++) {
            values.putIfAbsent("a" + i, actual[i]);
            values.putIfAbsent("p" + i, actual[i]);
        }
        return new ArgumentBinding(values);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new KeyResolutionException("No argument bound to placeholder '" + name + "', bound=" + values.keySet());
        }
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    static boolean isPositionalAlias(String name) {
        return POSITIONAL.matcher(name).matches();
    }
}
