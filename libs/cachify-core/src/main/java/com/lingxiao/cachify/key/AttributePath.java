package com.lingxiao.cachify.key;

import com.lingxiao.cachify.KeyResolutionException;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;

/**
 * A dotted placeholder such as {@code user.address.city}. Walking is restricted to map keys,
 * record components, no-arg public getters/accessors and public fields; anything else fails
 * with {@link KeyResolutionException}.
 */
public final class AttributePath {

    private final String expression;
    private final String root;
    private final List<String> attributes;

    private AttributePath(String expression, String root, List<String> attributes) {
        this.expression = expression;
        this.root = root;
        this.attributes = attributes;
    }

    public static AttributePath parse(String expression) {
        String[] parts = expression.split("\\.", -1);
        for (String part : parts) {
            if (!isIdentifier(part)) {
                throw new KeyResolutionException("Invalid placeholder {" + expression + "}");
            }
        }
        return new AttributePath(expression, parts[0], List.of(parts).subList(1, parts.length));
    }

    public String root() {
        return root;
    }

    public String expression() {
        return expression;
    }

    public Object resolve(ArgumentBinding binding) {
        Object current = binding.get(root);
        String walked = root;
        for (String attribute : attributes) {
            if (current == null) {
                throw new KeyResolutionException("Cannot read '" + attribute + "' of null '" + walked
                        + "' in placeholder {" + expression + "}");
            }
            current = read(current, attribute, walked);
            walked = walked + "." + attribute;
        }
        return current;
    }

    private Object read(Object target, String attribute, String walked) {
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(attribute)) {
                throw new KeyResolutionException("Map '" + walked + "' has no key '" + attribute
                        + "' in placeholder {" + expression + "}");
            }
            return map.get(attribute);
        }
        Class<?> type = target.getClass();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(attribute)) {
                    return invoke(component.getAccessor(), target, walked, attribute);
                }
            }
        }
        Method accessor = findAccessor(type, attribute);
        if (accessor != null) {
            return invoke(accessor, target, walked, attribute);
        }
        Field field = ReflectionUtils.findField(type, attribute);
        if (field != null && Modifier.isPublic(field.getModifiers()) && !Modifier.isStatic(field.getModifiers())) {
            ReflectionUtils.makeAccessible(field);
            return ReflectionUtils.getField(field, target);
        }
        throw new KeyResolutionException("Type " + type.getName() + " of '" + walked + "' has no attribute '"
                + attribute + "' in placeholder {" + expression + "}");
    }

    private Method findAccessor(Class<?> type, String attribute) {
        String capitalized = StringUtils.capitalize(attribute);
        for (String candidate : List.of("get" + capitalized, "is" + capitalized, attribute)) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(candidate)
                        && method.getParameterCount() == 0
                        && !Modifier.isStatic(method.getModifiers())
                        && method.getReturnType() != Void.TYPE
                        && method.getDeclaringClass() != Object.class) {
                    return method;
                }
            }
        }
        return null;
    }

    private Object invoke(Method accessor, Object target, String walked, String attribute) {
        try {
            ReflectionUtils.makeAccessible(accessor);
            return accessor.invoke(target);
        } catch (InvocationTargetException e) {
            throw new KeyResolutionException("Accessor for '" + walked + "." + attribute + "' failed in placeholder {"
                    + expression + "}", e.getTargetException());
        } catch (IllegalAccessException e) {
            throw new KeyResolutionException("Accessor for '" + walked + "." + attribute + "' is not accessible", e);
        }
    }

    private static boolean isIdentifier(String part) {
        if (part.isEmpty() || !Character.isJavaIdentifierStart(part.charAt(0))) {
            return false;
        }
        for (int i = 1; i < part.length(); i++) {
            if (!Character.isJavaIdentifierPart(part.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return expression;
    }
}
