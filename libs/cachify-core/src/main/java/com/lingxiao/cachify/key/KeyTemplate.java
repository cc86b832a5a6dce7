package com.lingxiao.cachify.key;

import com.lingxiao.cachify.KeyResolutionException;
import org.springframework.util.ObjectUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable key pattern such as {@code read_user-{userId}} or {@code order-{cmd.orderId}}.
 * Parsed once, resolved on every call. Doubled braces render a literal brace. Arrays render
 * by content, {@code {1, 2}}, so equal arguments always give the same key.
 * Resolution is pure: no I/O, and equal arguments always render the same key.
 */
public final class KeyTemplate {

    private final String source;
    private final List<Segment> segments;

    private KeyTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = segments;
    }

    public static KeyTemplate parse(String source) {
        if (source == null || source.isBlank()) {
            throw new KeyResolutionException("Key template is empty");
        }
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '{') {
                if (i + 1 < n && source.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = source.indexOf('}', i + 1);
                if (close < 0) {
                    throw new KeyResolutionException("Unclosed placeholder in key template: " + source);
                }
                String expression = source.substring(i + 1, close).trim();
                if (expression.isEmpty()) {
                    throw new KeyResolutionException("Empty placeholder in key template: " + source);
                }
                if (literal.length() > 0) {
                    segments.add(new Segment(literal.toString(), null));
                    literal.setLength(0);
                }
                segments.add(new Segment(null, AttributePath.parse(expression)));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < n && source.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new KeyResolutionException("Unmatched '}' in key template: " + source);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(new Segment(literal.toString(), null));
        }
        return new KeyTemplate(source, List.copyOf(segments));
    }

    /**
     * Root names referenced by placeholders, in template order.
     */
    public Set<String> placeholderRoots() {
        Set<String> roots = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment.path() != null) {
                roots.add(segment.path().root());
            }
        }
        return roots;
    }

    /**
     * Fails fast when a placeholder names neither a parameter nor a positional alias.
     */
    public KeyTemplate validateAgainst(Collection<String> parameterNames) {
        for (String root : placeholderRoots()) {
            if (!parameterNames.contains(root) && !ArgumentBinding.isPositionalAlias(root)) {
                throw new KeyResolutionException("Placeholder {" + root + "} in key template '" + source
                        + "' matches no parameter of " + parameterNames);
            }
        }
        return this;
    }

    public String resolve(ArgumentBinding binding) {
        StringBuilder key = new StringBuilder(source.length() + 16);
        for (Segment segment : segments) {
            if (segment.path() == null) {
                key.append(segment.literal());
            } else {
                key.append(ObjectUtils.nullSafeToString(segment.path().resolve(binding)));
            }
        }
        return key.toString();
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    private record Segment(String literal, AttributePath path) {
    }
}
