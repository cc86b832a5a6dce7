package com.lingxiao.cachify.aop;

import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.ConcurrentReferenceHashMap;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Evaluates {@code @Once(fallback = ...)} expressions against the call arguments.
 */
public class SpelFallbackResolver {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentReferenceHashMap<>();
    private final ParameterNameDiscoverer paramDiscoverer = new DefaultParameterNameDiscoverer();

    public Expression parse(Method method, String expr) {
        try {
            return cache.computeIfAbsent(method.toGenericString() + "#" + expr, k -> parser.parseExpression(expr));
        } catch (Exception e) {
            throw new IllegalStateException("Invalid @Once fallback expression: " + expr + ", method=" + method, e);
        }
    }

    public Object evaluate(Method method, Object[] args, String expr) {
        Expression expression = parse(method, expr);
        try {
            StandardEvaluationContext context = new MethodBasedEvaluationContext(null, method, args, paramDiscoverer);
            for (int i = 0; i < args.length; i++) {
                context.setVariable("a" + i, args[i]);
                context.setVariable("p" + i, args[i]);
            }
            return expression.getValue(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to evaluate @Once fallback expression: " + expr, e);
        }
    }
}
