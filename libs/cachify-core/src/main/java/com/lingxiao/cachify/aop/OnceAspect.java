package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.ContendedAction;
import com.lingxiao.cachify.Once;
import com.lingxiao.cachify.execution.CallMode;
import com.lingxiao.cachify.execution.ContentionPolicy;
import com.lingxiao.cachify.execution.OnceExecution;
import com.lingxiao.cachify.execution.OnceSettings;
import com.lingxiao.cachify.key.KeyTemplate;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Aspect
public class OnceAspect {

    private static final Logger log = LoggerFactory.getLogger(OnceAspect.class);

    private final Cachify cachify;
    private final DurationParser durationParser;
    private final SpelFallbackResolver fallbackResolver;
    private final Map<Method, OnceExecution> executions = new ConcurrentHashMap<>();

    public OnceAspect(Cachify cachify,
                      DurationParser durationParser,
                      SpelFallbackResolver fallbackResolver) {
        this.cachify = cachify;
        this.durationParser = durationParser;
        this.fallbackResolver = fallbackResolver;
    }

    @Around("@annotation(com.lingxiao.cachify.Once)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        OnceExecution execution = executions.computeIfAbsent(MethodMetadata.resolve(pjp), this::decorate);
        return execution.call(pjp.getArgs(), args -> pjp.proceed());
    }

    private OnceExecution decorate(Method method) {
        Once anno = AnnotatedElementUtils.findMergedAnnotation(method, Once.class);
        String methodName = MethodMetadata.describe(method);
        if (anno == null) {
            throw new IllegalStateException("Method is not annotated with @Once, method=" + methodName);
        }
        CallMode mode = CallMode.of(method);
        boolean hasFallback = StringUtils.hasText(anno.fallback());
        if (anno.onContended() == ContendedAction.THROW && hasFallback) {
            throw new IllegalStateException("@Once fallback requires onContended=RETURN_FALLBACK, method=" + methodName);
        }
        if (anno.onContended() == ContendedAction.RETURN_FALLBACK && !hasFallback
                && mode == CallMode.BLOCKING && method.getReturnType().isPrimitive()
                && method.getReturnType() != Void.TYPE) {
            throw new IllegalStateException("@Once on a primitive return type requires a fallback expression or onContended=THROW, method=" + methodName);
        }

        String[] parameterNames = MethodMetadata.parameterNames(method);
        KeyTemplate template = KeyTemplate.parse(anno.key()).validateAgainst(List.of(parameterNames));
        Duration ttl = durationParser.parse(anno.ttl());
        OnceSettings settings = new OnceSettings(
                method.getDeclaringClass().getSimpleName() + "#" + method.getName(),
                template,
                parameterNames,
                ttl != null ? ttl : cachify.defaultLockTtl(),
                contentionPolicy(method, anno),
                anno.onStoreUnavailable());
        log.debug("Registered @Once method={} key={} ttl={} onContended={} mode={}",
                methodName, template, settings.ttl(), anno.onContended(), mode);
        return mode.onceExecution(cachify, settings);
    }

    private ContentionPolicy contentionPolicy(Method method, Once anno) {
        if (anno.onContended() == ContendedAction.THROW) {
            return ContentionPolicy.throwing();
        }
        String expr = anno.fallback();
        if (!StringUtils.hasText(expr)) {
            return ContentionPolicy.returning(null);
        }
        fallbackResolver.parse(method, expr);
        return (key, args) -> fallbackResolver.evaluate(method, args, expr);
    }
}
