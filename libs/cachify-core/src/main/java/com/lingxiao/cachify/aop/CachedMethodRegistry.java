package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.Cached;
import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.execution.CacheSettings;
import com.lingxiao.cachify.execution.CallMode;
import com.lingxiao.cachify.key.KeyTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One decoration per {@code @Cached} method, created the first time the method is seen and
 * reachable by name so callers can reset entries after writes.
 */
public class CachedMethodRegistry {

    private static final Logger log = LoggerFactory.getLogger(CachedMethodRegistry.class);

    private final Cachify cachify;
    private final DurationParser durationParser;
    private final Map<Method, CachedMethodHandle> byMethod = new ConcurrentHashMap<>();
    private final Map<String, CachedMethodHandle> byName = new ConcurrentHashMap<>();

    public CachedMethodRegistry(Cachify cachify, DurationParser durationParser) {
        this.cachify = cachify;
        this.durationParser = durationParser;
    }

    public CachedMethodHandle register(Method method) {
        return byMethod.computeIfAbsent(method, this::decorate);
    }

    public CachedMethodHandle handle(String name) {
        return find(name).orElseThrow(() ->
                new IllegalArgumentException("No @Cached method named '" + name + "', known=" + byName.keySet()));
    }

    public Optional<CachedMethodHandle> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Collection<CachedMethodHandle> handles() {
        return List.copyOf(byName.values());
    }

    private CachedMethodHandle decorate(Method method) {
        Cached anno = AnnotatedElementUtils.findMergedAnnotation(method, Cached.class);
        String methodName = MethodMetadata.describe(method);
        if (anno == null) {
            throw new IllegalStateException("Method is not annotated with @Cached, method=" + methodName);
        }
        if (method.getReturnType() == Void.TYPE) {
            throw new IllegalStateException("@Cached requires a non-void method, method=" + methodName);
        }
        CallMode mode = CallMode.of(method);
        String[] parameterNames = MethodMetadata.parameterNames(method);
        KeyTemplate template = KeyTemplate.parse(anno.key()).validateAgainst(List.of(parameterNames));
        String name = StringUtils.hasText(anno.name())
                ? anno.name()
                : method.getDeclaringClass().getSimpleName() + "#" + method.getName();

        CacheSettings settings = new CacheSettings(
                name,
                template,
                parameterNames,
                durationParser.parse(anno.ttl()),
                MethodMetadata.valueType(method, mode),
                null,
                cachify.degradeOnStoreError());
        CachedMethodHandle handle = new CachedMethodHandle(name, method, mode.cacheExecution(cachify, settings));

        CachedMethodHandle existing = byName.putIfAbsent(name, handle);
        if (existing != null && !existing.method().equals(method)) {
            throw new IllegalStateException("Duplicate @Cached name '" + name + "' on " + methodName
                    + " and " + MethodMetadata.describe(existing.method()) + ", set name() explicitly");
        }
        log.debug("Registered @Cached name={} key={} ttl={} mode={}", name, template, settings.ttl(), mode);
        return existing != null ? existing : handle;
    }
}
