package com.lingxiao.cachify.aop;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

@Aspect
public class CachedAspect {

    private final CachedMethodRegistry registry;

    public CachedAspect(CachedMethodRegistry registry) {
        this.registry = registry;
    }

    @Around("@annotation(com.lingxiao.cachify.Cached)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        CachedMethodHandle handle = registry.register(MethodMetadata.resolve(pjp));
        return handle.execution().call(pjp.getArgs(), args -> pjp.proceed());
    }
}
