package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.execution.CallMode;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.BridgeMethodResolver;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.concurrent.CompletionStage;

final class MethodMetadata {

    private static final ParameterNameDiscoverer PARAMETER_NAMES = new DefaultParameterNameDiscoverer();

    private MethodMetadata() {
    }

    static Method resolve(ProceedingJoinPoint pjp) {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        Object target = pjp.getTarget();
        if (target != null) {
            method = ClassUtils.getMostSpecificMethod(method, AopUtils.getTargetClass(target));
        }
        return BridgeMethodResolver.findBridgedMethod(method);
    }

    /**
     * Empty when the class was compiled without {@code -parameters}; only positional
     * placeholders work then.
     */
    static String[] parameterNames(Method method) {
        String[] names = PARAMETER_NAMES.getParameterNames(method);
        return names != null ? names : new String[0];
    }

    /**
     * The type cached values decode into: the declared return type, or the stage's element
     * type for non-blocking methods.
     */
    static Type valueType(Method method, CallMode mode) {
        ResolvableType returnType = ResolvableType.forMethodReturnType(method);
        if (mode == CallMode.NON_BLOCKING) {
            ResolvableType element = returnType.as(CompletionStage.class).getGeneric(0);
            return element.resolve() != null ? element.getType() : Object.class;
        }
        return returnType.getType();
    }

    static String describe(Method method) {
        return method.getDeclaringClass().getName() + "#" + method.getName();
    }
}
