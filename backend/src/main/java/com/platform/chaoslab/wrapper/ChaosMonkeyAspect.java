package com.platform.chaoslab.wrapper;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultSpec;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies {@link ChaosMonkey} and {@link ResilienceTest} to bean methods.
 *
 * The {@link FaultWrapper} for a method is built on its first call and reused
 * afterwards. A method carrying both annotations gets the monkey fault first.
 */
@Slf4j
@Aspect
@Component
public class ChaosMonkeyAspect {

    private final FaultInjector injector;
    private final Map<Method, FaultWrapper> wrappers = new ConcurrentHashMap<>();

    public ChaosMonkeyAspect(FaultInjector injector) {
        this.injector = injector;
    }

    @Around("@annotation(com.platform.chaoslab.wrapper.ChaosMonkey) "
        + "|| @annotation(com.platform.chaoslab.wrapper.ResilienceTest)")
    public Object injectFaults(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = AopUtils.getMostSpecificMethod(signature.getMethod(),
            joinPoint.getTarget() != null ? joinPoint.getTarget().getClass() : signature.getDeclaringType());

        wrappers.computeIfAbsent(method, this::buildWrapper).injectAll();
        return joinPoint.proceed();
    }

    private FaultWrapper buildWrapper(Method method) {
        List<FaultSpec> specs = new ArrayList<>();

        ChaosMonkey monkey = AnnotatedElementUtils.findMergedAnnotation(method, ChaosMonkey.class);
        if (monkey != null) {
            specs.add(FaultSpec.builder()
                .faultType(monkey.faultType())
                .probability(monkey.probability())
                .durationMs(monkey.durationMs())
                .errorCode(monkey.errorCode())
                .errorMessage(monkey.errorMessage())
                .affectedTargets(Arrays.asList(monkey.targets()))
                .build());
        }

        ResilienceTest resilienceTest = AnnotatedElementUtils.findMergedAnnotation(method, ResilienceTest.class);
        if (resilienceTest != null) {
            for (Fault fault : resilienceTest.value()) {
                specs.add(FaultSpec.builder()
                    .faultType(fault.type())
                    .probability(fault.probability())
                    .durationMs(fault.durationMs())
                    .errorCode(fault.errorCode())
                    .errorMessage(fault.errorMessage().isEmpty() ? null : fault.errorMessage())
                    .build());
            }
        }

        log.debug("Bound {} fault(s) to {}.{}", specs.size(),
            method.getDeclaringClass().getSimpleName(), method.getName());
        return FaultWrapper.of(specs, injector);
    }

    int cachedWrapperCount() {
        return wrappers.size();
    }
}
