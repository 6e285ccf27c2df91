package com.example.presence.shared.aspect;

import com.example.presence.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    @Around("@within(com.example.presence.shared.aspect.Monitored) || @annotation(com.example.presence.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // Method-level annotation overrides the one on the declaring type
        Monitored monitoredAnnotation = method.getAnnotation(Monitored.class);
        if (monitoredAnnotation == null) {
            monitoredAnnotation = joinPoint.getTarget().getClass().getAnnotation(Monitored.class);
        }
        if (monitoredAnnotation == null) {
            return joinPoint.proceed();
        }

        String operationType = monitoredAnnotation.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("presence." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("presence." + operationType + ".calls", "class", className, "method", methodName, "status", "success");

            log.trace("{}.{} ({}) completed successfully in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("presence." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("presence." + operationType + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("presence.errors", "type", operationType);

            log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
