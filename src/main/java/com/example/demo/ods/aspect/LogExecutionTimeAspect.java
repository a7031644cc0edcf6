package com.example.demo.ods.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

@Slf4j
@Aspect
@Component
public class LogExecutionTimeAspect {

    @Around("@annotation(logExecutionTime)")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint, LogExecutionTime logExecutionTime) throws Throwable {
        String label = logExecutionTime.value().isEmpty()
                ? joinPoint.getSignature().toShortString()
                : logExecutionTime.value();
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("{} completed in {} ms", label, System.currentTimeMillis() - startTime);
            return result;
        } catch (Throwable e) {
            log.warn("{} failed after {} ms: {}", label, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }
}
