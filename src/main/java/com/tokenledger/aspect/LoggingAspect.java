package com.tokenledger.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Call logging for services, controllers and repositories.
 *
 * - Services: entry with named parameters, exit with result and timing (INFO)
 * - Controllers: one line per request and response (INFO)
 * - Repositories: DEBUG only, plus a warning for slow queries
 *
 * A service call that was not nested in another one gets an executionId in
 * the MDC so the processor's own log lines can be grouped.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    static final long SLOW_SERVICE_MS = 1000;
    static final long SLOW_QUERY_MS = 500;
    private static final int MAX_VALUE_LENGTH = 120;

    @Around("execution(public * com.tokenledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        boolean outermost = MDC.get("executionId") == null;
        if (outermost) {
            MDC.put("executionId", generateExecutionId());
        }

        log.info("SERVICE CALL: {}({})", call, describeArguments(signature, joinPoint.getArgs()));
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("SERVICE DONE: {} -> {} in {} ms", call, formatParameter(result), executionTime);
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("SLOW OPERATION: {} took {} ms", call, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.error("SERVICE FAILED: {} after {} ms - {}: {}",
                    call, System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } finally {
            if (outermost) {
                MDC.remove("executionId");
            }
        }
    }

    @Around("execution(public * com.tokenledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        log.info("HTTP REQUEST: {}", call);
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            log.info("HTTP RESPONSE: {} completed in {} ms", call, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            // Rejections are expected outcomes, not errors
            log.info("HTTP ERROR: {} failed after {} ms - {}: {}",
                    call, System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.tokenledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        if (log.isDebugEnabled()) {
            String params = joinPoint.getArgs() != null ? Arrays.stream(joinPoint.getArgs())
                    .map(this::formatParameter)
                    .collect(Collectors.joining(", ")) : "";
            log.debug("DB CALL: {}({})", call, params);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("SLOW QUERY: {} took {} ms", call, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.error("DB ERROR: {} - {}: {}", call, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String describeArguments(MethodSignature signature, Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        String[] names = signature.getParameterNames();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String name = (names != null && i < names.length) ? names[i] : "arg" + i;
            sb.append(name).append('=').append(formatParameter(args[i]));
        }
        return sb.toString();
    }

    /**
     * Format a value for logging: mask secrets, truncate long values.
     */
    String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }
        String value = param.toString();
        String lower = value.toLowerCase();
        if (lower.contains("bearer ") || lower.contains("secret") || lower.contains("password")) {
            return "[REDACTED]";
        }
        if (value.length() > MAX_VALUE_LENGTH) {
            return value.substring(0, MAX_VALUE_LENGTH - 3) + "...";
        }
        return value;
    }

    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}
