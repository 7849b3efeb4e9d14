package com.tokenledger.aspect;

import com.tokenledger.exception.StorageUnavailableException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Turns storage-layer failures raised by service calls into
 * {@link StorageUnavailableException}.
 *
 * Ordered ahead of the transaction interceptor so that failures to open or
 * commit a transaction are translated too. Nothing is retried here.
 *
 * Translated:
 * - DataAccessResourceFailureException   (connection lost / refused)
 * - CannotCreateTransactionException     (no connection for a new transaction)
 * - PessimisticLockingFailureException   (row lock not acquired within the lock timeout)
 * - QueryTimeoutException
 * - TransientDataAccessResourceException
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StorageFailureTranslationAspect {

    private static final Logger log = LoggerFactory.getLogger(StorageFailureTranslationAspect.class);

    @Around("execution(public * com.tokenledger.service..*(..))")
    public Object translateStorageFailures(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (DataAccessResourceFailureException
                 | CannotCreateTransactionException
                 | PessimisticLockingFailureException
                 | QueryTimeoutException
                 | TransientDataAccessResourceException e) {
            String call = joinPoint.getSignature().toShortString();
            log.error("Storage unavailable in {} - {}: {}", call, e.getClass().getSimpleName(), e.getMessage());
            throw new StorageUnavailableException("Storage unavailable during " + call, e);
        }
    }
}
