package com.tokenledger.aspect;

import com.tokenledger.config.LedgerPolicyProperties;
import com.tokenledger.exception.StorageUnavailableException;
import com.tokenledger.repository.TokenAccountRepository;
import com.tokenledger.repository.TokenTransactionRepository;
import com.tokenledger.service.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs the aspect around a real LedgerService through a programmatic
 * AspectJ proxy; repositories are mocks, no Spring context.
 */
@ExtendWith(MockitoExtension.class)
class StorageFailureTranslationAspectTest {

    @Mock TokenTransactionRepository transactionRepository;
    @Mock TokenAccountRepository     accountRepository;

    private LedgerService proxy;

    @BeforeEach
    void setUp() {
        LedgerService target = new LedgerService(
                transactionRepository, accountRepository, LedgerPolicyProperties.defaults(), Clock.systemUTC());
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new StorageFailureTranslationAspect());
        proxy = factory.getProxy();
    }

    @Test @DisplayName("normal call passes through")
    void passThrough() {
        when(accountRepository.findByUserId("u1")).thenReturn(Optional.empty());
        assertThat(proxy.findByReference("u1", "REF-1")).isEmpty();
    }

    @Test @DisplayName("connection failure → StorageUnavailableException with cause")
    void connectionFailure() {
        when(accountRepository.findByUserId("u1"))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> proxy.findByReference("u1", "REF-1"))
            .isInstanceOf(StorageUnavailableException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test @DisplayName("transaction cannot be opened → StorageUnavailableException")
    void cannotCreateTransaction() {
        when(accountRepository.findByUserId("u1"))
            .thenThrow(new CannotCreateTransactionException("pool exhausted"));

        assertThatThrownBy(() -> proxy.reconcile("u1"))
            .isInstanceOf(StorageUnavailableException.class);
    }

    @Test @DisplayName("lock timeout → StorageUnavailableException")
    void lockTimeout() {
        when(accountRepository.findByUserId("u1"))
            .thenThrow(new CannotAcquireLockException("lock wait timeout"));

        assertThatThrownBy(() -> proxy.reconcile("u1"))
            .isInstanceOf(StorageUnavailableException.class);
    }

    @Test @DisplayName("integrity violation is not a storage outage")
    void integrityViolationUntouched() {
        when(accountRepository.findByUserId("u1"))
            .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> proxy.reconcile("u1"))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test @DisplayName("business exceptions are not translated")
    void businessExceptionUntouched() {
        assertThatThrownBy(() -> proxy.recent("u1", 0))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(transactionRepository);
    }
}
