package com.tokenledger.service;

import com.tokenledger.domain.AccountDelta;
import com.tokenledger.domain.TokenAccount;
import com.tokenledger.domain.TransactionType;
import com.tokenledger.exception.AccountNotFoundException;
import com.tokenledger.repository.TokenAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    @Mock TokenAccountRepository accountRepository;
    @Mock AccountProvisioner     provisioner;

    private AccountService service;

    @BeforeEach
    void setUp() {
        service = new AccountService(accountRepository, provisioner, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private TokenAccount account(String userId) {
        return new TokenAccount(userId, new BigDecimal("1000"), NOW);
    }

    @Test @DisplayName("existing account is returned without provisioning")
    void existing() {
        var existing = account("u1");
        when(accountRepository.findByUserId("u1")).thenReturn(Optional.of(existing));

        assertThat(service.getAccount("u1")).isSameAs(existing);
        verifyNoInteractions(provisioner);
    }

    @Test @DisplayName("missing account is created with the starting grant")
    void createsOnFirstAccess() {
        var created = account("u1");
        when(accountRepository.findByUserId("u1")).thenReturn(Optional.empty());
        when(provisioner.create("u1")).thenReturn(created);

        var result = service.getAccount("u1");

        assertThat(result.getBalance()).isEqualByComparingTo("1000");
        assertThat(result.getTotalEarned()).isEqualByComparingTo("1000");
    }

    @Test @DisplayName("lost creation race → winner's row is returned")
    void creationRace() {
        var winner = account("u1");
        when(accountRepository.findByUserId("u1"))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(winner));
        when(provisioner.create("u1")).thenThrow(new DataIntegrityViolationException("uk_user_id"));

        assertThat(service.getAccount("u1")).isSameAs(winner);
    }

    @Test @DisplayName("creation failed and no row readable → AccountNotFoundException")
    void creationFailedNoRow() {
        when(accountRepository.findByUserId("u1")).thenReturn(Optional.empty());
        when(provisioner.create("u1")).thenThrow(new DataIntegrityViolationException("uk_user_id"));

        assertThatThrownBy(() -> service.getAccount("u1"))
            .isInstanceOf(AccountNotFoundException.class)
            .isInstanceOf(NoSuchElementException.class)
            .hasMessageContaining("u1");
    }

    @Test @DisplayName("blank user id → IllegalArgumentException")
    void blankUser() {
        assertThatThrownBy(() -> service.getAccount(""))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(accountRepository, provisioner);
    }

    @Test @DisplayName("lockAccount returns the locked row")
    void lockExisting() {
        var existing = account("u1");
        when(accountRepository.findByUserIdForUpdate("u1")).thenReturn(Optional.of(existing));

        assertThat(service.lockAccount("u1")).isSameAs(existing);
    }

    @Test @DisplayName("lockAccount never provisions: missing account → AccountNotFoundException")
    void lockDoesNotProvision() {
        when(accountRepository.findByUserIdForUpdate("u1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.lockAccount("u1"))
            .isInstanceOf(AccountNotFoundException.class);
        verifyNoInteractions(provisioner);
    }

    @Test @DisplayName("apply changes the locked account and saves it")
    void applySaves() {
        var locked = account("u1");
        when(accountRepository.findByUserIdForUpdate("u1")).thenReturn(Optional.of(locked));
        when(accountRepository.save(any(TokenAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        var result = service.apply("u1", AccountDelta.of(TransactionType.STAKE, new BigDecimal("300")));

        assertThat(result.getBalance()).isEqualByComparingTo("700");
        assertThat(result.getStakedAmount()).isEqualByComparingTo("300");
        assertThat(result.getUpdatedAt()).isEqualTo(NOW);
        verify(accountRepository).save(locked);
    }

    @Test @DisplayName("apply that would overdraw → IllegalStateException, nothing saved")
    void applyOverdraw() {
        when(accountRepository.findByUserIdForUpdate("u1")).thenReturn(Optional.of(account("u1")));

        assertThatThrownBy(() -> service.apply("u1", AccountDelta.of(TransactionType.SPEND, new BigDecimal("1001"))))
            .isInstanceOf(IllegalStateException.class);
        verify(accountRepository, never()).save(any());
    }
}
