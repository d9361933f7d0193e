package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.Account;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class AccountRepositoryTest {

    @Autowired
    private AccountRepository accountRepository;

    private Account newAccount(long quota) {
        return accountRepository.saveAndFlush(new Account("ext-" + UUID.randomUUID(), "Owner", quota));
    }

    @Test
    void incrementStopsAtTheQuota() {
        Account account = newAccount(1000);

        assertThat(accountRepository.incrementUsageWithinQuota(account.getId(), 600)).isEqualTo(1);
        assertThat(accountRepository.incrementUsageWithinQuota(account.getId(), 600)).isZero();
        assertThat(accountRepository.incrementUsageWithinQuota(account.getId(), 400)).isEqualTo(1);

        assertThat(accountRepository.findById(account.getId()).orElseThrow().getStorageUsedBytes()).isEqualTo(1000);
    }

    @Test
    void unlimitedQuotaAlwaysAccepts() {
        Account account = newAccount(Account.UNLIMITED_QUOTA);

        assertThat(accountRepository.incrementUsageWithinQuota(account.getId(), 1L << 40)).isEqualTo(1);
    }

    @Test
    void decrementClampsAtZero() {
        Account account = newAccount(1000);
        accountRepository.incrementUsageWithinQuota(account.getId(), 300);

        assertThat(accountRepository.decrementUsage(account.getId(), 500)).isEqualTo(1);

        assertThat(accountRepository.findById(account.getId()).orElseThrow().getStorageUsedBytes()).isZero();
    }

    @Test
    void unknownAccountUpdatesNothing() {
        assertThat(accountRepository.decrementUsage(UUID.randomUUID(), 10)).isZero();
        assertThat(accountRepository.incrementUsageWithinQuota(UUID.randomUUID(), 10)).isZero();
    }

    @Test
    void externalSubjectIsUnique() {
        accountRepository.saveAndFlush(new Account("dup-subject", "First", 100));

        assertThrows(DataIntegrityViolationException.class,
                () -> accountRepository.saveAndFlush(new Account("dup-subject", "Second", 100)));
    }
}
