package com.coopledger.ledger;

import com.coopledger.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the organization chart of accounts: bootstrap and lookup.
 */
@ExtendWith(MockitoExtension.class)
class ChartOfAccountsTest {

    @Mock
    private LedgerAccountRepository accountRepository;

    @Mock
    private JournalEntryRepository entryRepository;

    @Mock
    private JournalLineRepository lineRepository;

    @Mock
    private PostingLockRepository postingLockRepository;

    @Mock
    private SubaccountRegistry subaccountRegistry;

    @Mock
    private Clock clock;

    @InjectMocks
    private LedgerService ledgerService;

    @Test
    void testMissingOrganizationAccountIsConfigurationError() {
        when(accountRepository.findByCode("LOANS_RECEIVABLE")).thenReturn(Optional.empty());

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> ledgerService.requireOrgAccount(OrgAccount.LOANS_RECEIVABLE));

        assertTrue(e.getMessage().contains("LOANS_RECEIVABLE"));
    }

    @Test
    void testExistingOrganizationAccountIsReturned() {
        LedgerAccount cash = LedgerAccount.forOrganization(OrgAccount.BANK_CASH);
        when(accountRepository.findByCode("BANK_CASH")).thenReturn(Optional.of(cash));

        assertSame(cash, ledgerService.requireOrgAccount(OrgAccount.BANK_CASH));
    }

    @Test
    void testInitializerCreatesOnlyMissingAccounts() {
        // Given only cash exists
        when(accountRepository.existsByCode(anyString()))
            .thenAnswer(invocation -> "BANK_CASH".equals(invocation.getArgument(0)));
        ChartOfAccountsInitializer initializer = new ChartOfAccountsInitializer(accountRepository);

        // When
        initializer.run(null);

        // Then
        ArgumentCaptor<LedgerAccount> saved = ArgumentCaptor.forClass(LedgerAccount.class);
        verify(accountRepository, times(OrgAccount.values().length - 1)).save(saved.capture());
        List<LedgerAccount> created = saved.getAllValues();
        assertTrue(created.stream().noneMatch(account -> "BANK_CASH".equals(account.getCode())));
        assertTrue(created.stream().anyMatch(account ->
            "PENALTY_INCOME".equals(account.getCode()) && account.getAccountType() == AccountType.INCOME));
    }

    @Test
    void testInitializerLeavesCompleteChartAlone() {
        when(accountRepository.existsByCode(anyString())).thenReturn(true);

        new ChartOfAccountsInitializer(accountRepository).run(null);

        verify(accountRepository, never()).save(any());
    }
}
