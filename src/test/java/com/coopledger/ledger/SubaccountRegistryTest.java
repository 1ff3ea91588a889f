package com.coopledger.ledger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for memoizing sub-account lookups per transaction.
 */
class SubaccountRegistryTest {

    private final SubaccountRegistry registry = new SubaccountRegistry();

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.getSynchronizations()
                .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testLookupIsMemoizedWithinTransaction() {
        TransactionSynchronizationManager.initSynchronization();
        AtomicInteger loads = new AtomicInteger();
        Supplier<LedgerAccount> loader = () -> {
            loads.incrementAndGet();
            return new LedgerAccount();
        };

        LedgerAccount first = registry.resolve("member-1", FundKind.SAVINGS, loader);
        LedgerAccount second = registry.resolve("member-1", FundKind.SAVINGS, loader);
        registry.resolve("member-1", FundKind.SOCIAL_FUND, loader);

        assertSame(first, second);
        assertEquals(2, loads.get());
    }

    @Test
    void testCacheIsDroppedWhenTransactionCompletes() {
        TransactionSynchronizationManager.initSynchronization();
        LedgerAccount first = registry.resolve("member-1", FundKind.SAVINGS, LedgerAccount::new);

        TransactionSynchronizationManager.getSynchronizations()
            .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
        TransactionSynchronizationManager.clearSynchronization();
        TransactionSynchronizationManager.initSynchronization();

        assertNotSame(first, registry.resolve("member-1", FundKind.SAVINGS, LedgerAccount::new));
    }

    @Test
    void testEveryLookupLoadsOutsideTransaction() {
        AtomicInteger loads = new AtomicInteger();

        registry.resolve("member-1", FundKind.SAVINGS, () -> {
            loads.incrementAndGet();
            return new LedgerAccount();
        });
        registry.resolve("member-1", FundKind.SAVINGS, () -> {
            loads.incrementAndGet();
            return new LedgerAccount();
        });

        assertEquals(2, loads.get());
    }
}
