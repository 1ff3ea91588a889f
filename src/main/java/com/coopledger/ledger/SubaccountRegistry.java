package com.coopledger.ledger;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Memoizes member sub-account lookups for the lifetime of the current transaction,
 * so that one posting that touches the same (member, fund) twice resolves a single account.
 * Outside a transaction every lookup goes straight to the supplier.
 */
@Component
public class SubaccountRegistry {

    private static final Object RESOURCE_KEY = new Object();

    public LedgerAccount resolve(String memberId, FundKind fundKind, Supplier<LedgerAccount> loader) {
        AccountCache cache = currentCache();
        if (cache == null) {
            return loader.get();
        }
        return cache.accounts.computeIfAbsent(memberId + ":" + fundKind, key -> loader.get());
    }

    private AccountCache currentCache() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return null;
        }
        AccountCache cache = (AccountCache) TransactionSynchronizationManager.getResource(RESOURCE_KEY);
        if (cache == null) {
            cache = new AccountCache();
            TransactionSynchronizationManager.bindResource(RESOURCE_KEY, cache);
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    TransactionSynchronizationManager.unbindResourceIfPossible(RESOURCE_KEY);
                }
            });
        }
        return cache;
    }

    private static final class AccountCache {
        private final Map<String, LedgerAccount> accounts = new HashMap<>();
    }
}
