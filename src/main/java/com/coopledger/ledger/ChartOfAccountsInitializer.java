package com.coopledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the organization accounts that are missing at startup. Existing accounts are left alone.
 */
@Component
@ConditionalOnProperty(name = "cooperative.ledger.bootstrap-chart", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsInitializer implements ApplicationRunner {

    private final LedgerAccountRepository accountRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int created = 0;
        for (OrgAccount orgAccount : OrgAccount.values()) {
            if (!accountRepository.existsByCode(orgAccount.getCode())) {
                accountRepository.save(LedgerAccount.forOrganization(orgAccount));
                created++;
            }
        }
        log.info("Chart of accounts ready: {} organization accounts created", created);
    }
}
