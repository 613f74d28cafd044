package com.libraria.backend.modules.loan.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class OverdueLoanScheduler {

    private static final Logger log = LoggerFactory.getLogger(OverdueLoanScheduler.class);

    private final LoanLifecycleService loanLifecycleService;

    public OverdueLoanScheduler(LoanLifecycleService loanLifecycleService) {
        this.loanLifecycleService = loanLifecycleService;
    }

    @Scheduled(fixedDelayString = "${app.loan.overdue-sweep-interval:PT15M}")
    @Transactional
    public void promoteOverdueLoans() {
        int promoted = loanLifecycleService.promoteOverdueLoans();
        if (promoted > 0) {
            log.info("Marked {} loans as overdue", promoted);
        }
    }
}
