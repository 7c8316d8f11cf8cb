package com.ias.distributor.gateway;

import com.ias.distributor.entity.CustodyAccount;
import com.ias.distributor.repository.CustodyAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Database-backed asset ledger. Transfers enlist in the caller's transaction, so a rolled-back
 * settlement also rolls back the value it moved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustodyLedgerGateway implements AssetTransferGateway {

    public static final String HANDLE = "custody";

    private final CustodyAccountRepository accountRepository;

    @Override
    public String handle() {
        return HANDLE;
    }

    @Override
    @Transactional
    public TransferReceipt transfer(String from, String to, BigInteger amount) {
        String source = from.toLowerCase();
        String recipient = to.toLowerCase();

        if (amount.signum() <= 0) {
            return TransferReceipt.failed(recipient, amount, "amount must be positive");
        }

        CustodyAccount debited = accountRepository.findByIdForUpdate(source).orElse(null);
        if (debited == null || debited.getBalance().compareTo(amount) < 0) {
            log.warn("Custody transfer of {} from {} to {} rejected: insufficient funds", amount, source, recipient);
            return TransferReceipt.failed(recipient, amount, "insufficient custody balance");
        }

        debited.setBalance(debited.getBalance().subtract(amount));
        accountRepository.save(debited);

        CustodyAccount credited = lockOrCreate(recipient);
        credited.setBalance(credited.getBalance().add(amount));
        accountRepository.save(credited);

        String reference = "custody-" + UUID.randomUUID();
        log.debug("Custody transfer {}: {} from {} to {}", reference, amount, source, recipient);
        return TransferReceipt.ok(recipient, amount, reference);
    }

    @Override
    @Transactional
    public TransferReceipt deposit(String account, BigInteger amount) {
        String recipient = account.toLowerCase();
        if (amount.signum() <= 0) {
            return TransferReceipt.failed(recipient, amount, "amount must be positive");
        }

        CustodyAccount credited = lockOrCreate(recipient);
        credited.setBalance(credited.getBalance().add(amount));
        accountRepository.save(credited);

        String reference = "custody-deposit-" + UUID.randomUUID();
        log.info("Deposited {} into custody account {} ({})", amount, recipient, reference);
        return TransferReceipt.ok(recipient, amount, reference);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String account) {
        return accountRepository.findById(account.toLowerCase())
                .map(CustodyAccount::getBalance)
                .orElse(BigInteger.ZERO);
    }

    private CustodyAccount lockOrCreate(String account) {
        return accountRepository.findByIdForUpdate(account)
                .orElseGet(() -> CustodyAccount.builder()
                        .accountAddress(account)
                        .build());
    }
}
