package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.PaymentMethodMapping;
import com.example.ledger.exception.MissingAccountMappingException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.PaymentMethodMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Per-organization mapping from payment method to the cash or bank account that money moves
 * through, plus the lookup used by every payment, receipt and refund posting.
 *
 * Resolution order: explicit mapping, then an active asset account whose name contains
 * "cash" (CASH) or "bank" (other methods), then the configured default code.
 */
@Service
@Transactional
public class PaymentMethodMappingService {

    private static final Logger log = LoggerFactory.getLogger(PaymentMethodMappingService.class);

    private final PaymentMethodMappingRepository mappingRepository;
    private final AccountRepository accountRepository;
    private final AuditService auditService;
    private final LedgerProperties properties;

    public PaymentMethodMappingService(PaymentMethodMappingRepository mappingRepository,
                                       AccountRepository accountRepository,
                                       AuditService auditService,
                                       LedgerProperties properties) {
        this.mappingRepository = mappingRepository;
        this.accountRepository = accountRepository;
        this.auditService = auditService;
        this.properties = properties;
    }

    /**
     * Maps a method to an account, replacing any existing mapping for that method.
     *
     * @throws ValidationException if the account is not an active asset account
     */
    public PaymentMethodMapping upsertMapping(Long orgId, PaymentMethod method, Long accountId,
                                              Long userId) {
        if (method == null) {
            throw new ValidationException("Payment method is required");
        }
        Account account = accountRepository.findByIdAndOrgId(accountId, orgId)
            .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        if (account.getType() != AccountType.ASSET) {
            throw new ValidationException("Payment method " + method + " must map to an ASSET account; "
                + account.getCode() + " is " + account.getType());
        }
        if (!account.isActive()) {
            throw new ValidationException("Account is inactive: " + account.getCode());
        }

        PaymentMethodMapping mapping = mappingRepository.findByOrgIdAndMethod(orgId, method)
            .orElseGet(() -> new PaymentMethodMapping(orgId, method, account));
        mapping.setAccount(account);
        mapping = mappingRepository.save(mapping);

        auditService.logEvent(orgId, userId, "PAYMENT_METHOD_MAPPED", "PaymentMethodMapping",
            mapping.getId(), "Mapped " + method + " to account " + account.getCode());
        return mapping;
    }

    @Transactional(readOnly = true)
    public List<PaymentMethodMapping> listMappings(Long orgId) {
        return mappingRepository.findByOrgIdOrderByMethod(orgId);
    }

    public void deleteMapping(Long orgId, PaymentMethod method, Long userId) {
        PaymentMethodMapping mapping = mappingRepository.findByOrgIdAndMethod(orgId, method)
            .orElseThrow(() -> new NotFoundException("No mapping for payment method " + method));
        mappingRepository.delete(mapping);

        auditService.logEvent(orgId, userId, "PAYMENT_METHOD_UNMAPPED", "PaymentMethodMapping",
            mapping.getId(), "Removed mapping for " + method);
    }

    /**
     * Finds the cash or bank account a payment with this method moves through.
     *
     * @throws MissingAccountMappingException if nothing suitable is configured
     */
    @Transactional(readOnly = true)
    public Account resolveAccount(Long orgId, PaymentMethod method) {
        Optional<PaymentMethodMapping> mapping = mappingRepository.findByOrgIdAndMethod(orgId, method);
        if (mapping.isPresent()) {
            return mapping.get().getAccount();
        }

        String hint = method == PaymentMethod.CASH ? "cash" : "bank";
        Optional<Account> byName = accountRepository
            .findFirstByOrgIdAndTypeAndActiveTrueAndNameContainingIgnoreCaseOrderByCode(
                orgId, AccountType.ASSET, hint);
        if (byName.isPresent()) {
            log.debug("No mapping for {} in org {}, using account {} by name", method, orgId,
                byName.get().getCode());
            return byName.get();
        }

        String code = method == PaymentMethod.CASH
            ? properties.getAccounts().getCash()
            : properties.getAccounts().getBank();
        return accountRepository.findByOrgIdAndCode(orgId, code)
            .orElseThrow(() -> new MissingAccountMappingException("No account is mapped for payment method "
                + method + " and no " + hint + " account (code " + code + ") exists for organization "
                + orgId));
    }
}
