package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.CashMovementType;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns operational events from the point of sale into journal entries using the configured
 * account codes. Every event is keyed by its operational id, so replays post nothing new.
 *
 * <pre>
 * Sale:          Dr Cash (or AR when unpaid)   Cr Sales, Cr Sales (service), Cr Tax payable
 * COGS:          Dr COGS                       Cr Inventory
 * Refund:        Dr Sales                      Cr Cash
 * Paid in:       Dr Cash                       Cr Equity
 * Paid out, safe drop, pickup:  Dr Equity      Cr Cash
 * </pre>
 *
 * <p>Each posting runs in its own transaction. When two deliveries of one event race, the loser
 * fails on the journal's unique source key; its transaction rolls back and the winner's entry is
 * returned.
 */
@Service
public class OperationalPostingService {

    private static final Logger log = LoggerFactory.getLogger(OperationalPostingService.class);

    private final JournalService journalService;
    private final AccountService accountService;
    private final LedgerProperties properties;
    private final TransactionOperations transactions;

    public OperationalPostingService(JournalService journalService,
                                     AccountService accountService,
                                     LedgerProperties properties,
                                     TransactionOperations transactions) {
        this.journalService = journalService;
        this.accountService = accountService;
        this.properties = properties;
        this.transactions = transactions;
    }

    /** A closed order. {@code total} must equal subtotal + service charge + tax. */
    public record SaleEvent(Long orgId, Long branchId, String orderId, LocalDate date,
                            BigDecimal subtotal, BigDecimal serviceCharge, BigDecimal tax,
                            BigDecimal total, boolean paid, Long userId) {
    }

    public record CogsEvent(Long orgId, Long branchId, String orderId, LocalDate date,
                            BigDecimal cost, Long userId) {
    }

    public record RefundEvent(Long orgId, Long branchId, String refundId, LocalDate date,
                              BigDecimal amount, String reason, Long userId) {
    }

    public record CashMovementEvent(Long orgId, Long branchId, String movementId, LocalDate date,
                                    CashMovementType type, BigDecimal amount, String memo, Long userId) {
    }

    public JournalEntry postSale(SaleEvent event) {
        requireId(event.orderId(), "order");
        BigDecimal total = Amounts.normalize(event.total());
        if (!Amounts.isPositive(total)) {
            throw new ValidationException("Sale total must be greater than zero for order " + event.orderId());
        }
        LedgerProperties.Accounts codes = properties.getAccounts();
        Account debitAccount = event.paid()
            ? accountService.requireByCode(event.orgId(), codes.getCash(), "cash")
            : accountService.requireByCode(event.orgId(), codes.getReceivable(), "accounts receivable");
        Account salesAccount = accountService.requireByCode(event.orgId(), codes.getRevenue(), "sales revenue");

        List<JournalLineRequest> lines = new ArrayList<>();
        lines.add(JournalLineRequest.debit(debitAccount.getId(), total));
        if (Amounts.isPositive(event.subtotal())) {
            lines.add(JournalLineRequest.credit(salesAccount.getId(), event.subtotal()));
        }
        if (Amounts.isPositive(event.serviceCharge())) {
            lines.add(JournalLineRequest.credit(salesAccount.getId(), event.serviceCharge())
                .withMemo("Service charge"));
        }
        if (Amounts.isPositive(event.tax())) {
            Account taxAccount = accountService.requireByCode(event.orgId(), codes.getTaxPayable(), "tax payable");
            lines.add(JournalLineRequest.credit(taxAccount.getId(), event.tax()).withMemo("Tax"));
        }

        JournalEntry entry = post(new PostingRequest(
            event.orgId(), event.branchId(), event.date(), "Sale - Order #" + shortId(event.orderId()),
            JournalSource.ORDER, event.orderId(), lines, event.userId()));
        log.info("Posted sale for order {} as entry {} ({} lines)", event.orderId(), entry.getId(),
            entry.getLines().size());
        return entry;
    }

    /**
     * Posts the cost of an order. Orders with no cost produce no entry.
     */
    public Optional<JournalEntry> postCogs(CogsEvent event) {
        requireId(event.orderId(), "order");
        BigDecimal cost = Amounts.normalize(event.cost());
        if (cost.signum() < 0) {
            throw new ValidationException("COGS cannot be negative for order " + event.orderId());
        }
        if (cost.signum() == 0) {
            log.warn("Order {} has zero COGS, skipping GL posting", event.orderId());
            return Optional.empty();
        }
        LedgerProperties.Accounts codes = properties.getAccounts();
        Account cogsAccount = accountService.requireByCode(event.orgId(), codes.getCogs(), "cost of goods sold");
        Account inventoryAccount = accountService.requireByCode(event.orgId(), codes.getInventory(), "inventory");

        JournalEntry entry = post(new PostingRequest(
            event.orgId(), event.branchId(), event.date(), "COGS - Order #" + shortId(event.orderId()),
            JournalSource.COGS, event.orderId(),
            List.of(JournalLineRequest.debit(cogsAccount.getId(), cost),
                JournalLineRequest.credit(inventoryAccount.getId(), cost)),
            event.userId()));
        log.info("Posted COGS for order {} as entry {} (cost {})", event.orderId(), entry.getId(), cost);
        return Optional.of(entry);
    }

    public JournalEntry postRefund(RefundEvent event) {
        requireId(event.refundId(), "refund");
        BigDecimal amount = Amounts.normalize(event.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Refund amount must be greater than zero");
        }
        LedgerProperties.Accounts codes = properties.getAccounts();
        Account salesAccount = accountService.requireByCode(event.orgId(), codes.getRevenue(), "sales revenue");
        Account cashAccount = accountService.requireByCode(event.orgId(), codes.getCash(), "cash");

        JournalEntry entry = post(new PostingRequest(
            event.orgId(), event.branchId(), event.date(),
            "Refund - " + (event.reason() != null ? event.reason() : "No reason"),
            JournalSource.REFUND, event.refundId(),
            List.of(JournalLineRequest.debit(salesAccount.getId(), amount),
                JournalLineRequest.credit(cashAccount.getId(), amount)),
            event.userId()));
        log.info("Posted refund {} as entry {}", event.refundId(), entry.getId());
        return entry;
    }

    public JournalEntry postCashMovement(CashMovementEvent event) {
        requireId(event.movementId(), "cash movement");
        if (event.type() == null) {
            throw new ValidationException("Cash movement type is required");
        }
        BigDecimal amount = Amounts.normalize(event.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Cash movement amount must be greater than zero");
        }
        LedgerProperties.Accounts codes = properties.getAccounts();
        Account cashAccount = accountService.requireByCode(event.orgId(), codes.getCash(), "cash");
        Account equityAccount = accountService.requireByCode(event.orgId(), codes.getEquity(), "owner's equity");

        List<JournalLineRequest> lines = event.type().increasesCash()
            ? List.of(JournalLineRequest.debit(cashAccount.getId(), amount),
                JournalLineRequest.credit(equityAccount.getId(), amount))
            : List.of(JournalLineRequest.debit(equityAccount.getId(), amount),
                JournalLineRequest.credit(cashAccount.getId(), amount));

        JournalEntry entry = post(new PostingRequest(
            event.orgId(), event.branchId(), event.date(),
            "Cash " + event.type() + (event.memo() != null ? " - " + event.memo() : ""),
            JournalSource.CASH_MOVEMENT, event.movementId(), lines, event.userId()));
        log.info("Posted cash movement {} ({}) as entry {}", event.movementId(), event.type(), entry.getId());
        return entry;
    }

    private JournalEntry post(PostingRequest request) {
        try {
            return transactions.execute(status -> journalService.postDirect(request));
        } catch (DataIntegrityViolationException e) {
            JournalEntry existing = journalService
                .findBySource(request.orgId(), request.source(), request.sourceId())
                .orElseThrow(() -> e);
            log.warn("Concurrent duplicate posting for {} {} resolved to entry {}",
                request.source(), request.sourceId(), existing.getId());
            return existing;
        }
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("The " + what + " id is required");
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(id.length() - 8) : id;
    }
}
