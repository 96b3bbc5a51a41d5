package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.CreditNoteStatus;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.Customer;
import com.example.ledger.domain.CustomerCreditAllocation;
import com.example.ledger.domain.CustomerCreditNote;
import com.example.ledger.domain.CustomerCreditRefund;
import com.example.ledger.domain.CustomerInvoice;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.CustomerCreditAllocationRepository;
import com.example.ledger.repository.CustomerCreditNoteRepository;
import com.example.ledger.repository.CustomerCreditRefundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Customer credit notes: credit granted to a customer that reduces what they owe.
 *
 * Opening posts Dr Revenue / Cr AR. The credit is then allocated against the customer's
 * invoices (no journal entry) or paid out in cash (Dr AR / Cr Cash). allocated + refunded never
 * exceeds the note amount.
 */
@Service
@Transactional
public class CustomerCreditNoteService {

    private static final Logger log = LoggerFactory.getLogger(CustomerCreditNoteService.class);

    private final CustomerCreditNoteRepository creditNoteRepository;
    private final CustomerCreditAllocationRepository allocationRepository;
    private final CustomerCreditRefundRepository refundRepository;
    private final ReceivablesService receivablesService;
    private final AccountService accountService;
    private final JournalService journalService;
    private final FiscalPeriodService periodService;
    private final PaymentMethodMappingService paymentMethodMappingService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    public CustomerCreditNoteService(CustomerCreditNoteRepository creditNoteRepository,
                                     CustomerCreditAllocationRepository allocationRepository,
                                     CustomerCreditRefundRepository refundRepository,
                                     ReceivablesService receivablesService,
                                     AccountService accountService,
                                     JournalService journalService,
                                     FiscalPeriodService periodService,
                                     PaymentMethodMappingService paymentMethodMappingService,
                                     AuditService auditService,
                                     LedgerProperties properties) {
        this.creditNoteRepository = creditNoteRepository;
        this.allocationRepository = allocationRepository;
        this.refundRepository = refundRepository;
        this.receivablesService = receivablesService;
        this.accountService = accountService;
        this.journalService = journalService;
        this.periodService = periodService;
        this.paymentMethodMappingService = paymentMethodMappingService;
        this.auditService = auditService;
        this.properties = properties;
    }

    /** One invoice and the part of the credit to apply to it. */
    public record AllocationLine(Long invoiceId, BigDecimal amount) {
    }

    public record RefundRequest(BigDecimal amount, LocalDate refundDate, PaymentMethod method, String ref) {
    }

    public CustomerCreditNote create(Long orgId, Long customerId, LocalDate creditDate, BigDecimal amount,
                                     String reason, String memo, Long userId) {
        Customer customer = receivablesService.getCustomer(orgId, customerId);
        BigDecimal normalized = Amounts.normalize(amount);
        if (!Amounts.isPositive(normalized)) {
            throw new ValidationException("Credit note amount must be greater than zero");
        }
        if (creditDate == null) {
            throw new ValidationException("Credit note date is required");
        }

        CustomerCreditNote note = new CustomerCreditNote(orgId, customer, creditDate, normalized);
        note.setNumber(DocumentNumbers.next("CCN", creditNoteRepository.findAllNumbersByOrgId(orgId)));
        note.setReason(reason);
        note.setMemo(memo);
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_CREATED", "CustomerCreditNote", note.getId(),
            "Created credit note " + note.getNumber() + " for " + customer.getName() + " of "
                + normalized.toPlainString());
        return note;
    }

    /**
     * Opens a draft credit note: posts Dr Revenue / Cr AR for the full amount.
     */
    public CustomerCreditNote open(Long orgId, Long creditNoteId, Long userId) {
        CustomerCreditNote note = lockNote(orgId, creditNoteId);
        if (!note.isDraft()) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; only DRAFT credit notes can be opened");
        }

        Account arAccount = accountService.requireByCode(orgId, properties.getAccounts().getReceivable(),
            "accounts receivable");
        Account revenueAccount = accountService.requireByCode(orgId, properties.getAccounts().getRevenue(),
            "revenue");

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, note.getCreditDate(),
            "Customer credit note " + note.getNumber() + " - " + note.getCustomer().getName(),
            JournalSource.CUSTOMER_CREDIT_NOTE, String.valueOf(note.getId()),
            List.of(JournalLineRequest.debit(revenueAccount.getId(), note.getAmount()),
                JournalLineRequest.credit(arAccount.getId(), note.getAmount())),
            userId));

        note.markOpened(userId, entry.getId());
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_OPENED", "CustomerCreditNote", note.getId(),
            "Opened credit note " + note.getNumber() + " for " + note.getAmount().toPlainString());
        return note;
    }

    /**
     * Voids a credit note that has not been used. A draft is simply marked VOID; an open note
     * also has its opening entry reversed.
     */
    public CustomerCreditNote voidCreditNote(Long orgId, Long creditNoteId, Long userId) {
        CustomerCreditNote note = lockNote(orgId, creditNoteId);
        if (note.getStatus() != CreditNoteStatus.DRAFT && note.getStatus() != CreditNoteStatus.OPEN) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; only DRAFT or unused OPEN credit notes can be voided");
        }
        if (allocationRepository.existsByCreditNote_Id(note.getId())
                || refundRepository.existsByCreditNote_Id(note.getId())) {
            throw new InvalidStateException("Credit note " + note.getNumber()
                + " has allocations or refunds and cannot be voided");
        }

        if (note.getJournalEntryId() != null) {
            journalService.reverse(orgId, note.getJournalEntryId(), userId, LocalDate.now(),
                JournalSource.CUSTOMER_CREDIT_NOTE_VOID, String.valueOf(note.getId()));
        }
        note.setStatus(CreditNoteStatus.VOID);
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_VOIDED", "CustomerCreditNote", note.getId(),
            "Voided credit note " + note.getNumber());
        return note;
    }

    /**
     * Applies parts of the credit to invoices of the same customer. Each invoice must be payable
     * and each part must fit its outstanding balance; the total must fit the remaining credit.
     */
    public List<CustomerCreditAllocation> allocate(Long orgId, Long creditNoteId, Long userId,
                                                   List<AllocationLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("At least one allocation is required");
        }
        CustomerCreditNote note = lockNote(orgId, creditNoteId);
        if (!note.isUsable()) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; allocations need an OPEN or PARTIALLY_APPLIED credit note");
        }

        BigDecimal requested = BigDecimal.ZERO;
        for (AllocationLine line : lines) {
            BigDecimal amount = Amounts.normalize(line.amount());
            if (!Amounts.isPositive(amount)) {
                throw new ValidationException("Allocation amount must be greater than zero");
            }
            requested = requested.add(amount);
        }
        if (requested.compareTo(note.getRemaining()) > 0) {
            throw new InsufficientBalanceException("remaining credit on " + note.getNumber(),
                requested, note.getRemaining());
        }

        List<CustomerCreditAllocation> created = new ArrayList<>();
        for (AllocationLine line : lines) {
            BigDecimal amount = Amounts.normalize(line.amount());
            CustomerInvoice invoice = receivablesService.lockInvoice(orgId, line.invoiceId());
            if (!invoice.isPayable()) {
                throw new InvalidStateException("Invoice " + invoice.getNumber() + " is " + invoice.getStatus()
                    + "; credit can be applied only while OPEN or PARTIALLY_PAID");
            }
            if (!invoice.getCustomer().getId().equals(note.getCustomer().getId())) {
                throw new ValidationException("Invoice " + invoice.getNumber() + " belongs to a different customer");
            }
            if (amount.compareTo(invoice.getOutstanding()) > 0) {
                throw new InsufficientBalanceException("outstanding balance of invoice " + invoice.getNumber(),
                    amount, invoice.getOutstanding());
            }

            invoice.applyPayment(amount);
            note.addAllocated(amount);
            created.add(allocationRepository.save(new CustomerCreditAllocation(note, invoice, amount, userId)));
        }
        creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_ALLOCATED", "CustomerCreditNote", note.getId(),
            "Allocated " + requested.toPlainString() + " of " + note.getNumber() + " to "
                + created.size() + " invoice(s)",
            Map.of("allocated", requested.toPlainString(), "remaining", note.getRemaining().toPlainString()));
        return created;
    }

    /**
     * Undoes one allocation: the invoice and the credit note each get the amount back.
     */
    public void deleteAllocation(Long orgId, Long allocationId, Long userId) {
        CustomerCreditAllocation allocation = allocationRepository.findById(allocationId)
            .filter(a -> orgId.equals(a.getCreditNote().getOrgId()))
            .orElseThrow(() -> new NotFoundException("Credit allocation not found: " + allocationId));
        CustomerCreditNote note = lockNote(orgId, allocation.getCreditNote().getId());
        CustomerInvoice invoice = receivablesService.lockInvoice(orgId, allocation.getInvoice().getId());

        invoice.reversePayment(allocation.getAmount());
        note.addAllocated(allocation.getAmount().negate());
        allocationRepository.delete(allocation);
        creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_UNALLOCATED", "CustomerCreditNote", note.getId(),
            "Removed allocation of " + allocation.getAmount().toPlainString() + " from invoice " + invoice.getNumber());
    }

    /**
     * Pays remaining credit out to the customer in cash: posts Dr AR / Cr Cash.
     */
    public CustomerCreditRefund createRefund(Long orgId, Long creditNoteId, RefundRequest request, Long userId) {
        BigDecimal amount = Amounts.normalize(request.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Refund amount must be greater than zero");
        }
        if (request.refundDate() == null || request.method() == null) {
            throw new ValidationException("Refund date and method are required");
        }
        CustomerCreditNote note = lockNote(orgId, creditNoteId);
        if (!note.isUsable()) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; refunds need an OPEN or PARTIALLY_APPLIED credit note");
        }
        if (amount.compareTo(note.getRemaining()) > 0) {
            throw new InsufficientBalanceException("remaining credit on " + note.getNumber(),
                amount, note.getRemaining());
        }
        periodService.assertPostable(orgId, request.refundDate());

        Account arAccount = accountService.requireByCode(orgId, properties.getAccounts().getReceivable(),
            "accounts receivable");
        Account cashAccount = paymentMethodMappingService.resolveAccount(orgId, request.method());

        CustomerCreditRefund refund = new CustomerCreditRefund(note, amount, request.refundDate(), request.method());
        refund.setRef(request.ref());
        refund.setCreatedById(userId);
        refund = refundRepository.save(refund);

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, request.refundDate(),
            "Refund on credit note " + note.getNumber() + " to " + note.getCustomer().getName(),
            JournalSource.CUSTOMER_CREDIT_REFUND, String.valueOf(refund.getId()),
            List.of(JournalLineRequest.debit(arAccount.getId(), amount),
                JournalLineRequest.credit(cashAccount.getId(), amount)),
            userId));
        refund.setJournalEntryId(entry.getId());
        refund = refundRepository.save(refund);

        note.addRefunded(amount);
        creditNoteRepository.save(note);

        log.info("Refunded {} on customer credit note {}", amount, note.getNumber());
        auditService.logEvent(orgId, userId, "CUSTOMER_CREDIT_REFUNDED", "CustomerCreditNote", note.getId(),
            "Refunded " + amount.toPlainString() + " on " + note.getNumber() + " by " + request.method());
        return refund;
    }

    @Transactional(readOnly = true)
    public CustomerCreditNote get(Long orgId, Long creditNoteId) {
        return creditNoteRepository.findByIdAndOrgId(creditNoteId, orgId)
            .orElseThrow(() -> new NotFoundException("Customer credit note not found: " + creditNoteId));
    }

    @Transactional(readOnly = true)
    public List<CustomerCreditNote> list(Long orgId, CreditNoteStatus status) {
        return status != null
            ? creditNoteRepository.findByOrgIdAndStatusOrderByCreditDateDesc(orgId, status)
            : creditNoteRepository.findByOrgIdOrderByCreditDateDesc(orgId);
    }

    @Transactional(readOnly = true)
    public List<CustomerCreditAllocation> listAllocations(Long orgId, Long creditNoteId) {
        get(orgId, creditNoteId);
        return allocationRepository.findByCreditNote_IdOrderByAppliedAtAsc(creditNoteId);
    }

    @Transactional(readOnly = true)
    public List<CustomerCreditRefund> listRefunds(Long orgId, Long creditNoteId) {
        get(orgId, creditNoteId);
        return refundRepository.findByCreditNote_IdOrderByRefundDateAsc(creditNoteId);
    }

    private CustomerCreditNote lockNote(Long orgId, Long creditNoteId) {
        return creditNoteRepository.findByIdForUpdate(creditNoteId, orgId)
            .orElseThrow(() -> new NotFoundException("Customer credit note not found: " + creditNoteId));
    }
}
