package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.CreditNoteStatus;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.Vendor;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorCreditAllocation;
import com.example.ledger.domain.VendorCreditNote;
import com.example.ledger.domain.VendorCreditRefund;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.VendorCreditAllocationRepository;
import com.example.ledger.repository.VendorCreditNoteRepository;
import com.example.ledger.repository.VendorCreditRefundRepository;
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
 * Vendor credit notes: credit received from a vendor that reduces what we owe.
 *
 * Opening posts Dr AP / Cr Expense. The credit is then allocated against the vendor's bills
 * (no journal entry, the AP reduction already happened on open) or refunded in cash
 * (Dr Cash / Cr AP). allocated + refunded never exceeds the note amount.
 */
@Service
@Transactional
public class VendorCreditNoteService {

    private static final Logger log = LoggerFactory.getLogger(VendorCreditNoteService.class);

    private final VendorCreditNoteRepository creditNoteRepository;
    private final VendorCreditAllocationRepository allocationRepository;
    private final VendorCreditRefundRepository refundRepository;
    private final PayablesService payablesService;
    private final AccountService accountService;
    private final JournalService journalService;
    private final FiscalPeriodService periodService;
    private final PaymentMethodMappingService paymentMethodMappingService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    public VendorCreditNoteService(VendorCreditNoteRepository creditNoteRepository,
                                   VendorCreditAllocationRepository allocationRepository,
                                   VendorCreditRefundRepository refundRepository,
                                   PayablesService payablesService,
                                   AccountService accountService,
                                   JournalService journalService,
                                   FiscalPeriodService periodService,
                                   PaymentMethodMappingService paymentMethodMappingService,
                                   AuditService auditService,
                                   LedgerProperties properties) {
        this.creditNoteRepository = creditNoteRepository;
        this.allocationRepository = allocationRepository;
        this.refundRepository = refundRepository;
        this.payablesService = payablesService;
        this.accountService = accountService;
        this.journalService = journalService;
        this.periodService = periodService;
        this.paymentMethodMappingService = paymentMethodMappingService;
        this.auditService = auditService;
        this.properties = properties;
    }

    /** One bill and the part of the credit to apply to it. */
    public record AllocationLine(Long billId, BigDecimal amount) {
    }

    public record RefundRequest(BigDecimal amount, LocalDate refundDate, PaymentMethod method, String ref) {
    }

    public VendorCreditNote create(Long orgId, Long vendorId, LocalDate creditDate, BigDecimal amount,
                                   String reason, String memo, Long userId) {
        Vendor vendor = payablesService.getVendor(orgId, vendorId);
        BigDecimal normalized = Amounts.normalize(amount);
        if (!Amounts.isPositive(normalized)) {
            throw new ValidationException("Credit note amount must be greater than zero");
        }
        if (creditDate == null) {
            throw new ValidationException("Credit note date is required");
        }

        VendorCreditNote note = new VendorCreditNote(orgId, vendor, creditDate, normalized);
        note.setNumber(DocumentNumbers.next("VCN", creditNoteRepository.findAllNumbersByOrgId(orgId)));
        note.setReason(reason);
        note.setMemo(memo);
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_CREATED", "VendorCreditNote", note.getId(),
            "Created credit note " + note.getNumber() + " from " + vendor.getName() + " for "
                + normalized.toPlainString());
        return note;
    }

    /**
     * Opens a draft credit note: posts Dr AP / Cr Expense for the full amount.
     */
    public VendorCreditNote open(Long orgId, Long creditNoteId, Long userId) {
        VendorCreditNote note = lockNote(orgId, creditNoteId);
        if (!note.isDraft()) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; only DRAFT credit notes can be opened");
        }

        Account apAccount = accountService.requireByCode(orgId, properties.getAccounts().getPayable(),
            "accounts payable");
        Account expenseAccount = accountService.requireByCode(orgId, properties.getAccounts().getExpense(),
            "expense");

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, note.getCreditDate(),
            "Vendor credit note " + note.getNumber() + " - " + note.getVendor().getName(),
            JournalSource.VENDOR_CREDIT_NOTE, String.valueOf(note.getId()),
            List.of(JournalLineRequest.debit(apAccount.getId(), note.getAmount()),
                JournalLineRequest.credit(expenseAccount.getId(), note.getAmount())),
            userId));

        note.markOpened(userId, entry.getId());
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_OPENED", "VendorCreditNote", note.getId(),
            "Opened credit note " + note.getNumber() + " for " + note.getAmount().toPlainString());
        return note;
    }

    /**
     * Voids a credit note that has not been used. A draft is simply marked VOID; an open note
     * also has its opening entry reversed.
     */
    public VendorCreditNote voidCreditNote(Long orgId, Long creditNoteId, Long userId) {
        VendorCreditNote note = lockNote(orgId, creditNoteId);
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
                JournalSource.VENDOR_CREDIT_NOTE_VOID, String.valueOf(note.getId()));
        }
        note.setStatus(CreditNoteStatus.VOID);
        note = creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_VOIDED", "VendorCreditNote", note.getId(),
            "Voided credit note " + note.getNumber());
        return note;
    }

    /**
     * Applies parts of the credit to bills of the same vendor. Each bill must be payable and
     * each part must fit the bill's outstanding balance; the total must fit the remaining credit.
     */
    public List<VendorCreditAllocation> allocate(Long orgId, Long creditNoteId, Long userId,
                                                 List<AllocationLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("At least one allocation is required");
        }
        VendorCreditNote note = lockNote(orgId, creditNoteId);
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

        List<VendorCreditAllocation> created = new ArrayList<>();
        for (AllocationLine line : lines) {
            BigDecimal amount = Amounts.normalize(line.amount());
            VendorBill bill = payablesService.lockBill(orgId, line.billId());
            if (!bill.isPayable()) {
                throw new InvalidStateException("Bill " + bill.getNumber() + " is " + bill.getStatus()
                    + "; credit can be applied only while OPEN or PARTIALLY_PAID");
            }
            if (!bill.getVendor().getId().equals(note.getVendor().getId())) {
                throw new ValidationException("Bill " + bill.getNumber() + " belongs to a different vendor");
            }
            if (amount.compareTo(bill.getOutstanding()) > 0) {
                throw new InsufficientBalanceException("outstanding balance of bill " + bill.getNumber(),
                    amount, bill.getOutstanding());
            }

            bill.applyPayment(amount);
            note.addAllocated(amount);
            created.add(allocationRepository.save(new VendorCreditAllocation(note, bill, amount, userId)));
        }
        creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_ALLOCATED", "VendorCreditNote", note.getId(),
            "Allocated " + requested.toPlainString() + " of " + note.getNumber() + " to "
                + created.size() + " bill(s)",
            Map.of("allocated", requested.toPlainString(), "remaining", note.getRemaining().toPlainString()));
        return created;
    }

    /**
     * Undoes one allocation: the bill and the credit note each get the amount back.
     */
    public void deleteAllocation(Long orgId, Long allocationId, Long userId) {
        VendorCreditAllocation allocation = allocationRepository.findById(allocationId)
            .filter(a -> orgId.equals(a.getCreditNote().getOrgId()))
            .orElseThrow(() -> new NotFoundException("Credit allocation not found: " + allocationId));
        VendorCreditNote note = lockNote(orgId, allocation.getCreditNote().getId());
        VendorBill bill = payablesService.lockBill(orgId, allocation.getBill().getId());

        bill.reversePayment(allocation.getAmount());
        note.addAllocated(allocation.getAmount().negate());
        allocationRepository.delete(allocation);
        creditNoteRepository.save(note);

        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_UNALLOCATED", "VendorCreditNote", note.getId(),
            "Removed allocation of " + allocation.getAmount().toPlainString() + " from bill " + bill.getNumber());
    }

    /**
     * Takes remaining credit back as cash: posts Dr Cash / Cr AP.
     */
    public VendorCreditRefund createRefund(Long orgId, Long creditNoteId, RefundRequest request, Long userId) {
        BigDecimal amount = Amounts.normalize(request.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Refund amount must be greater than zero");
        }
        if (request.refundDate() == null || request.method() == null) {
            throw new ValidationException("Refund date and method are required");
        }
        VendorCreditNote note = lockNote(orgId, creditNoteId);
        if (!note.isUsable()) {
            throw new InvalidStateException("Credit note " + note.getNumber() + " is " + note.getStatus()
                + "; refunds need an OPEN or PARTIALLY_APPLIED credit note");
        }
        if (amount.compareTo(note.getRemaining()) > 0) {
            throw new InsufficientBalanceException("remaining credit on " + note.getNumber(),
                amount, note.getRemaining());
        }
        periodService.assertPostable(orgId, request.refundDate());

        Account apAccount = accountService.requireByCode(orgId, properties.getAccounts().getPayable(),
            "accounts payable");
        Account cashAccount = paymentMethodMappingService.resolveAccount(orgId, request.method());

        VendorCreditRefund refund = new VendorCreditRefund(note, amount, request.refundDate(), request.method());
        refund.setRef(request.ref());
        refund.setCreatedById(userId);
        refund = refundRepository.save(refund);

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, request.refundDate(),
            "Refund on credit note " + note.getNumber() + " from " + note.getVendor().getName(),
            JournalSource.VENDOR_CREDIT_REFUND, String.valueOf(refund.getId()),
            List.of(JournalLineRequest.debit(cashAccount.getId(), amount),
                JournalLineRequest.credit(apAccount.getId(), amount)),
            userId));
        refund.setJournalEntryId(entry.getId());
        refund = refundRepository.save(refund);

        note.addRefunded(amount);
        creditNoteRepository.save(note);

        log.info("Refunded {} on vendor credit note {}", amount, note.getNumber());
        auditService.logEvent(orgId, userId, "VENDOR_CREDIT_REFUNDED", "VendorCreditNote", note.getId(),
            "Refunded " + amount.toPlainString() + " on " + note.getNumber() + " by " + request.method());
        return refund;
    }

    @Transactional(readOnly = true)
    public VendorCreditNote get(Long orgId, Long creditNoteId) {
        return creditNoteRepository.findByIdAndOrgId(creditNoteId, orgId)
            .orElseThrow(() -> new NotFoundException("Vendor credit note not found: " + creditNoteId));
    }

    @Transactional(readOnly = true)
    public List<VendorCreditNote> list(Long orgId, CreditNoteStatus status) {
        return status != null
            ? creditNoteRepository.findByOrgIdAndStatusOrderByCreditDateDesc(orgId, status)
            : creditNoteRepository.findByOrgIdOrderByCreditDateDesc(orgId);
    }

    @Transactional(readOnly = true)
    public List<VendorCreditAllocation> listAllocations(Long orgId, Long creditNoteId) {
        get(orgId, creditNoteId);
        return allocationRepository.findByCreditNote_IdOrderByAppliedAtAsc(creditNoteId);
    }

    @Transactional(readOnly = true)
    public List<VendorCreditRefund> listRefunds(Long orgId, Long creditNoteId) {
        get(orgId, creditNoteId);
        return refundRepository.findByCreditNote_IdOrderByRefundDateAsc(creditNoteId);
    }

    private VendorCreditNote lockNote(Long orgId, Long creditNoteId) {
        return creditNoteRepository.findByIdForUpdate(creditNoteId, orgId)
            .orElseThrow(() -> new NotFoundException("Vendor credit note not found: " + creditNoteId));
    }
}
