package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.PaymentTerms;
import com.example.ledger.domain.Vendor;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
import com.example.ledger.domain.VendorPayment;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.VendorBillRepository;
import com.example.ledger.repository.VendorPaymentRepository;
import com.example.ledger.repository.VendorRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for vendors, vendor bills and vendor payments (A/P).
 *
 * Key workflows:
 * 1. Create draft bill → Open (Dr Expense / Cr AP for the total)
 * 2. Pay, fully or in parts (Dr AP / Cr Cash per payment); the bill's status follows paidAmount
 * 3. Void (reverses the opening entry only; payments already made stay posted)
 *
 * Bills are re-read under a row lock before every status or paidAmount change, so concurrent
 * payments against one bill serialize and cannot overpay it.
 */
@Service
@Transactional
public class PayablesService {

    private final VendorRepository vendorRepository;
    private final VendorBillRepository billRepository;
    private final VendorPaymentRepository paymentRepository;
    private final AccountService accountService;
    private final JournalService journalService;
    private final FiscalPeriodService periodService;
    private final PaymentMethodMappingService paymentMethodMappingService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    public PayablesService(VendorRepository vendorRepository,
                           VendorBillRepository billRepository,
                           VendorPaymentRepository paymentRepository,
                           AccountService accountService,
                           JournalService journalService,
                           FiscalPeriodService periodService,
                           PaymentMethodMappingService paymentMethodMappingService,
                           AuditService auditService,
                           LedgerProperties properties) {
        this.vendorRepository = vendorRepository;
        this.billRepository = billRepository;
        this.paymentRepository = paymentRepository;
        this.accountService = accountService;
        this.journalService = journalService;
        this.periodService = periodService;
        this.paymentMethodMappingService = paymentMethodMappingService;
        this.auditService = auditService;
        this.properties = properties;
    }

    /** Fields of a new draft bill. {@code number}, {@code dueDate}, {@code tax} and the account are optional. */
    public record BillRequest(Long vendorId, String number, LocalDate billDate, LocalDate dueDate,
                              BigDecimal subtotal, BigDecimal tax, Long expenseAccountId, String memo) {
    }

    /** A payment to a vendor, optionally against one bill. */
    public record PaymentRequest(Long vendorId, Long billId, BigDecimal amount, LocalDate paidAt,
                                 PaymentMethod method, String ref) {
    }

    // Vendors

    public Vendor createVendor(Long orgId, String name, String email, String phone,
                               PaymentTerms defaultTerms, Long userId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Vendor name is required");
        }
        Vendor vendor = new Vendor(orgId, name.trim());
        vendor.setEmail(email);
        vendor.setPhone(phone);
        vendor.setDefaultTerms(defaultTerms);
        vendor = vendorRepository.save(vendor);

        auditService.logEvent(orgId, userId, "VENDOR_CREATED", "Vendor", vendor.getId(),
            "Created vendor " + vendor.getName());
        return vendor;
    }

    @Transactional(readOnly = true)
    public List<Vendor> listVendors(Long orgId) {
        return vendorRepository.findByOrgIdOrderByName(orgId);
    }

    @Transactional(readOnly = true)
    public Vendor getVendor(Long orgId, Long vendorId) {
        return vendorRepository.findByIdAndOrgId(vendorId, orgId)
            .orElseThrow(() -> new NotFoundException("Vendor not found: " + vendorId));
    }

    // Bills

    /**
     * Creates a draft bill. The total is subtotal plus tax; the due date defaults from the
     * vendor's terms (NET30 when none) and the number from the BILL-n sequence.
     */
    public VendorBill createBill(Long orgId, BillRequest request, Long userId) {
        Vendor vendor = getVendor(orgId, request.vendorId());
        if (request.billDate() == null) {
            throw new ValidationException("Bill date is required");
        }
        BigDecimal subtotal = Amounts.normalize(request.subtotal());
        BigDecimal tax = request.tax() != null ? Amounts.normalize(request.tax()) : null;
        BigDecimal total = tax != null ? subtotal.add(tax) : subtotal;
        if (subtotal.signum() < 0 || (tax != null && tax.signum() < 0)) {
            throw new ValidationException("Bill amounts cannot be negative");
        }
        if (!Amounts.isPositive(total)) {
            throw new ValidationException("Bill total must be greater than zero");
        }
        if (request.expenseAccountId() != null) {
            accountService.getAccount(orgId, request.expenseAccountId());
        }

        LocalDate dueDate = request.dueDate() != null ? request.dueDate()
            : request.billDate().plusDays(termsOf(vendor.getDefaultTerms()).getDays());
        if (dueDate.isBefore(request.billDate())) {
            throw new ValidationException("Due date " + dueDate + " is before bill date " + request.billDate());
        }

        VendorBill bill = new VendorBill(orgId, vendor, request.billDate(), dueDate, subtotal, tax, total);
        bill.setNumber(request.number() != null && !request.number().isBlank()
            ? request.number().trim()
            : DocumentNumbers.next("BILL", billRepository.findAllNumbersByOrgId(orgId)));
        bill.setExpenseAccountId(request.expenseAccountId());
        bill.setMemo(request.memo());
        bill = billRepository.save(bill);

        auditService.logEvent(orgId, userId, "BILL_CREATED", "VendorBill", bill.getId(),
            "Created bill " + bill.getNumber() + " from " + vendor.getName() + " for " + total.toPlainString());
        return bill;
    }

    /**
     * Opens a draft bill: posts Dr Expense / Cr AP for the total and links the entry.
     */
    public VendorBill openBill(Long orgId, Long billId, Long userId) {
        VendorBill bill = lockBill(orgId, billId);
        if (!bill.isDraft()) {
            throw new InvalidStateException("Bill " + bill.getNumber() + " is " + bill.getStatus()
                + "; only DRAFT bills can be opened");
        }

        Account apAccount = accountService.requireByCode(orgId, properties.getAccounts().getPayable(),
            "accounts payable");
        Account expenseAccount = bill.getExpenseAccountId() != null
            ? accountService.getAccount(orgId, bill.getExpenseAccountId())
            : accountService.requireByCode(orgId, properties.getAccounts().getExpense(), "expense");

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, bill.getBillDate(),
            "Vendor bill " + bill.getNumber() + " - " + bill.getVendor().getName(),
            JournalSource.VENDOR_BILL, String.valueOf(bill.getId()),
            List.of(JournalLineRequest.debit(expenseAccount.getId(), bill.getTotal()),
                JournalLineRequest.credit(apAccount.getId(), bill.getTotal())),
            userId));

        bill.markOpened(userId, entry.getId());
        bill = billRepository.save(bill);

        auditService.logEvent(orgId, userId, "BILL_OPENED", "VendorBill", bill.getId(),
            "Opened bill " + bill.getNumber() + " for " + bill.getTotal().toPlainString());
        return bill;
    }

    /**
     * Voids an open, part-paid or paid bill. The opening entry is reversed; payments keep their
     * own entries. VOID is terminal.
     */
    public VendorBill voidBill(Long orgId, Long billId, Long userId) {
        VendorBill bill = lockBill(orgId, billId);
        if (bill.isDraft() || bill.isVoid()) {
            throw new InvalidStateException("Bill " + bill.getNumber() + " is " + bill.getStatus()
                + "; only OPEN, PARTIALLY_PAID or PAID bills can be voided");
        }

        if (bill.getJournalEntryId() != null) {
            journalService.reverse(orgId, bill.getJournalEntryId(), userId, LocalDate.now(),
                JournalSource.VENDOR_BILL_VOID, String.valueOf(bill.getId()));
        }
        BillStatus previous = bill.getStatus();
        bill.markVoid(userId);
        bill = billRepository.save(bill);

        auditService.logEvent(orgId, userId, "BILL_VOIDED", "VendorBill", bill.getId(),
            "Voided bill " + bill.getNumber() + " (was " + previous + ", paid "
                + bill.getPaidAmount().toPlainString() + ")");
        return bill;
    }

    // Payments

    /**
     * Records a payment: posts Dr AP / Cr Cash through the account mapped to the payment method
     * and, when tied to a bill, applies it to the bill's paidAmount in the same transaction.
     *
     * @throws InsufficientBalanceException if the amount exceeds the bill's outstanding balance
     * @throws PeriodLockedException if the payment date falls in a locked period
     */
    public VendorPayment createPayment(Long orgId, PaymentRequest request, Long userId) {
        BigDecimal amount = Amounts.normalize(request.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (request.paidAt() == null || request.method() == null) {
            throw new ValidationException("Payment date and method are required");
        }
        periodService.assertPostable(orgId, request.paidAt());

        VendorBill bill = null;
        Vendor vendor;
        if (request.billId() != null) {
            bill = lockBill(orgId, request.billId());
            if (!bill.isPayable()) {
                throw new InvalidStateException("Bill " + bill.getNumber() + " is " + bill.getStatus()
                    + "; payments are accepted only while OPEN or PARTIALLY_PAID");
            }
            if (request.vendorId() != null && !request.vendorId().equals(bill.getVendor().getId())) {
                throw new ValidationException("Bill " + bill.getNumber() + " belongs to a different vendor");
            }
            if (!Amounts.fitsWithin(amount, bill.getOutstanding())) {
                throw new InsufficientBalanceException("outstanding balance of bill " + bill.getNumber(),
                    amount, bill.getOutstanding());
            }
            vendor = bill.getVendor();
        } else {
            if (request.vendorId() == null) {
                throw new ValidationException("A payment needs a vendor or a bill");
            }
            vendor = getVendor(orgId, request.vendorId());
        }

        Account apAccount = accountService.requireByCode(orgId, properties.getAccounts().getPayable(),
            "accounts payable");
        Account cashAccount = paymentMethodMappingService.resolveAccount(orgId, request.method());

        VendorPayment payment = new VendorPayment(orgId, vendor, bill, amount, request.paidAt(), request.method());
        payment.setRef(request.ref());
        payment.setCreatedById(userId);
        payment = paymentRepository.save(payment);

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, request.paidAt(),
            "Payment to " + vendor.getName() + (bill != null ? " for bill " + bill.getNumber() : ""),
            JournalSource.VENDOR_PAYMENT, String.valueOf(payment.getId()),
            List.of(JournalLineRequest.debit(apAccount.getId(), amount),
                JournalLineRequest.credit(cashAccount.getId(), amount)),
            userId));
        payment.setJournalEntryId(entry.getId());
        payment = paymentRepository.save(payment);

        if (bill != null) {
            bill.applyPayment(amount);
            billRepository.save(bill);
        }

        auditService.logEvent(orgId, userId, "VENDOR_PAYMENT_RECORDED", "VendorPayment", payment.getId(),
            "Paid " + amount.toPlainString() + " to " + vendor.getName() + " by " + request.method()
                + (bill != null ? " against bill " + bill.getNumber() : ""));
        return payment;
    }

    @Transactional(readOnly = true)
    public List<VendorPayment> listPayments(Long orgId, Long billId) {
        if (billId == null) {
            return paymentRepository.findByOrgIdOrderByPaidAtDesc(orgId);
        }
        getBill(orgId, billId);
        return paymentRepository.findByBill_IdOrderByPaidAtAsc(billId);
    }

    // Queries

    @Transactional(readOnly = true)
    public VendorBill getBill(Long orgId, Long billId) {
        return billRepository.findByIdAndOrgId(billId, orgId)
            .orElseThrow(() -> new NotFoundException("Vendor bill not found: " + billId));
    }

    @Transactional(readOnly = true)
    public BigDecimal getOutstanding(Long orgId, Long billId) {
        VendorBill bill = getBill(orgId, billId);
        return bill.isPayable() ? bill.getOutstanding() : BigDecimal.ZERO;
    }

    /**
     * Lists bills newest first, optionally narrowed by status or vendor.
     */
    @Transactional(readOnly = true)
    public List<VendorBill> listBills(Long orgId, BillStatus status, Long vendorId) {
        List<VendorBill> bills;
        if (vendorId != null) {
            bills = billRepository.findByOrgIdAndVendor_IdOrderByBillDateDesc(orgId, vendorId);
            if (status != null) {
                bills = bills.stream().filter(b -> b.getStatus() == status).toList();
            }
        } else if (status != null) {
            bills = billRepository.findByOrgIdAndStatusOrderByBillDateDesc(orgId, status);
        } else {
            bills = billRepository.findByOrgIdOrderByBillDateDesc(orgId);
        }
        return bills;
    }

    @Transactional(readOnly = true)
    public List<VendorBill> listOutstandingBills(Long orgId) {
        return billRepository.findByOrgIdAndStatusInOrderByDueDateAsc(orgId,
            List.of(BillStatus.OPEN, BillStatus.PARTIALLY_PAID));
    }

    VendorBill lockBill(Long orgId, Long billId) {
        return billRepository.findByIdForUpdate(billId, orgId)
            .orElseThrow(() -> new NotFoundException("Vendor bill not found: " + billId));
    }

    private static PaymentTerms termsOf(PaymentTerms terms) {
        return terms != null ? terms : PaymentTerms.NET30;
    }
}
