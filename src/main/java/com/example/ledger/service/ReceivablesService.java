package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.Customer;
import com.example.ledger.domain.CustomerInvoice;
import com.example.ledger.domain.CustomerInvoice.InvoiceStatus;
import com.example.ledger.domain.CustomerReceipt;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.PaymentTerms;
import com.example.ledger.exception.InsufficientBalanceException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.CustomerInvoiceRepository;
import com.example.ledger.repository.CustomerReceiptRepository;
import com.example.ledger.repository.CustomerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for customers, customer invoices and customer receipts (A/R).
 *
 * Opening an invoice posts Dr AR / Cr Revenue; each receipt posts Dr Cash / Cr AR and is
 * applied to the invoice's paidAmount in the same transaction. Voiding reverses the invoice
 * entry only.
 */
@Service
@Transactional
public class ReceivablesService {

    private final CustomerRepository customerRepository;
    private final CustomerInvoiceRepository invoiceRepository;
    private final CustomerReceiptRepository receiptRepository;
    private final AccountService accountService;
    private final JournalService journalService;
    private final FiscalPeriodService periodService;
    private final PaymentMethodMappingService paymentMethodMappingService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    public ReceivablesService(CustomerRepository customerRepository,
                              CustomerInvoiceRepository invoiceRepository,
                              CustomerReceiptRepository receiptRepository,
                              AccountService accountService,
                              JournalService journalService,
                              FiscalPeriodService periodService,
                              PaymentMethodMappingService paymentMethodMappingService,
                              AuditService auditService,
                              LedgerProperties properties) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.receiptRepository = receiptRepository;
        this.accountService = accountService;
        this.journalService = journalService;
        this.periodService = periodService;
        this.paymentMethodMappingService = paymentMethodMappingService;
        this.auditService = auditService;
        this.properties = properties;
    }

    /** Fields of a new draft invoice. {@code number}, {@code dueDate}, {@code tax} and the account are optional. */
    public record InvoiceRequest(Long customerId, String number, LocalDate invoiceDate, LocalDate dueDate,
                                 BigDecimal subtotal, BigDecimal tax, Long revenueAccountId, String memo) {
    }

    /** Money received from a customer, optionally against one invoice. */
    public record ReceiptRequest(Long customerId, Long invoiceId, BigDecimal amount, LocalDate receivedAt,
                                 PaymentMethod method, String ref) {
    }

    // Customers

    public Customer createCustomer(Long orgId, String name, String email, String phone,
                                   PaymentTerms defaultTerms, BigDecimal creditLimit, Long userId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Customer name is required");
        }
        if (creditLimit != null && creditLimit.signum() < 0) {
            throw new ValidationException("Credit limit cannot be negative");
        }
        Customer customer = new Customer(orgId, name.trim());
        customer.setEmail(email);
        customer.setPhone(phone);
        customer.setDefaultTerms(defaultTerms);
        customer.setCreditLimit(creditLimit != null ? Amounts.normalize(creditLimit) : null);
        customer = customerRepository.save(customer);

        auditService.logEvent(orgId, userId, "CUSTOMER_CREATED", "Customer", customer.getId(),
            "Created customer " + customer.getName());
        return customer;
    }

    @Transactional(readOnly = true)
    public List<Customer> listCustomers(Long orgId) {
        return customerRepository.findByOrgIdOrderByName(orgId);
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(Long orgId, Long customerId) {
        return customerRepository.findByIdAndOrgId(customerId, orgId)
            .orElseThrow(() -> new NotFoundException("Customer not found: " + customerId));
    }

    // Invoices

    /**
     * Creates a draft invoice. The total is subtotal plus tax; the due date defaults from the
     * customer's terms (NET30 when none) and the number from the INV-n sequence.
     */
    public CustomerInvoice createInvoice(Long orgId, InvoiceRequest request, Long userId) {
        Customer customer = getCustomer(orgId, request.customerId());
        if (request.invoiceDate() == null) {
            throw new ValidationException("Invoice date is required");
        }
        BigDecimal subtotal = Amounts.normalize(request.subtotal());
        BigDecimal tax = request.tax() != null ? Amounts.normalize(request.tax()) : null;
        BigDecimal total = tax != null ? subtotal.add(tax) : subtotal;
        if (subtotal.signum() < 0 || (tax != null && tax.signum() < 0)) {
            throw new ValidationException("Invoice amounts cannot be negative");
        }
        if (!Amounts.isPositive(total)) {
            throw new ValidationException("Invoice total must be greater than zero");
        }
        if (request.revenueAccountId() != null) {
            accountService.getAccount(orgId, request.revenueAccountId());
        }

        PaymentTerms terms = customer.getDefaultTerms() != null ? customer.getDefaultTerms() : PaymentTerms.NET30;
        LocalDate dueDate = request.dueDate() != null ? request.dueDate()
            : request.invoiceDate().plusDays(terms.getDays());
        if (dueDate.isBefore(request.invoiceDate())) {
            throw new ValidationException("Due date " + dueDate + " is before invoice date " + request.invoiceDate());
        }

        CustomerInvoice invoice = new CustomerInvoice(orgId, customer, request.invoiceDate(), dueDate,
            subtotal, tax, total);
        invoice.setNumber(request.number() != null && !request.number().isBlank()
            ? request.number().trim()
            : DocumentNumbers.next("INV", invoiceRepository.findAllNumbersByOrgId(orgId)));
        invoice.setRevenueAccountId(request.revenueAccountId());
        invoice.setMemo(request.memo());
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(orgId, userId, "INVOICE_CREATED", "CustomerInvoice", invoice.getId(),
            "Created invoice " + invoice.getNumber() + " for " + customer.getName() + " of " + total.toPlainString());
        return invoice;
    }

    /**
     * Opens a draft invoice: posts Dr AR / Cr Revenue for the total and links the entry.
     */
    public CustomerInvoice openInvoice(Long orgId, Long invoiceId, Long userId) {
        CustomerInvoice invoice = lockInvoice(orgId, invoiceId);
        if (!invoice.isDraft()) {
            throw new InvalidStateException("Invoice " + invoice.getNumber() + " is " + invoice.getStatus()
                + "; only DRAFT invoices can be opened");
        }

        Account arAccount = accountService.requireByCode(orgId, properties.getAccounts().getReceivable(),
            "accounts receivable");
        Account revenueAccount = invoice.getRevenueAccountId() != null
            ? accountService.getAccount(orgId, invoice.getRevenueAccountId())
            : accountService.requireByCode(orgId, properties.getAccounts().getRevenue(), "revenue");

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, invoice.getInvoiceDate(),
            "Customer invoice " + invoice.getNumber() + " - " + invoice.getCustomer().getName(),
            JournalSource.CUSTOMER_INVOICE, String.valueOf(invoice.getId()),
            List.of(JournalLineRequest.debit(arAccount.getId(), invoice.getTotal()),
                JournalLineRequest.credit(revenueAccount.getId(), invoice.getTotal())),
            userId));

        invoice.markOpened(userId, entry.getId());
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(orgId, userId, "INVOICE_OPENED", "CustomerInvoice", invoice.getId(),
            "Opened invoice " + invoice.getNumber() + " for " + invoice.getTotal().toPlainString());
        return invoice;
    }

    /**
     * Voids an open, part-paid or paid invoice by reversing its opening entry. Receipts keep
     * their own entries. VOID is terminal.
     */
    public CustomerInvoice voidInvoice(Long orgId, Long invoiceId, Long userId) {
        CustomerInvoice invoice = lockInvoice(orgId, invoiceId);
        if (invoice.isDraft() || invoice.isVoid()) {
            throw new InvalidStateException("Invoice " + invoice.getNumber() + " is " + invoice.getStatus()
                + "; only OPEN, PARTIALLY_PAID or PAID invoices can be voided");
        }

        if (invoice.getJournalEntryId() != null) {
            journalService.reverse(orgId, invoice.getJournalEntryId(), userId, LocalDate.now(),
                JournalSource.CUSTOMER_INVOICE_VOID, String.valueOf(invoice.getId()));
        }
        InvoiceStatus previous = invoice.getStatus();
        invoice.markVoid(userId);
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(orgId, userId, "INVOICE_VOIDED", "CustomerInvoice", invoice.getId(),
            "Voided invoice " + invoice.getNumber() + " (was " + previous + ", received "
                + invoice.getPaidAmount().toPlainString() + ")");
        return invoice;
    }

    // Receipts

    /**
     * Records a receipt: posts Dr Cash / Cr AR and, when tied to an invoice, applies it to the
     * invoice's paidAmount in the same transaction.
     *
     * @throws InsufficientBalanceException if the amount exceeds the invoice's outstanding balance
     * @throws PeriodLockedException if the receipt date falls in a locked period
     */
    public CustomerReceipt createReceipt(Long orgId, ReceiptRequest request, Long userId) {
        BigDecimal amount = Amounts.normalize(request.amount());
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Receipt amount must be greater than zero");
        }
        if (request.receivedAt() == null || request.method() == null) {
            throw new ValidationException("Receipt date and method are required");
        }
        periodService.assertPostable(orgId, request.receivedAt());

        CustomerInvoice invoice = null;
        Customer customer;
        if (request.invoiceId() != null) {
            invoice = lockInvoice(orgId, request.invoiceId());
            if (!invoice.isPayable()) {
                throw new InvalidStateException("Invoice " + invoice.getNumber() + " is " + invoice.getStatus()
                    + "; receipts are accepted only while OPEN or PARTIALLY_PAID");
            }
            if (request.customerId() != null && !request.customerId().equals(invoice.getCustomer().getId())) {
                throw new ValidationException("Invoice " + invoice.getNumber() + " belongs to a different customer");
            }
            if (!Amounts.fitsWithin(amount, invoice.getOutstanding())) {
                throw new InsufficientBalanceException("outstanding balance of invoice " + invoice.getNumber(),
                    amount, invoice.getOutstanding());
            }
            customer = invoice.getCustomer();
        } else {
            if (request.customerId() == null) {
                throw new ValidationException("A receipt needs a customer or an invoice");
            }
            customer = getCustomer(orgId, request.customerId());
        }

        Account arAccount = accountService.requireByCode(orgId, properties.getAccounts().getReceivable(),
            "accounts receivable");
        Account cashAccount = paymentMethodMappingService.resolveAccount(orgId, request.method());

        CustomerReceipt receipt = new CustomerReceipt(orgId, customer, invoice, amount, request.receivedAt(),
            request.method());
        receipt.setRef(request.ref());
        receipt.setCreatedById(userId);
        receipt = receiptRepository.save(receipt);

        JournalEntry entry = journalService.postDirect(new PostingRequest(
            orgId, null, request.receivedAt(),
            "Receipt from " + customer.getName() + (invoice != null ? " for invoice " + invoice.getNumber() : ""),
            JournalSource.CUSTOMER_RECEIPT, String.valueOf(receipt.getId()),
            List.of(JournalLineRequest.debit(cashAccount.getId(), amount),
                JournalLineRequest.credit(arAccount.getId(), amount)),
            userId));
        receipt.setJournalEntryId(entry.getId());
        receipt = receiptRepository.save(receipt);

        if (invoice != null) {
            invoice.applyPayment(amount);
            invoiceRepository.save(invoice);
        }

        auditService.logEvent(orgId, userId, "CUSTOMER_RECEIPT_RECORDED", "CustomerReceipt", receipt.getId(),
            "Received " + amount.toPlainString() + " from " + customer.getName() + " by " + request.method()
                + (invoice != null ? " against invoice " + invoice.getNumber() : ""));
        return receipt;
    }

    @Transactional(readOnly = true)
    public List<CustomerReceipt> listReceipts(Long orgId, Long invoiceId) {
        if (invoiceId == null) {
            return receiptRepository.findByOrgIdOrderByReceivedAtDesc(orgId);
        }
        getInvoice(orgId, invoiceId);
        return receiptRepository.findByInvoice_IdOrderByReceivedAtAsc(invoiceId);
    }

    // Queries

    @Transactional(readOnly = true)
    public CustomerInvoice getInvoice(Long orgId, Long invoiceId) {
        return invoiceRepository.findByIdAndOrgId(invoiceId, orgId)
            .orElseThrow(() -> new NotFoundException("Customer invoice not found: " + invoiceId));
    }

    @Transactional(readOnly = true)
    public BigDecimal getOutstanding(Long orgId, Long invoiceId) {
        CustomerInvoice invoice = getInvoice(orgId, invoiceId);
        return invoice.isPayable() ? invoice.getOutstanding() : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public List<CustomerInvoice> listInvoices(Long orgId, InvoiceStatus status, Long customerId) {
        List<CustomerInvoice> invoices;
        if (customerId != null) {
            invoices = invoiceRepository.findByOrgIdAndCustomer_IdOrderByInvoiceDateDesc(orgId, customerId);
            if (status != null) {
                invoices = invoices.stream().filter(i -> i.getStatus() == status).toList();
            }
        } else if (status != null) {
            invoices = invoiceRepository.findByOrgIdAndStatusOrderByInvoiceDateDesc(orgId, status);
        } else {
            invoices = invoiceRepository.findByOrgIdOrderByInvoiceDateDesc(orgId);
        }
        return invoices;
    }

    @Transactional(readOnly = true)
    public List<CustomerInvoice> listOutstandingInvoices(Long orgId) {
        return invoiceRepository.findByOrgIdAndStatusInOrderByDueDateAsc(orgId,
            List.of(InvoiceStatus.OPEN, InvoiceStatus.PARTIALLY_PAID));
    }

    /**
     * Sum of outstanding balances across the customer's open invoices, for credit limit checks
     * by callers.
     */
    @Transactional(readOnly = true)
    public BigDecimal getCustomerExposure(Long orgId, Long customerId) {
        return listInvoices(orgId, null, customerId).stream()
            .filter(CustomerInvoice::isPayable)
            .map(CustomerInvoice::getOutstanding)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    CustomerInvoice lockInvoice(Long orgId, Long invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId, orgId)
            .orElseThrow(() -> new NotFoundException("Customer invoice not found: " + invoiceId));
    }
}
