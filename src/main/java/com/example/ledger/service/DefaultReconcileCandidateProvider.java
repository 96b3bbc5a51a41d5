package com.example.ledger.service;

import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.ReconcileMatch.MatchSource;
import com.example.ledger.repository.CustomerCreditRefundRepository;
import com.example.ledger.repository.CustomerReceiptRepository;
import com.example.ledger.repository.JournalEntryRepository;
import com.example.ledger.repository.VendorCreditRefundRepository;
import com.example.ledger.repository.VendorPaymentRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Offers vendor payments and customer receipts as PAYMENT candidates, and credit note refunds
 * plus point-of-sale refunds as REFUND candidates. Source ids carry a kind prefix so records of
 * different tables never collide under one match source.
 */
@Component
@Transactional(readOnly = true)
public class DefaultReconcileCandidateProvider implements ReconcileCandidateProvider {

    static final String VENDOR_PAYMENT = "vendor-payment:";
    static final String CUSTOMER_RECEIPT = "customer-receipt:";
    static final String VENDOR_CREDIT_REFUND = "vendor-credit-refund:";
    static final String CUSTOMER_CREDIT_REFUND = "customer-credit-refund:";
    static final String POS_REFUND = "pos-refund:";

    private final VendorPaymentRepository vendorPaymentRepository;
    private final CustomerReceiptRepository customerReceiptRepository;
    private final VendorCreditRefundRepository vendorCreditRefundRepository;
    private final CustomerCreditRefundRepository customerCreditRefundRepository;
    private final JournalEntryRepository journalEntryRepository;

    public DefaultReconcileCandidateProvider(VendorPaymentRepository vendorPaymentRepository,
                                             CustomerReceiptRepository customerReceiptRepository,
                                             VendorCreditRefundRepository vendorCreditRefundRepository,
                                             CustomerCreditRefundRepository customerCreditRefundRepository,
                                             JournalEntryRepository journalEntryRepository) {
        this.vendorPaymentRepository = vendorPaymentRepository;
        this.customerReceiptRepository = customerReceiptRepository;
        this.vendorCreditRefundRepository = vendorCreditRefundRepository;
        this.customerCreditRefundRepository = customerCreditRefundRepository;
        this.journalEntryRepository = journalEntryRepository;
    }

    @Override
    public List<Candidate> findCandidates(Long orgId, LocalDate from, LocalDate to) {
        List<Candidate> candidates = new ArrayList<>();

        vendorPaymentRepository.findByOrgIdAndPaidAtBetween(orgId, from, to).forEach(p ->
            candidates.add(new Candidate(MatchSource.PAYMENT, VENDOR_PAYMENT + p.getId(),
                p.getPaidAt(), p.getAmount().negate())));
        customerReceiptRepository.findByOrgIdAndReceivedAtBetween(orgId, from, to).forEach(r ->
            candidates.add(new Candidate(MatchSource.PAYMENT, CUSTOMER_RECEIPT + r.getId(),
                r.getReceivedAt(), r.getAmount())));

        vendorCreditRefundRepository.findByCreditNote_OrgIdAndRefundDateBetween(orgId, from, to)
            .forEach(r -> candidates.add(new Candidate(MatchSource.REFUND,
                VENDOR_CREDIT_REFUND + r.getId(), r.getRefundDate(), r.getAmount())));
        customerCreditRefundRepository.findByCreditNote_OrgIdAndRefundDateBetween(orgId, from, to)
            .forEach(r -> candidates.add(new Candidate(MatchSource.REFUND,
                CUSTOMER_CREDIT_REFUND + r.getId(), r.getRefundDate(), r.getAmount().negate())));

        // Refunds posted by the point-of-sale adapter exist only as journal entries
        journalEntryRepository.findByOrgIdAndSourceAndStatusInAndEntryDateBetween(orgId,
                JournalSource.REFUND, List.of(JournalEntry.Status.POSTED), from, to)
            .forEach(e -> candidates.add(new Candidate(MatchSource.REFUND,
                POS_REFUND + e.getSourceId(), e.getEntryDate(), e.getTotalDebits().negate())));

        candidates.sort(Comparator.comparing(Candidate::date));
        return candidates;
    }
}
