package com.example.ledger.service;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.UnbalancedEntryException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.JournalEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The only writer of journal entries. Ensures all accounting rules are enforced:
 * - Debits must equal credits (within one minor unit)
 * - Every line names an active account of the organization and has exactly one positive side
 * - The entry date is not inside a locked period
 * - Posted entries are immutable; a reversal is a new entry plus a status flag
 * - One business event yields at most one entry
 */
@Service
@Transactional
public class JournalService {

    private static final Logger log = LoggerFactory.getLogger(JournalService.class);

    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final JournalEntryRepository entryRepository;
    private final AccountRepository accountRepository;
    private final FiscalPeriodService periodService;
    private final AuditService auditService;

    public JournalService(JournalEntryRepository entryRepository,
                          AccountRepository accountRepository,
                          FiscalPeriodService periodService,
                          AuditService auditService) {
        this.entryRepository = entryRepository;
        this.accountRepository = accountRepository;
        this.periodService = periodService;
        this.auditService = auditService;
    }

    /**
     * Creates a manual DRAFT entry. Drafts do not affect reports, so no period check is made.
     *
     * @throws UnbalancedEntryException if debits and credits differ
     */
    public JournalEntry createDraft(Long orgId, LocalDate date, String memo, Long branchId,
                                    List<JournalLineRequest> lines, Long userId) {
        if (date == null) {
            throw new ValidationException("Entry date is required");
        }
        JournalEntry entry = new JournalEntry(orgId, date, memo, JournalSource.MANUAL, null);
        entry.setBranchId(branchId);
        entry.setCreatedById(userId);
        buildLines(orgId, branchId, lines).forEach(entry::addLine);
        assertBalanced(entry);

        entry = entryRepository.save(entry);

        auditService.logEvent(orgId, userId, "JOURNAL_DRAFT_CREATED", "JournalEntry", entry.getId(),
            "Created draft entry dated " + date + (memo != null ? ": " + memo : ""));
        return entry;
    }

    /**
     * Posts a DRAFT entry.
     *
     * @throws InvalidStateException if the entry is not a draft
     * @throws ValidationException if a line's account was deactivated after the draft was made
     * @throws com.example.ledger.exception.PeriodLockedException if its date is in a locked period
     */
    public JournalEntry post(Long orgId, Long entryId, Long userId) {
        JournalEntry entry = lockEntry(orgId, entryId);
        if (!entry.isDraft()) {
            throw new InvalidStateException("Journal entry " + entryId + " is " + entry.getStatus()
                + "; only DRAFT entries can be posted");
        }
        for (JournalLine line : entry.getLines()) {
            if (!line.getAccount().isActive()) {
                throw new ValidationException("Account is inactive: " + line.getAccount().getCode()
                    + "; draft entry " + entryId + " cannot be posted");
            }
        }
        assertBalanced(entry);
        periodService.assertPostable(orgId, entry.getEntryDate());

        entry.markPosted(userId);
        entry = entryRepository.save(entry);

        log.info("Posted journal entry {} for org {}", entry.getId(), orgId);
        auditService.logEvent(orgId, userId, "JOURNAL_POSTED", "JournalEntry", entry.getId(),
            "Posted entry dated " + entry.getEntryDate());
        return entry;
    }

    /**
     * Validates and posts a system-generated entry in one step. A second request for the same
     * {@code (source, sourceId)} returns the entry already recorded instead of creating another.
     * A concurrent duplicate that commits first makes this transaction fail on commit with
     * {@link org.springframework.dao.DataIntegrityViolationException}; callers that own the
     * transaction re-read with {@link #findBySource}.
     */
    public JournalEntry postDirect(PostingRequest request) {
        if (request.date() == null || request.source() == null) {
            throw new ValidationException("Posting date and source are required");
        }
        if (request.sourceId() != null) {
            Optional<JournalEntry> existing = entryRepository.findFirstByOrgIdAndSourceAndSourceId(
                request.orgId(), request.source(), request.sourceId());
            if (existing.isPresent()) {
                log.warn("Duplicate posting ignored: {} {} already recorded as entry {}",
                    request.source(), request.sourceId(), existing.get().getId());
                return existing.get();
            }
        }

        JournalEntry entry = new JournalEntry(request.orgId(), request.date(), request.memo(),
            request.source(), request.sourceId());
        entry.setBranchId(request.branchId());
        entry.setCreatedById(request.userId());
        buildLines(request.orgId(), request.branchId(), request.lines()).forEach(entry::addLine);
        assertBalanced(entry);
        periodService.assertPostable(request.orgId(), request.date());

        entry.markPosted(request.userId());
        entry = entryRepository.save(entry);

        log.info("Posted {} entry {} for source id {}", request.source(), entry.getId(), request.sourceId());
        auditService.logEvent(request.orgId(), request.userId(), "JOURNAL_POSTED", "JournalEntry",
            entry.getId(), "Posted " + request.source() + " entry dated " + request.date());
        return entry;
    }

    public JournalEntry reverse(Long orgId, Long entryId, Long userId, LocalDate reversalDate) {
        return reverse(orgId, entryId, userId, reversalDate, JournalSource.REVERSAL,
            String.valueOf(entryId));
    }

    /**
     * Reverses a POSTED entry: creates a new POSTED entry with every line's sides swapped and
     * flips the original to REVERSED. The reversal date defaults to today and must be postable.
     *
     * @param source REVERSAL, or the void source of the document being voided
     * @param sourceId the original entry id, or the voided document id
     */
    public JournalEntry reverse(Long orgId, Long entryId, Long userId, LocalDate reversalDate,
                                JournalSource source, String sourceId) {
        JournalEntry original = lockEntry(orgId, entryId);
        if (original.isReversed()) {
            throw new InvalidStateException("Journal entry " + entryId + " is already reversed by entry "
                + original.getReversedByEntryId());
        }
        if (!original.isPosted()) {
            throw new InvalidStateException("Journal entry " + entryId + " is " + original.getStatus()
                + "; only POSTED entries can be reversed");
        }

        LocalDate date = reversalDate != null ? reversalDate : LocalDate.now();
        periodService.assertPostable(orgId, date);

        String memo = "Reversal of entry #" + entryId
            + (original.getMemo() != null ? ": " + original.getMemo() : "");
        JournalEntry reversal = new JournalEntry(orgId, date, memo, source, sourceId);
        reversal.setBranchId(original.getBranchId());
        reversal.setCreatedById(userId);
        reversal.setReversesEntryId(entryId);
        for (JournalLine line : original.getLines()) {
            reversal.addLine(line.inverted());
        }
        reversal.markPosted(userId);
        reversal = entryRepository.save(reversal);

        original.markReversed(userId, reversal.getId());
        entryRepository.save(original);

        log.info("Reversed journal entry {} with entry {} ({})", entryId, reversal.getId(), source);
        auditService.logEvent(orgId, userId, "JOURNAL_REVERSED", "JournalEntry", entryId,
            "Reversed entry #" + entryId + " by entry #" + reversal.getId());
        return reversal;
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(Long orgId, Long entryId) {
        return entryRepository.findByIdAndOrgId(entryId, orgId)
            .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId));
    }

    /**
     * Lists entries newest first. An unsorted page request is sorted by date then id, descending.
     */
    @Transactional(readOnly = true)
    public Page<JournalEntry> listEntries(Long orgId, JournalEntryFilter filter, Pageable pageable) {
        JournalEntryFilter criteria = filter != null ? filter : JournalEntryFilter.none();
        Pageable paging = pageable.getSort().isSorted() ? pageable
            : PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                Sort.by(Sort.Direction.DESC, "entryDate", "id"));
        return entryRepository.findAll(criteria.toSpecification(orgId), paging);
    }

    /**
     * Entries dated within the range with their lines loaded, oldest first. Either bound may be
     * null for an open range.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> listEntriesWithLines(Long orgId, LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : EARLIEST;
        LocalDate end = to != null ? to : LATEST;
        if (start.isAfter(end)) {
            throw new ValidationException("Export range starts after it ends: " + start + " > " + end);
        }
        return entryRepository.findWithLinesBetween(orgId, start, end);
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findBySource(Long orgId, JournalSource source, String sourceId) {
        return entryRepository.findFirstByOrgIdAndSourceAndSourceId(orgId, source, sourceId);
    }

    private JournalEntry lockEntry(Long orgId, Long entryId) {
        return entryRepository.findByIdForUpdate(entryId)
            .filter(e -> orgId.equals(e.getOrgId()))
            .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId));
    }

    private List<JournalLine> buildLines(Long orgId, Long entryBranchId, List<JournalLineRequest> requests) {
        if (requests == null || requests.size() < 2) {
            throw new ValidationException("A journal entry needs at least two lines");
        }
        List<JournalLine> lines = new ArrayList<>();
        int index = 0;
        for (JournalLineRequest request : requests) {
            index++;
            BigDecimal debit = Amounts.normalize(request.debit());
            BigDecimal credit = Amounts.normalize(request.credit());
            if (debit.signum() < 0 || credit.signum() < 0) {
                throw new ValidationException("Line " + index + " has a negative amount");
            }
            if (debit.signum() > 0 == credit.signum() > 0) {
                throw new ValidationException("Line " + index + " must have exactly one of debit or credit");
            }
            if (request.accountId() == null) {
                throw new ValidationException("Line " + index + " has no account");
            }
            Account account = accountRepository.findByIdAndOrgId(request.accountId(), orgId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + request.accountId()));
            if (!account.isActive()) {
                throw new ValidationException("Account is inactive: " + account.getCode());
            }
            Long branchId = request.branchId() != null ? request.branchId() : entryBranchId;
            JournalLine line = new JournalLine(account, branchId, debit, credit);
            line.setMemo(request.memo());
            lines.add(line);
        }
        return lines;
    }

    private void assertBalanced(JournalEntry entry) {
        if (!entry.isBalanced()) {
            throw new UnbalancedEntryException("Journal entry is unbalanced: debits="
                + entry.getTotalDebits().toPlainString() + ", credits="
                + entry.getTotalCredits().toPlainString());
        }
    }
}
