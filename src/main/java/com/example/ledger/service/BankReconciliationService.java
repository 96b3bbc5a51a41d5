package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.BankAccount;
import com.example.ledger.domain.BankTxn;
import com.example.ledger.domain.ReconcileMatch;
import com.example.ledger.domain.ReconcileMatch.MatchSource;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.BankAccountRepository;
import com.example.ledger.repository.BankTxnRepository;
import com.example.ledger.repository.ReconcileMatchRepository;
import com.example.ledger.service.BankStatementCsvParser.BankStatementRow;
import com.example.ledger.service.ReconcileCandidateProvider.Candidate;

/**
 * Imports bank statements and links each statement row to the payment, refund or cash movement
 * that explains it. A row has at most one match; {@code reconciled} is true exactly while it has
 * one. Nothing here posts to the ledger.
 */
@Service
@Transactional
public class BankReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(BankReconciliationService.class);

  private final BankAccountRepository bankAccountRepository;
  private final BankTxnRepository bankTxnRepository;
  private final ReconcileMatchRepository matchRepository;
  private final AccountRepository accountRepository;
  private final BankStatementCsvParser csvParser;
  private final ReconcileCandidateProvider candidateProvider;
  private final AuditService auditService;
  private final LedgerProperties properties;

  public BankReconciliationService(
      BankAccountRepository bankAccountRepository,
      BankTxnRepository bankTxnRepository,
      ReconcileMatchRepository matchRepository,
      AccountRepository accountRepository,
      BankStatementCsvParser csvParser,
      ReconcileCandidateProvider candidateProvider,
      AuditService auditService,
      LedgerProperties properties) {
    this.bankAccountRepository = bankAccountRepository;
    this.bankTxnRepository = bankTxnRepository;
    this.matchRepository = matchRepository;
    this.accountRepository = accountRepository;
    this.csvParser = csvParser;
    this.candidateProvider = candidateProvider;
    this.auditService = auditService;
    this.properties = properties;
  }

  /** Rows written and rows skipped as duplicates by one import. */
  public record ImportResult(int imported, int duplicates, List<BankTxn> transactions) {}

  /**
   * Creates a bank account, or updates it when {@code bankAccountId} is given.
   *
   * @throws ValidationException if the name is blank or the GL account is unknown
   */
  public BankAccount upsertBankAccount(
      Long orgId,
      Long bankAccountId,
      String name,
      String accountNumber,
      String currency,
      Long glAccountId,
      Long userId) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Bank account name is required");
    }
    if (glAccountId != null && accountRepository.findByIdAndOrgId(glAccountId, orgId).isEmpty()) {
      throw new ValidationException("GL account not found: " + glAccountId);
    }

    BankAccount bankAccount;
    if (bankAccountId != null) {
      bankAccount = getBankAccount(orgId, bankAccountId);
      bankAccount.setName(name.trim());
    } else {
      bankAccountRepository
          .findByOrgIdAndName(orgId, name.trim())
          .ifPresent(
              existing -> {
                throw new ValidationException("Bank account already exists: " + name.trim());
              });
      bankAccount = new BankAccount(orgId, name.trim());
    }
    bankAccount.setAccountNumber(accountNumber);
    bankAccount.setCurrency(currency);
    bankAccount.setGlAccountId(glAccountId);
    bankAccount = bankAccountRepository.save(bankAccount);

    auditService.logEvent(
        orgId,
        userId,
        bankAccountId == null ? "BANK_ACCOUNT_CREATED" : "BANK_ACCOUNT_UPDATED",
        "BankAccount",
        bankAccount.getId(),
        "Bank account " + bankAccount.getName());
    return bankAccount;
  }

  @Transactional(readOnly = true)
  public List<BankAccount> listBankAccounts(Long orgId) {
    return bankAccountRepository.findByOrgIdOrderByName(orgId);
  }

  @Transactional(readOnly = true)
  public BankAccount getBankAccount(Long orgId, Long bankAccountId) {
    return bankAccountRepository
        .findByIdAndOrgId(bankAccountId, orgId)
        .orElseThrow(() -> new NotFoundException("Bank account not found: " + bankAccountId));
  }

  /**
   * Imports a CSV statement as unreconciled rows. A row identical in date, amount and description
   * to one already stored for the account, or earlier in the same file, is skipped.
   *
   * @throws com.example.ledger.exception.InvalidFormatException if the text is empty,
   *     header-only, or has no readable row
   */
  public ImportResult importCsv(Long orgId, Long bankAccountId, String text, Long userId) {
    BankAccount bankAccount = getBankAccount(orgId, bankAccountId);
    List<BankStatementRow> rows = csvParser.parse(text);

    Set<String> seen = new HashSet<>();
    List<BankTxn> newTxns = new ArrayList<>();
    int duplicates = 0;
    for (BankStatementRow row : rows) {
      String key = row.date() + "|" + row.amount() + "|" + row.description();
      if (!seen.add(key)
          || bankTxnRepository.existsByBankAccount_IdAndTxnDateAndAmountAndDescription(
              bankAccount.getId(), row.date(), row.amount(), row.description())) {
        duplicates++;
        continue;
      }
      BankTxn txn = new BankTxn(orgId, bankAccount, row.date(), row.amount(), row.description());
      txn.setReference(row.reference());
      newTxns.add(txn);
    }
    List<BankTxn> saved = bankTxnRepository.saveAll(newTxns);

    log.info(
        "Imported {} statement rows into bank account {} ({} duplicates skipped)",
        saved.size(),
        bankAccount.getName(),
        duplicates);
    auditService.logEvent(
        orgId,
        userId,
        "BANK_STATEMENT_IMPORTED",
        "BankAccount",
        bankAccount.getId(),
        "Imported " + saved.size() + " rows",
        Map.of("imported", saved.size(), "duplicates", duplicates));
    return new ImportResult(saved.size(), duplicates, saved);
  }

  /**
   * Manually matches a statement row to an internal record.
   *
   * @throws InvalidStateException if the row is already reconciled
   */
  public ReconcileMatch matchTransaction(
      Long orgId, Long bankTxnId, MatchSource source, String sourceId, Long userId) {
    if (source == null || sourceId == null || sourceId.isBlank()) {
      throw new ValidationException("Match source and source id are required");
    }
    BankTxn txn = lockTxn(orgId, bankTxnId);
    ReconcileMatch match = createMatch(txn, source, sourceId, false, userId);
    log.info("Matched bank transaction {} to {} {}", txn.getId(), source, sourceId);
    return match;
  }

  /**
   * Removes the match from a statement row and marks it unreconciled again.
   *
   * @throws InvalidStateException if the row has no match
   */
  public void unmatchTransaction(Long orgId, Long bankTxnId, Long userId) {
    BankTxn txn = lockTxn(orgId, bankTxnId);
    ReconcileMatch match =
        matchRepository
            .findByBankTxn_Id(txn.getId())
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Bank transaction " + bankTxnId + " is not reconciled"));
    matchRepository.delete(match);
    txn.setReconciled(false);
    bankTxnRepository.save(txn);

    log.info("Unmatched bank transaction {} from {} {}", txn.getId(), match.getSource(),
        match.getSourceId());
    auditService.logEvent(
        orgId,
        userId,
        "BANK_MATCH_REMOVED",
        "BankTxn",
        txn.getId(),
        "Removed match to " + match.getSource() + " " + match.getSourceId());
  }

  /**
   * Matches unreconciled rows to candidates with the same absolute amount dated within the
   * configured window of the row. The first candidate found wins; candidates that already have a
   * match are passed over.
   *
   * @param from first statement date to consider, or null for no lower bound
   * @param to last statement date to consider, or null for no upper bound
   * @return the matches created
   */
  public List<ReconcileMatch> autoMatch(
      Long orgId, Long bankAccountId, LocalDate from, LocalDate to, Long userId) {
    BankAccount bankAccount = getBankAccount(orgId, bankAccountId);
    List<BankTxn> unreconciled =
        bankTxnRepository
            .findByBankAccount_IdAndReconciledFalseOrderByTxnDateAsc(bankAccount.getId())
            .stream()
            .filter(t -> from == null || !t.getTxnDate().isBefore(from))
            .filter(t -> to == null || !t.getTxnDate().isAfter(to))
            .toList();
    if (unreconciled.isEmpty()) {
      return List.of();
    }

    int window = properties.getReconciliation().getMatchWindowDays();
    LocalDate earliest = unreconciled.get(0).getTxnDate().minusDays(window);
    LocalDate latest = unreconciled.get(unreconciled.size() - 1).getTxnDate().plusDays(window);
    List<Candidate> candidates = candidateProvider.findCandidates(orgId, earliest, latest);

    Set<String> taken = new HashSet<>();
    List<ReconcileMatch> created = new ArrayList<>();
    for (BankTxn txn : unreconciled) {
      BigDecimal amount = txn.getAmount().abs();
      for (Candidate candidate : candidates) {
        String key = candidate.source() + ":" + candidate.sourceId();
        if (taken.contains(key)
            || candidate.amount().abs().compareTo(amount) != 0
            || Math.abs(candidate.date().toEpochDay() - txn.getTxnDate().toEpochDay()) > window
            || matchRepository.existsByOrgIdAndSourceAndSourceId(
                orgId, candidate.source(), candidate.sourceId())) {
          continue;
        }
        created.add(createMatch(txn, candidate.source(), candidate.sourceId(), true, userId));
        taken.add(key);
        break;
      }
    }

    log.info(
        "Auto-matched {} of {} unreconciled rows in bank account {}",
        created.size(),
        unreconciled.size(),
        bankAccount.getName());
    return created;
  }

  @Transactional(readOnly = true)
  public List<BankTxn> getUnreconciled(Long orgId, Long bankAccountId) {
    BankAccount bankAccount = getBankAccount(orgId, bankAccountId);
    return bankTxnRepository.findByBankAccount_IdAndReconciledFalseOrderByTxnDateAsc(
        bankAccount.getId());
  }

  @Transactional(readOnly = true)
  public List<BankTxn> listTransactions(Long orgId, Long bankAccountId) {
    BankAccount bankAccount = getBankAccount(orgId, bankAccountId);
    return bankTxnRepository.findByBankAccount_IdOrderByTxnDateAsc(bankAccount.getId());
  }

  private BankTxn lockTxn(Long orgId, Long bankTxnId) {
    return bankTxnRepository
        .findByIdForUpdate(bankTxnId, orgId)
        .orElseThrow(() -> new NotFoundException("Bank transaction not found: " + bankTxnId));
  }

  private ReconcileMatch createMatch(
      BankTxn txn, MatchSource source, String sourceId, boolean auto, Long userId) {
    if (txn.isReconciled() || matchRepository.existsByBankTxn_Id(txn.getId())) {
      throw new InvalidStateException("Bank transaction " + txn.getId() + " is already reconciled");
    }
    ReconcileMatch match =
        matchRepository.save(new ReconcileMatch(txn, source, sourceId, auto, userId));
    txn.setReconciled(true);
    bankTxnRepository.save(txn);

    auditService.logEvent(
        txn.getOrgId(),
        userId,
        "BANK_MATCH_CREATED",
        "BankTxn",
        txn.getId(),
        (auto ? "Auto-matched" : "Matched") + " to " + source + " " + sourceId);
    return match;
  }
}
