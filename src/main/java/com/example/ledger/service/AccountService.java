package com.example.ledger.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.MissingAccountMappingException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.JournalLineRepository;

/** Chart of accounts for each organization. */
@Service
@Transactional
public class AccountService {

  private final AccountRepository accountRepository;
  private final JournalLineRepository journalLineRepository;
  private final AuditService auditService;
  private final LedgerProperties properties;

  public AccountService(
      AccountRepository accountRepository,
      JournalLineRepository journalLineRepository,
      AuditService auditService,
      LedgerProperties properties) {
    this.accountRepository = accountRepository;
    this.journalLineRepository = journalLineRepository;
    this.auditService = auditService;
    this.properties = properties;
  }

  public Account createAccount(Long orgId, String code, String name, AccountType type, Long userId) {
    return createAccount(orgId, code, name, type, null, userId);
  }

  /**
   * Creates a new account with optional parent and audit logging.
   *
   * @param orgId the organization
   * @param code account code, unique within the organization
   * @param name account name
   * @param type account type
   * @param parentId optional parent account in the same organization
   * @param userId the user creating the account (for audit logging)
   * @return the created account
   * @throws ValidationException if code already exists or a field is missing
   * @throws NotFoundException if the parent does not exist in this organization
   */
  public Account createAccount(
      Long orgId, String code, String name, AccountType type, Long parentId, Long userId) {
    if (code == null || code.isBlank() || name == null || name.isBlank() || type == null) {
      throw new ValidationException("Account code, name and type are required");
    }
    if (accountRepository.existsByOrgIdAndCode(orgId, code)) {
      throw new ValidationException("Account code already exists: " + code);
    }
    if (parentId != null) {
      getAccount(orgId, parentId);
    }

    Account account = new Account(orgId, code, name, type);
    account.setParentId(parentId);
    account = accountRepository.save(account);

    auditService.logEvent(
        orgId,
        userId,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + code + " - " + name);

    return account;
  }

  /**
   * Relabels an account. The type may change only while no journal line references the account.
   */
  public Account updateAccount(
      Long orgId, Long accountId, String code, String name, AccountType type, Long userId) {
    Account account = getAccount(orgId, accountId);
    Map<String, Object> changes = new LinkedHashMap<>();

    if (code != null && !code.equals(account.getCode())) {
      if (accountRepository.existsByOrgIdAndCode(orgId, code)) {
        throw new ValidationException("Account code already exists: " + code);
      }
      changes.put("code", Map.of("from", account.getCode(), "to", code));
      account.setCode(code);
    }
    if (name != null && !name.equals(account.getName())) {
      changes.put("name", Map.of("from", account.getName(), "to", name));
      account.setName(name);
    }
    if (type != null && type != account.getType()) {
      if (journalLineRepository.existsByAccount_Id(accountId)) {
        throw new InvalidStateException(
            "Account " + account.getCode() + " is used by journal lines; its type cannot change");
      }
      changes.put("type", Map.of("from", account.getType().name(), "to", type.name()));
      account.setType(type);
    }

    if (changes.isEmpty()) {
      return account;
    }
    Account saved = accountRepository.save(account);
    auditService.logEvent(
        orgId,
        userId,
        "ACCOUNT_UPDATED",
        "Account",
        accountId,
        "Updated account: " + saved.getCode(),
        changes);
    return saved;
  }

  /**
   * Deactivates an account with audit logging. Existing lines are kept; new postings to the
   * account are refused.
   */
  public Account deactivateAccount(Long orgId, Long accountId, Long userId) {
    Account account = getAccount(orgId, accountId);
    account.setActive(false);
    account = accountRepository.save(account);

    auditService.logEvent(
        orgId,
        userId,
        "ACCOUNT_DEACTIVATED",
        "Account",
        accountId,
        "Deactivated account: " + account.getCode());
    return account;
  }

  /**
   * Creates the default chart using the configured codes. Codes that already exist are left
   * untouched, so calling this twice is harmless.
   */
  public List<Account> seedDefaultChart(Long orgId, Long userId) {
    LedgerProperties.Accounts codes = properties.getAccounts();
    seedIfMissing(orgId, codes.getCash(), "Cash on Hand", AccountType.ASSET, userId);
    seedIfMissing(orgId, codes.getBank(), "Bank Account", AccountType.ASSET, userId);
    seedIfMissing(orgId, codes.getReceivable(), "Accounts Receivable", AccountType.ASSET, userId);
    seedIfMissing(orgId, codes.getInventory(), "Inventory", AccountType.ASSET, userId);
    seedIfMissing(orgId, codes.getPayable(), "Accounts Payable", AccountType.LIABILITY, userId);
    seedIfMissing(orgId, codes.getTaxPayable(), "Tax Payable", AccountType.LIABILITY, userId);
    seedIfMissing(orgId, codes.getEquity(), "Owner's Equity", AccountType.EQUITY, userId);
    seedIfMissing(orgId, codes.getRevenue(), "Sales Revenue", AccountType.REVENUE, userId);
    seedIfMissing(orgId, codes.getCogs(), "Cost of Goods Sold", AccountType.COGS, userId);
    seedIfMissing(orgId, codes.getExpense(), "Operating Expenses", AccountType.EXPENSE, userId);
    return accountRepository.findByOrgIdOrderByCode(orgId);
  }

  private void seedIfMissing(Long orgId, String code, String name, AccountType type, Long userId) {
    if (!accountRepository.existsByOrgIdAndCode(orgId, code)) {
      createAccount(orgId, code, name, type, userId);
    }
  }

  @Transactional(readOnly = true)
  public Account getAccount(Long orgId, Long accountId) {
    return accountRepository
        .findByIdAndOrgId(accountId, orgId)
        .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
  }

  /**
   * Lists accounts, optionally narrowed to one type and to active accounts only.
   */
  @Transactional(readOnly = true)
  public List<Account> listAccounts(Long orgId, AccountType type, boolean activeOnly) {
    List<Account> accounts =
        type != null
            ? accountRepository.findByOrgIdAndTypeOrderByCode(orgId, type)
            : accountRepository.findByOrgIdOrderByCode(orgId);
    if (activeOnly) {
      accounts = accounts.stream().filter(Account::isActive).toList();
    }
    return accounts;
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByCode(Long orgId, String code) {
    return accountRepository.findByOrgIdAndCode(orgId, code);
  }

  /**
   * Looks up a configured control account; a missing one is a mapping problem, not a lookup miss.
   *
   * @param purpose human-readable role of the account, used in the error message
   */
  @Transactional(readOnly = true)
  public Account requireByCode(Long orgId, String code, String purpose) {
    return accountRepository
        .findByOrgIdAndCode(orgId, code)
        .orElseThrow(
            () ->
                new MissingAccountMappingException(
                    "No "
                        + purpose
                        + " account (code "
                        + code
                        + ") is configured for organization "
                        + orgId));
  }
}
