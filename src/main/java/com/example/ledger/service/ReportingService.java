package com.example.ledger.service;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.Amounts;
import com.example.ledger.domain.CustomerInvoice;
import com.example.ledger.domain.CustomerInvoice.InvoiceStatus;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.VendorBill;
import com.example.ledger.domain.VendorBill.BillStatus;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.CustomerInvoiceRepository;
import com.example.ledger.repository.JournalLineRepository;
import com.example.ledger.repository.VendorBillRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Service for generating financial reports.
 * Produces Trial Balance, P&L and Balance Sheet by aggregating journal lines on read, plus
 * AP and AR aging from the open documents. Posted and reversed entries both count, so a
 * reversal pair nets to zero.
 */
@Service
@Transactional(readOnly = true)
public class ReportingService {

    static final List<JournalEntry.Status> REPORTED_STATUSES =
        List.of(JournalEntry.Status.POSTED, JournalEntry.Status.REVERSED);

    private final AccountRepository accountRepository;
    private final JournalLineRepository lineRepository;
    private final VendorBillRepository billRepository;
    private final CustomerInvoiceRepository invoiceRepository;

    public ReportingService(AccountRepository accountRepository,
                            JournalLineRepository lineRepository,
                            VendorBillRepository billRepository,
                            CustomerInvoiceRepository invoiceRepository) {
        this.accountRepository = accountRepository;
        this.lineRepository = lineRepository;
        this.billRepository = billRepository;
        this.invoiceRepository = invoiceRepository;
    }

    /**
     * Generates a Trial Balance of every account with activity up to and including {@code asOf}.
     *
     * @param branchId restricts to lines of one branch, or null for the whole organization
     */
    public TrialBalance getTrialBalance(Long orgId, LocalDate asOf, Long branchId) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();
        Map<Long, AccountTotals> totals = totalsAsOf(orgId, date, branchId);

        List<TrialBalanceLine> lines = new ArrayList<>();
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;

        for (Account account : accountRepository.findByOrgIdOrderByCode(orgId)) {
            AccountTotals t = totals.get(account.getId());
            if (t == null) {
                continue;
            }
            BigDecimal debits = Amounts.normalize(t.getDebits());
            BigDecimal credits = Amounts.normalize(t.getCredits());

            // Skip accounts with no activity
            if (debits.signum() == 0 && credits.signum() == 0) {
                continue;
            }

            lines.add(new TrialBalanceLine(account, debits, credits, account.normalBalance(debits, credits)));
            totalDebits = totalDebits.add(debits);
            totalCredits = totalCredits.add(credits);
        }

        return new TrialBalance(date, branchId, lines, totalDebits, totalCredits);
    }

    /**
     * Generates a Profit & Loss statement for the inclusive date range.
     */
    public ProfitAndLoss getProfitAndLoss(Long orgId, LocalDate from, LocalDate to, Long branchId) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new ValidationException("A profit and loss report needs a date range with from <= to");
        }
        Map<Long, AccountTotals> totals = branchId == null
            ? index(lineRepository.sumByAccountBetween(orgId, REPORTED_STATUSES, from, to))
            : index(lineRepository.sumByAccountBetweenAndBranch(orgId, REPORTED_STATUSES, from, to, branchId));

        List<ReportLine> revenue = balances(orgId, AccountType.REVENUE, totals);
        List<ReportLine> cogs = balances(orgId, AccountType.COGS, totals);
        List<ReportLine> expenses = balances(orgId, AccountType.EXPENSE, totals);

        BigDecimal totalRevenue = sum(revenue);
        BigDecimal totalCogs = sum(cogs);
        BigDecimal totalExpenses = sum(expenses);
        BigDecimal grossProfit = totalRevenue.subtract(totalCogs);
        BigDecimal netProfit = grossProfit.subtract(totalExpenses);

        return new ProfitAndLoss(from, to, branchId, revenue, cogs, expenses,
            totalRevenue, totalCogs, totalExpenses, grossProfit, netProfit);
    }

    /**
     * Generates a Balance Sheet as of the given date. Revenue less COGS and expenses to date is
     * shown as current earnings inside equity, so a balanced ledger always satisfies
     * assets = liabilities + equity.
     */
    public BalanceSheet getBalanceSheet(Long orgId, LocalDate asOf, Long branchId) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();
        Map<Long, AccountTotals> totals = totalsAsOf(orgId, date, branchId);

        List<ReportLine> assets = balances(orgId, AccountType.ASSET, totals);
        List<ReportLine> liabilities = balances(orgId, AccountType.LIABILITY, totals);
        List<ReportLine> equity = balances(orgId, AccountType.EQUITY, totals);

        BigDecimal currentEarnings = sum(balances(orgId, AccountType.REVENUE, totals))
            .subtract(sum(balances(orgId, AccountType.COGS, totals)))
            .subtract(sum(balances(orgId, AccountType.EXPENSE, totals)));

        BigDecimal totalAssets = sum(assets);
        BigDecimal totalLiabilities = sum(liabilities);
        BigDecimal totalEquity = sum(equity).add(currentEarnings);

        return new BalanceSheet(date, branchId, assets, liabilities, equity, currentEarnings,
            totalAssets, totalLiabilities, totalEquity);
    }

    /**
     * Ages unpaid vendor bills by days past due at {@code asOf}.
     */
    public AgingReport getApAging(Long orgId, LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();
        List<AgingLine> lines = new ArrayList<>();
        for (VendorBill bill : billRepository.findByOrgIdAndStatusInOrderByDueDateAsc(orgId,
                List.of(BillStatus.OPEN, BillStatus.PARTIALLY_PAID))) {
            if (bill.getBillDate().isAfter(date)) {
                continue;
            }
            lines.add(new AgingLine(bill.getId(), bill.getNumber(), bill.getVendor().getName(),
                bill.getBillDate(), bill.getDueDate(), bill.getTotal(), bill.getOutstanding(),
                ChronoUnit.DAYS.between(bill.getDueDate(), date)));
        }
        return AgingReport.of(date, lines);
    }

    /**
     * Ages unpaid customer invoices by days past due at {@code asOf}.
     */
    public AgingReport getArAging(Long orgId, LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();
        List<AgingLine> lines = new ArrayList<>();
        for (CustomerInvoice invoice : invoiceRepository.findByOrgIdAndStatusInOrderByDueDateAsc(orgId,
                List.of(InvoiceStatus.OPEN, InvoiceStatus.PARTIALLY_PAID))) {
            if (invoice.getInvoiceDate().isAfter(date)) {
                continue;
            }
            lines.add(new AgingLine(invoice.getId(), invoice.getNumber(), invoice.getCustomer().getName(),
                invoice.getInvoiceDate(), invoice.getDueDate(), invoice.getTotal(), invoice.getOutstanding(),
                ChronoUnit.DAYS.between(invoice.getDueDate(), date)));
        }
        return AgingReport.of(date, lines);
    }

    private Map<Long, AccountTotals> totalsAsOf(Long orgId, LocalDate asOf, Long branchId) {
        return branchId == null
            ? index(lineRepository.sumByAccountAsOf(orgId, REPORTED_STATUSES, asOf))
            : index(lineRepository.sumByAccountAsOfAndBranch(orgId, REPORTED_STATUSES, asOf, branchId));
    }

    private static Map<Long, AccountTotals> index(List<AccountTotals> totals) {
        Map<Long, AccountTotals> byAccount = new HashMap<>();
        for (AccountTotals t : totals) {
            byAccount.put(t.getAccountId(), t);
        }
        return byAccount;
    }

    private List<ReportLine> balances(Long orgId, AccountType type, Map<Long, AccountTotals> totals) {
        List<ReportLine> lines = new ArrayList<>();
        for (Account account : accountRepository.findByOrgIdAndTypeOrderByCode(orgId, type)) {
            AccountTotals t = totals.get(account.getId());
            if (t == null) {
                continue;
            }
            BigDecimal balance = account.normalBalance(Amounts.normalize(t.getDebits()),
                Amounts.normalize(t.getCredits()));
            if (balance.signum() != 0) {
                lines.add(new ReportLine(account, balance));
            }
        }
        return lines;
    }

    private static BigDecimal sum(List<ReportLine> lines) {
        return lines.stream()
            .map(ReportLine::amount)
            .reduce(BigDecimal.ZERO.setScale(Amounts.SCALE), BigDecimal::add);
    }

    // Record classes for report data
    public record TrialBalance(
        LocalDate asOf,
        Long branchId,  // null means all branches
        List<TrialBalanceLine> lines,
        BigDecimal totalDebits,
        BigDecimal totalCredits
    ) {
        public boolean isBalanced() {
            return Amounts.isBalanced(totalDebits, totalCredits);
        }
    }

    public record TrialBalanceLine(Account account, BigDecimal debits, BigDecimal credits, BigDecimal balance) {}

    public record ProfitAndLoss(
        LocalDate from,
        LocalDate to,
        Long branchId,
        List<ReportLine> revenue,
        List<ReportLine> cogs,
        List<ReportLine> expenses,
        BigDecimal totalRevenue,
        BigDecimal totalCogs,
        BigDecimal totalExpenses,
        BigDecimal grossProfit,
        BigDecimal netProfit
    ) {}

    /** An account and its balance in the account's normal direction. */
    public record ReportLine(Account account, BigDecimal amount) {}

    public record BalanceSheet(
        LocalDate asOf,
        Long branchId,
        List<ReportLine> assets,
        List<ReportLine> liabilities,
        List<ReportLine> equity,
        BigDecimal currentEarnings,
        BigDecimal totalAssets,
        BigDecimal totalLiabilities,
        BigDecimal totalEquity
    ) {
        public boolean isBalanced() {
            return Amounts.isBalanced(totalAssets, totalLiabilities.add(totalEquity));
        }
    }

    public record AgingLine(
        Long documentId,
        String number,
        String counterparty,
        LocalDate documentDate,
        LocalDate dueDate,
        BigDecimal total,
        BigDecimal outstanding,
        long daysOverdue  // negative while not yet due
    ) {}

    /**
     * Outstanding amounts by days past due: up to 30 (including not yet due), 31-60, 61-90 and
     * over 90.
     */
    public record AgingReport(
        LocalDate asOf,
        List<AgingLine> lines,
        BigDecimal current,
        BigDecimal days31To60,
        BigDecimal days61To90,
        BigDecimal over90,
        BigDecimal total
    ) {
        static AgingReport of(LocalDate asOf, List<AgingLine> lines) {
            BigDecimal current = BigDecimal.ZERO;
            BigDecimal days31To60 = BigDecimal.ZERO;
            BigDecimal days61To90 = BigDecimal.ZERO;
            BigDecimal over90 = BigDecimal.ZERO;
            for (AgingLine line : lines) {
                if (line.daysOverdue() <= 30) {
                    current = current.add(line.outstanding());
                } else if (line.daysOverdue() <= 60) {
                    days31To60 = days31To60.add(line.outstanding());
                } else if (line.daysOverdue() <= 90) {
                    days61To90 = days61To90.add(line.outstanding());
                } else {
                    over90 = over90.add(line.outstanding());
                }
            }
            BigDecimal total = current.add(days31To60).add(days61To90).add(over90);
            return new AgingReport(asOf, List.copyOf(lines), current, days31To60, days61To90, over90, total);
        }
    }
}
