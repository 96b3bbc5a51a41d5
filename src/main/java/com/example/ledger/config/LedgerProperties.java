package com.example.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger-wide settings bound from {@code ledger.*}. Account codes here are the defaults used when
 * a document or payment method does not name its own account.
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

  private final Accounts accounts = new Accounts();
  private final Periods periods = new Periods();
  private final Reconciliation reconciliation = new Reconciliation();

  public Accounts getAccounts() {
    return accounts;
  }

  public Periods getPeriods() {
    return periods;
  }

  public Reconciliation getReconciliation() {
    return reconciliation;
  }

  /** Default chart-of-accounts codes. */
  public static class Accounts {
    private String cash = "1000";
    private String bank = "1010";
    private String receivable = "1100";
    private String inventory = "1200";
    private String payable = "2000";
    private String taxPayable = "2100";
    private String equity = "3000";
    private String revenue = "4000";
    private String cogs = "5000";
    private String expense = "6000";

    public String getCash() {
      return cash;
    }

    public void setCash(String cash) {
      this.cash = cash;
    }

    public String getBank() {
      return bank;
    }

    public void setBank(String bank) {
      this.bank = bank;
    }

    public String getReceivable() {
      return receivable;
    }

    public void setReceivable(String receivable) {
      this.receivable = receivable;
    }

    public String getInventory() {
      return inventory;
    }

    public void setInventory(String inventory) {
      this.inventory = inventory;
    }

    public String getPayable() {
      return payable;
    }

    public void setPayable(String payable) {
      this.payable = payable;
    }

    public String getTaxPayable() {
      return taxPayable;
    }

    public void setTaxPayable(String taxPayable) {
      this.taxPayable = taxPayable;
    }

    public String getEquity() {
      return equity;
    }

    public void setEquity(String equity) {
      this.equity = equity;
    }

    public String getRevenue() {
      return revenue;
    }

    public void setRevenue(String revenue) {
      this.revenue = revenue;
    }

    public String getCogs() {
      return cogs;
    }

    public void setCogs(String cogs) {
      this.cogs = cogs;
    }

    public String getExpense() {
      return expense;
    }

    public void setExpense(String expense) {
      this.expense = expense;
    }
  }

  /** Fiscal period enforcement switches. */
  public static class Periods {
    /** Reject postings dated outside every fiscal period. */
    private boolean requirePeriod = false;

    /** Treat CLOSED periods as a hard barrier, same as LOCKED. */
    private boolean enforceClosed = false;

    public boolean isRequirePeriod() {
      return requirePeriod;
    }

    public void setRequirePeriod(boolean requirePeriod) {
      this.requirePeriod = requirePeriod;
    }

    public boolean isEnforceClosed() {
      return enforceClosed;
    }

    public void setEnforceClosed(boolean enforceClosed) {
      this.enforceClosed = enforceClosed;
    }
  }

  public static class Reconciliation {
    private int matchWindowDays = 3;

    public int getMatchWindowDays() {
      return matchWindowDays;
    }

    public void setMatchWindowDays(int matchWindowDays) {
      this.matchWindowDays = matchWindowDays;
    }
  }
}
