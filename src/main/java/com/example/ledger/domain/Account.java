package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A chart-of-accounts entry. Codes are unique per organization. Once a journal line references
 * the account its type is fixed; code and name may still be relabeled.
 */
@Entity
@Table(name = "account", uniqueConstraints = {
    @UniqueConstraint(name = "uk_account_org_code", columnNames = {"org_id", "code"})
})
public class Account {

    public enum AccountType {
        ASSET(true),
        LIABILITY(false),
        EQUITY(false),
        REVENUE(false),
        COGS(true),
        EXPENSE(true);

        private final boolean debitNormal;

        AccountType(boolean debitNormal) {
            this.debitNormal = debitNormal;
        }

        /** Assets, COGS and expenses grow with debits; the rest grow with credits. */
        public boolean isDebitNormal() {
            return debitNormal;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @NotBlank
    @Size(max = 20)
    @Column(nullable = false, length = 20)
    private String code;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, length = 100)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountType type;

    @Column(name = "parent_id")
    private Long parentId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Account() {
    }

    public Account(Long orgId, String code, String name, AccountType type) {
        this.orgId = orgId;
        this.code = code;
        this.name = name;
        this.type = type;
    }

    /**
     * Signed balance in this account's normal direction: debits minus credits for debit-normal
     * accounts, credits minus debits otherwise.
     */
    public BigDecimal normalBalance(BigDecimal debits, BigDecimal credits) {
        return type.isDebitNormal() ? debits.subtract(credits) : credits.subtract(debits);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOrgId() {
        return orgId;
    }

    public void setOrgId(Long orgId) {
        this.orgId = orgId;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public AccountType getType() {
        return type;
    }

    public void setType(AccountType type) {
        this.type = type;
    }

    public Long getParentId() {
        return parentId;
    }

    public void setParentId(Long parentId) {
        this.parentId = parentId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
