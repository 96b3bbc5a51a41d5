package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Per-organization mapping of a payment method to the cash or bank account that receives or
 * disburses the money.
 */
@Entity
@Table(name = "payment_method_mapping", uniqueConstraints = {
    @UniqueConstraint(name = "uk_payment_method_mapping", columnNames = {"org_id", "method"})
})
public class PaymentMethodMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public PaymentMethodMapping() {
    }

    public PaymentMethodMapping(Long orgId, PaymentMethod method, Account account) {
        this.orgId = orgId;
        this.method = method;
        this.account = account;
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

    public PaymentMethod getMethod() {
        return method;
    }

    public Account getAccount() {
        return account;
    }

    public void setAccount(Account account) {
        this.account = account;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
