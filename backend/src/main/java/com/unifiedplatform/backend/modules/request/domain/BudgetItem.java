package com.unifiedplatform.backend.modules.request.domain;

import java.math.BigDecimal;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class BudgetItem {

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    protected BudgetItem() {
    }

    public BudgetItem(String name, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("budget amount must be >= 0");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.amount = amount;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
