package com.moonscribe.rag.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Override of an action's default cost. Only active rows are consulted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "credit_costs")
public class CreditCostEntry {

    @Id
    private String action;

    @Column(nullable = false)
    private int creditsCost;

    @Builder.Default
    private boolean active = true;

    private String description;
}
