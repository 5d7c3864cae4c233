package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Stock-relevant view of a part. Parts form a tree through {@code parent}
 * (template / variant); a parent's stock and minimum are tracked on its own row.
 */
@Entity
@Table(name = "parts", indexes = {
        @Index(name = "idx_part_parent_id", columnList = "parent_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Part {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Part parent;

    @Column(name = "minimum_stock", nullable = false, precision = 19, scale = 5)
    @Builder.Default
    private BigDecimal minimumStock = BigDecimal.ZERO;

    @Column(name = "in_stock", nullable = false, precision = 19, scale = 5)
    @Builder.Default
    private BigDecimal inStock = BigDecimal.ZERO;

    public boolean isLowOnStock() {
        return inStock.compareTo(minimumStock) < 0;
    }

    /**
     * This part followed by its parents, nearest first, ending at the root.
     */
    public List<Part> ancestorsIncludingSelf() {
        var chain = new ArrayList<Part>();
        var seen = new HashSet<Long>();
        var current = this;
        while (current != null) {
            if (current.getId() != null && !seen.add(current.getId())) {
                throw new IllegalStateException("Cycle in part hierarchy at part " + current.getId());
            }
            chain.add(current);
            current = current.getParent();
        }
        return chain;
    }

    public String getFullName() {
        return parent == null ? name : parent.getFullName() + " | " + name;
    }
}
