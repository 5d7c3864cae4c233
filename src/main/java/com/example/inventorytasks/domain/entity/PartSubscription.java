package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A user e-mail address subscribed ("starred") to a part
 */
@Entity
@Table(name = "part_subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_part_subscription", columnNames = {"part_id", "email"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PartSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "part_id", nullable = false)
    private Long partId;

    @Column(name = "email", nullable = false, length = 254)
    private String email;
}
