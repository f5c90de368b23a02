package com.chicu.gridbot.strategy.grid.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(
        name = "grid_levels",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_grid_level_identity",
                columnNames = {"symbol", "level_index", "side"}
        )
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridLevelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false)
    private String symbol;

    @Column(name = "level_index", nullable = false)
    private Integer levelIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private OrderSide side;

    @Column(name = "amount", nullable = false, precision = 38, scale = 18)
    private BigDecimal amount;   // объём в BASE

    @Column(name = "price", nullable = false, precision = 38, scale = 18)
    private BigDecimal price;

    @Column(name = "order_ref")
    private String orderRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LevelStatus status;

    @Column(name = "entry_price", precision = 38, scale = 18)
    private BigDecimal entryPrice;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
