package com.learn.venue.model.trade;

import com.learn.venue.model.support.EntitySupport;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

// 只追加的成交记录
@Entity
@Table(name = "trades")
public class TradeEntity implements EntitySupport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    public long id;

    @Column(nullable = false, updatable = false)
    public long sequenceId;

    @Column(nullable = false, updatable = false, length = VAR_CHAR_50)
    public String buyOrderId;

    @Column(nullable = false, updatable = false, length = VAR_CHAR_50)
    public String sellOrderId;

    @Column(nullable = false, updatable = false, precision = PRECISION, scale = SCALE)
    public BigDecimal price;

    @Column(nullable = false, updatable = false)
    public long quantity;

    @Column(nullable = false, updatable = false)
    public long createdAt;

    @Override
    public String toString() {
        return "TradeEntity [id=" + id + ", sequenceId=" + sequenceId + ", buyOrderId=" + buyOrderId +
                ", sellOrderId=" + sellOrderId + ", price=" + price + ", quantity=" + quantity +
                ", createdAt=" + createdAt + "]";
    }
}
