package com.learn.venue.model.trade;

import com.learn.venue.enums.OrderStatus;
import com.learn.venue.enums.Side;
import com.learn.venue.model.support.EntitySupport;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

// 账本中的订单记录，是订单簿的派生视图
@Entity
@Table(name = "orders")
public class OrderEntity implements EntitySupport {
    @Id
    @Column(nullable = false, updatable = false, length = VAR_CHAR_50)
    public String id;

    // 创建该订单的撮合周期
    @Column(nullable = false, updatable = false)
    public long sequenceId;

    @Column(nullable = true, updatable = false, length = VAR_CHAR_50)
    public String userId;

    @Column(nullable = false, updatable = false, length = VAR_ENUM)
    public Side side;

    @Column(nullable = false, updatable = false, precision = PRECISION, scale = SCALE)
    public BigDecimal price;

    // 剩余数量 / 原始数量
    @Column(nullable = false)
    public long quantity;

    @Column(nullable = false, updatable = false)
    public long originalQuantity;

    @Column(nullable = false, length = VAR_ENUM)
    public OrderStatus status;

    @Column(nullable = false, updatable = false)
    public long createdAt;

    @Column(nullable = false)
    public long updatedAt;

    @Override
    public boolean equals(Object o) {
        if(this == o)
            return true;
        if(o instanceof OrderEntity e) {
            return this.id.equals(e.id);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public String toString() {
        return "OrderEntity [id=" + id + ", sequenceId=" + sequenceId + ", userId=" + userId +
                ", side=" + side + ", price=" + price + ", quantity=" + quantity +
                ", originalQuantity=" + originalQuantity + ", status=" + status +
                ", createdAt=" + createdAt + ", updatedAt=" + updatedAt + "]";
    }
}
