package com.learn.venue.match;

import com.learn.venue.enums.Side;

import java.math.BigDecimal;

// 订单簿中的挂单，只有剩余数量可变
public class Order {

    public final String id;
    // 进入订单簿的顺序，同价位先到先得
    public final long sequenceId;
    public final String userId;
    public final Side side;
    public final BigDecimal price;
    public final long originalQuantity;
    public final long createdAt;

    // 剩余数量
    public long quantity;

    public Order(String id, long sequenceId, String userId, Side side, BigDecimal price,
                 long quantity, long originalQuantity, long createdAt) {
        this.id = id;
        this.sequenceId = sequenceId;
        this.userId = userId;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.originalQuantity = originalQuantity;
        this.createdAt = createdAt;
    }

    public Order(String id, long sequenceId, String userId, Side side, BigDecimal price, long quantity, long createdAt) {
        this(id, sequenceId, userId, side, price, quantity, quantity, createdAt);
    }

    @Override
    public String toString() {
        return "Order [id=" + id + ", sequenceId=" + sequenceId + ", side=" + side + ", price=" + price
                + ", quantity=" + quantity + "/" + originalQuantity + "]";
    }
}
