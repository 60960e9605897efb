package com.learn.venue.enums;

public enum OrderStatus {
    // 等待成交 (remaining == original)
    OPEN(false),

    // 部分成交 (original > remaining > 0)
    PARTIAL(false),

    // 完全成交 (remaining == 0)
    FILLED(true),

    // 完全成交前被取消
    CANCELED(true);

    // 订单是否处理完成
    public final boolean isFinalStatus;

    OrderStatus(boolean status) {
        this.isFinalStatus = status;
    }

    // 根据原始数量和剩余数量计算状态
    public static OrderStatus of(long originalQuantity, long remainingQuantity, boolean canceled) {
        if(canceled)
            return CANCELED;
        if(remainingQuantity <= 0)
            return FILLED;
        if(remainingQuantity < originalQuantity)
            return PARTIAL;
        return OPEN;
    }
}
