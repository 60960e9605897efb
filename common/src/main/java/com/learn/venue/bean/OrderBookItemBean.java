package com.learn.venue.bean;

import java.math.BigDecimal;

// 盘口中的一个挂单
public record OrderBookItemBean(String id, BigDecimal price, long quantity, long originalQuantity) {
}
