package com.learn.venue.bean;

import java.math.BigDecimal;

public record TradeRecord(String buyOrderId, String sellOrderId, BigDecimal price, long quantity) {
}
