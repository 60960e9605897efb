package com.learn.venue.bean;

import com.learn.venue.model.trade.OrderEntity;

import java.util.List;

// 下单结果：账本中的订单、本次成交、成交后的盘口
public record OrderResultBean(OrderEntity order, List<TradeRecord> trades, OrderBookBean orderBook) {
}
