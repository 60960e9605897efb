package com.learn.venue.bean;

import java.util.List;

// 某一时刻的盘口快照，两侧均按优先级排列
public record OrderBookBean(long sequenceId, List<OrderBookItemBean> buy, List<OrderBookItemBean> sell) {

    public static final OrderBookBean EMPTY = new OrderBookBean(0, List.of(), List.of());
}
