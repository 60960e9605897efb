package com.learn.venue.match;

import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.Side;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MatchResult {
    public final Order takerOrder;
    public final List<TradeRecord> trades = new ArrayList<>();
    // 部分成交后仍在簿中的对手单: id -> 剩余数量
    public final Map<String, Long> touchedRestingOrders = new LinkedHashMap<>();

    public MatchResult(Order takerOrder) {
        this.takerOrder = takerOrder;
    }

    void add(BigDecimal price, long matchedQuantity, Order makerOrder) {
        if(takerOrder.side == Side.BUY)
            this.trades.add(new TradeRecord(takerOrder.id, makerOrder.id, price, matchedQuantity));
        else
            this.trades.add(new TradeRecord(makerOrder.id, takerOrder.id, price, matchedQuantity));
    }

    @Override
    public String toString() {
        if(trades.isEmpty())
            return "No matched.";
        return trades.size() + " matched: " +
                String.join(", ", trades.stream()
                        .map(TradeRecord::toString)
                        .toArray(String[]::new));
    }
}
