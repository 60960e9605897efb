package com.learn.venue.match;

import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.Side;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

// 只能在撮合线程中修改
@Component
public class MatchEngine {
    public final OrderBook buyBook = new OrderBook(Side.BUY);
    public final OrderBook sellBook = new OrderBook(Side.SELL);
    // 全部成交记录，只追加
    private final List<TradeRecord> tradeHistory = new ArrayList<>();

    public MatchResult processOrder(Order order) {
        return switch (order.side) {
            case BUY -> processOrder(order, this.sellBook, this.buyBook);
            case SELL -> processOrder(order, this.buyBook, this.sellBook);
        };
    }

    private MatchResult processOrder(Order takerOrder, OrderBook makerBook, OrderBook anotherBook) {
        MatchResult matchResult = new MatchResult(takerOrder);
        for(;;) {
            if(takerOrder.quantity <= 0)
                break; // Taker 订单完全成交
            Order makerOrder = makerBook.bestMatch(takerOrder.price);
            if(makerOrder == null)
                break; // 没有可成交的对手盘
            // 成交数量为两者较小值
            long matchedQuantity = Math.min(takerOrder.quantity, makerOrder.quantity);
            // 以 Maker 价格成交
            matchResult.add(makerOrder.price, matchedQuantity, makerOrder);
            takerOrder.quantity -= matchedQuantity;
            makerOrder.quantity -= matchedQuantity;
            if(makerOrder.quantity == 0) {
                // 对手盘完全成交后，从订单簿删除
                makerBook.remove(makerOrder);
                matchResult.touchedRestingOrders.remove(makerOrder.id);
            } else {
                matchResult.touchedRestingOrders.put(makerOrder.id, makerOrder.quantity);
            }
        }
        if(takerOrder.quantity > 0) {
            // 未成交部分放入订单簿
            anotherBook.insert(takerOrder);
        }
        this.tradeHistory.addAll(matchResult.trades);
        return matchResult;
    }

    // 直接挂单，不撮合
    public void insert(Order order) {
        bookOf(order.side).insert(order);
    }

    public Order removeById(Side side, String id) {
        return bookOf(side).removeById(id);
    }

    // 从任一侧撤单，不存在返回 null
    public Order cancel(String id) {
        Order order = this.buyBook.removeById(id);
        return order != null ? order : this.sellBook.removeById(id);
    }

    // side 方向订单在 limitPrice 下可成交的最优对手价
    public BigDecimal bestOpposingPrice(Side side, BigDecimal limitPrice) {
        Order order = bookOf(side.negate()).bestMatch(limitPrice);
        return order == null ? null : order.price;
    }

    public boolean contains(String id) {
        return this.buyBook.contains(id) || this.sellBook.contains(id);
    }

    // 不在簿中返回 0
    public long remainingQuantity(String id) {
        Order order = this.buyBook.get(id);
        if(order == null)
            order = this.sellBook.get(id);
        return order == null ? 0 : order.quantity;
    }

    public OrderBookBean getOrderBook(long sequenceId) {
        return new OrderBookBean(sequenceId, this.buyBook.getOrderBook(), this.sellBook.getOrderBook());
    }

    // 最近 n 条成交，新的在前
    public List<TradeRecord> getRecentTrades(int n) {
        int size = this.tradeHistory.size();
        List<TradeRecord> recent = new ArrayList<>(Math.min(n, size));
        for(int i = size - 1; i >= 0 && recent.size() < n; i--)
            recent.add(this.tradeHistory.get(i));
        return recent;
    }

    public int tradeCount() {
        return this.tradeHistory.size();
    }

    private OrderBook bookOf(Side side) {
        return side == Side.BUY ? this.buyBook : this.sellBook;
    }
}
