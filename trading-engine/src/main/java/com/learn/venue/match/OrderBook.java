package com.learn.venue.match;

import com.learn.venue.ApiError;
import com.learn.venue.ApiException;
import com.learn.venue.bean.OrderBookItemBean;
import com.learn.venue.enums.Side;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// 单侧订单簿，按价格优先、时间优先排序
public class OrderBook {
    public final Side side;
    final TreeMap<OrderKey, Order> book;
    // id -> key，用于按 id 撤单
    private final Map<String, OrderKey> index = new HashMap<>();

    public OrderBook(Side side) {
        this.side = side;
        this.book = new TreeMap<>(this.side == Side.BUY ? SORT_BUY : SORT_SELL);
    }

    public Order getFirst() {
        return book.isEmpty() ? null : book.firstEntry().getValue();
    }

    // 对手盘第一档能否与 limitPrice 成交，不能返回 null
    public Order bestMatch(BigDecimal limitPrice) {
        Order first = getFirst();
        if(first == null)
            return null;
        if(this.side == Side.SELL)
            return first.price.compareTo(limitPrice) <= 0 ? first : null;
        return first.price.compareTo(limitPrice) >= 0 ? first : null;
    }

    public void insert(Order order) {
        if(order.side != this.side)
            throw new IllegalArgumentException("Order side " + order.side + " does not match book " + this.side);
        if(order.quantity <= 0)
            throw new ApiException(ApiError.ORDER_INVALID_STATE, order.id, "Resting quantity must be positive.");
        if(this.index.containsKey(order.id))
            throw new ApiException(ApiError.ORDER_INVALID_STATE, order.id, "Order already in book.");
        OrderKey key = new OrderKey(order.sequenceId, order.price);
        this.book.put(key, order);
        this.index.put(order.id, key);
    }

    // 不存在返回 null
    public Order removeById(String id) {
        OrderKey key = this.index.remove(id);
        return key == null ? null : this.book.remove(key);
    }

    public boolean remove(Order order) {
        return removeById(order.id) != null;
    }

    public boolean contains(String id) {
        return this.index.containsKey(id);
    }

    public Order get(String id) {
        OrderKey key = this.index.get(id);
        return key == null ? null : this.book.get(key);
    }

    public int size() {
        return this.book.size();
    }

    // 逐笔列出挂单，顺序即撮合优先级
    public List<OrderBookItemBean> getOrderBook() {
        List<OrderBookItemBean> items = new ArrayList<>(this.book.size());
        for(Order order : this.book.values())
            items.add(new OrderBookItemBean(order.id, order.price, order.quantity, order.originalQuantity));
        return items;
    }

    @Override
    public String toString() {
        if(this.book.isEmpty())
            return "(empty)";
        List<String> orders = new ArrayList<>(10);
        for(Order order : this.book.values()) {
            orders.add(" " + order.price + " " + order.quantity + " " + order);
        }
        if(side == Side.SELL)
            Collections.reverse(orders);
        return String.join("\n", orders);
    }

    // 定义买卖盘的订单排序规则
    private static final Comparator<OrderKey> SORT_SELL = new Comparator<OrderKey>() {
        @Override
        public int compare(OrderKey o1, OrderKey o2) {
            // 卖方价格低优先
            int cmp = o1.price().compareTo(o2.price());
            // 时间早在前
            return cmp == 0 ? Long.compare(o1.sequenceId(), o2.sequenceId()) : cmp;
        }
    };
    private static final Comparator<OrderKey> SORT_BUY = new Comparator<OrderKey>() {
        @Override
        public int compare(OrderKey o1, OrderKey o2) {
            // 买方价格高优先
            int cmp = o2.price().compareTo(o1.price());
            // 时间早在前
            return cmp == 0 ? Long.compare(o1.sequenceId(), o2.sequenceId()) : cmp;
        }
    };
}
