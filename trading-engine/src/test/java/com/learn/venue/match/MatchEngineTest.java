package com.learn.venue.match;

import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MatchEngineTest {
    long sequenceId = 0;
    MatchEngine engine;

    @BeforeEach
    void init() {
        this.engine = new MatchEngine();
    }

    @Test
    void processTest() {
        List<Order> orders = List.of( //
                createOrder(Side.BUY, "12300.21", 102), // 0
                createOrder(Side.BUY, "12305.39", 33), // 1
                createOrder(Side.SELL, "12305.39", 11), // 2
                createOrder(Side.SELL, "12300.01", 33), // 3
                createOrder(Side.SELL, "12400.00", 10), // 4
                createOrder(Side.SELL, "12400.00", 20), // 5
                createOrder(Side.SELL, "12390.00", 15), // 6
                createOrder(Side.BUY, "12400.01", 55), // 7
                createOrder(Side.BUY, "12300.00", 77));
        List<TradeRecord> trades = new ArrayList<>();
        for(Order order : orders) {
            MatchResult res = this.engine.processOrder(order);
            trades.addAll(res.trades);
        }
        assertArrayEquals(new TradeRecord[] { //
                new TradeRecord("o1", "o2", bd("12305.39"), 11), //
                new TradeRecord("o1", "o3", bd("12305.39"), 22), //
                new TradeRecord("o0", "o3", bd("12300.21"), 11), //
                new TradeRecord("o7", "o6", bd("12390.00"), 15), //
                new TradeRecord("o7", "o4", bd("12400.00"), 10), //
                new TradeRecord("o7", "o5", bd("12400.00"), 20), //
        }, trades.toArray(TradeRecord[]::new));
        // 剩余: buy o7 10@12400.01, o0 91@12300.21, o8 77@12300.00
        assertEquals(List.of("o7", "o0", "o8"), ids(engine.buyBook));
        assertEquals(10, engine.remainingQuantity("o7"));
        assertEquals(91, engine.remainingQuantity("o0"));
        assertTrue(engine.sellBook.getOrderBook().isEmpty());
    }

    @Test
    void testRestThenPartial() {
        Order buy = createOrder(Side.BUY, "5.00", 10);
        MatchResult r1 = engine.processOrder(buy);
        assertTrue(r1.trades.isEmpty());
        assertEquals(10, engine.remainingQuantity(buy.id));

        MatchResult r2 = engine.processOrder(createOrder(Side.SELL, "5.00", 4));
        assertEquals(List.of(new TradeRecord(buy.id, "o1", bd("5.00"), 4)), r2.trades);
        assertEquals(6, engine.remainingQuantity(buy.id));
        assertEquals(Map.of(buy.id, 6L), r2.touchedRestingOrders);
        assertEquals(0, r2.takerOrder.quantity);
        assertFalse(engine.contains("o1"));
    }

    @Test
    void testFifoWithinPrice() {
        Order earlier = createOrder(Side.SELL, "9.00", 3);
        Order later = createOrder(Side.SELL, "9.00", 5);
        engine.processOrder(earlier);
        engine.processOrder(later);
        Order buy = createOrder(Side.BUY, "9.50", 6);
        MatchResult result = engine.processOrder(buy);
        assertEquals(List.of(
                new TradeRecord(buy.id, earlier.id, bd("9.00"), 3),
                new TradeRecord(buy.id, later.id, bd("9.00"), 3)), result.trades);
        assertEquals(0, buy.quantity);
        assertFalse(engine.contains(buy.id));
        assertFalse(engine.contains(earlier.id));
        assertEquals(2, engine.remainingQuantity(later.id));
        assertEquals(Map.of(later.id, 2L), result.touchedRestingOrders);
    }

    @Test
    void testRestingPriceSetsTradePrice() {
        engine.processOrder(createOrder(Side.BUY, "10.00", 5));
        // 卖单报价更低，仍按挂单价成交
        MatchResult result = engine.processOrder(createOrder(Side.SELL, "9.00", 2));
        assertEquals(0, bd("10.00").compareTo(result.trades.get(0).price()));
    }

    @Test
    void testNoCross() {
        engine.processOrder(createOrder(Side.SELL, "10.00", 5));
        MatchResult result = engine.processOrder(createOrder(Side.BUY, "9.99", 5));
        assertTrue(result.trades.isEmpty());
        assertEquals(1, engine.buyBook.size());
        assertEquals(0, bd("10.00").compareTo(engine.bestOpposingPrice(Side.BUY, bd("10.00"))));
        assertNull(engine.bestOpposingPrice(Side.BUY, bd("9.99")));
    }

    @Test
    void testCancelAndSnapshot() {
        engine.processOrder(createOrder(Side.BUY, "1.00", 1));
        engine.processOrder(createOrder(Side.SELL, "2.00", 1));
        assertEquals("o0", engine.cancel("o0").id);
        assertNull(engine.cancel("o0"));
        assertNull(engine.cancel("missing"));
        OrderBookBean book = engine.getOrderBook(7);
        assertEquals(7, book.sequenceId());
        assertTrue(book.buy().isEmpty());
        assertEquals("o1", book.sell().get(0).id());
    }

    @Test
    void testRecentTrades() {
        engine.processOrder(createOrder(Side.SELL, "1.00", 10));
        engine.processOrder(createOrder(Side.BUY, "1.00", 1));
        engine.processOrder(createOrder(Side.BUY, "1.00", 2));
        engine.processOrder(createOrder(Side.BUY, "1.00", 3));
        List<TradeRecord> recent = engine.getRecentTrades(2);
        assertEquals(2, recent.size());
        assertEquals(3, recent.get(0).quantity());
        assertEquals(2, recent.get(1).quantity());
        assertEquals(3, engine.getRecentTrades(50).size());
        assertEquals(3, engine.tradeCount());
    }

    List<String> ids(OrderBook book) {
        return book.getOrderBook().stream().map(item -> item.id()).toList();
    }

    Order createOrder(Side side, String price, long quantity) {
        String id = "o" + sequenceId;
        this.sequenceId++;
        return new Order(id, sequenceId, null, side, bd(price), quantity, 1000 + sequenceId);
    }

    BigDecimal bd(String s) {
        return new BigDecimal(s);
    }
}
