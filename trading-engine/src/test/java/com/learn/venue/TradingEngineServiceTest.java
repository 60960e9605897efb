package com.learn.venue;

import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.OrderBookItemBean;
import com.learn.venue.bean.OrderRequestBean;
import com.learn.venue.bean.OrderResultBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.OrderStatus;
import com.learn.venue.enums.Side;
import com.learn.venue.match.MatchEngine;
import com.learn.venue.message.MarketUpdateMessage;
import com.learn.venue.model.trade.OrderEntity;
import com.learn.venue.model.trade.TradeEntity;
import com.learn.venue.sequencer.CycleSequencer;
import com.learn.venue.store.LedgerService;
import com.learn.venue.store.LedgerTestConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@SpringJUnitConfig(LedgerTestConfiguration.class)
public class TradingEngineServiceTest {

    @Autowired
    LedgerService ledgerService;
    @Autowired
    JdbcTemplate jdbcTemplate;

    final List<CycleSequencer> sequencers = new ArrayList<>();
    final List<MarketUpdateMessage> updates = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void clean() {
        jdbcTemplate.update("DELETE FROM trades");
        jdbcTemplate.update("DELETE FROM orders");
    }

    @AfterEach
    void shutdown() {
        sequencers.forEach(CycleSequencer::shutdown);
    }

    @Test
    void testRestThenPartialFill() {
        var engine = createTradingEngineService();
        OrderResultBean r1 = engine.submit(request("b1", Side.BUY, "5.00", 10), "user-a");
        assertTrue(r1.trades().isEmpty());
        assertEquals(OrderStatus.OPEN, r1.order().status);
        assertEquals(List.of("b1"), ids(engine.snapshot().buy()));

        OrderResultBean r2 = engine.submit(request("s1", Side.SELL, "5.00", 4), null);
        assertEquals(1, r2.trades().size());
        TradeRecord trade = r2.trades().get(0);
        assertEquals("b1", trade.buyOrderId());
        assertEquals("s1", trade.sellOrderId());
        assertEquals(0, bd("5.00").compareTo(trade.price()));
        assertEquals(4, trade.quantity());
        assertEquals(OrderStatus.FILLED, r2.order().status);

        OrderBookItemBean resting = engine.snapshot().buy().get(0);
        assertEquals(6, resting.quantity());
        assertEquals(10, resting.originalQuantity());
        OrderEntity ledger = ledgerService.getOrder("b1");
        assertEquals(OrderStatus.PARTIAL, ledger.status);
        assertEquals(6, ledger.quantity);
        assertEquals("user-a", ledger.userId);
        assertEquals(r2.orderBook(), engine.snapshot());
    }

    @Test
    void testTimePriorityWithinPrice() {
        var engine = createTradingEngineService();
        engine.submit(request("s-early", Side.SELL, "9.00", 3), null);
        engine.submit(request("s-late", Side.SELL, "9.00", 5), null);
        OrderResultBean result = engine.submit(request("b1", Side.BUY, "9.50", 6), null);

        assertEquals(2, result.trades().size());
        assertEquals("s-early", result.trades().get(0).sellOrderId());
        assertEquals(3, result.trades().get(0).quantity());
        assertEquals("s-late", result.trades().get(1).sellOrderId());
        assertEquals(3, result.trades().get(1).quantity());
        // 成交价为挂单价
        assertEquals(0, bd("9.00").compareTo(result.trades().get(1).price()));
        assertEquals(OrderStatus.FILLED, result.order().status);
        assertFalse(ids(engine.snapshot().buy()).contains("b1"));

        assertEquals(OrderStatus.FILLED, ledgerService.getOrder("s-early").status);
        assertEquals(OrderStatus.PARTIAL, ledgerService.getOrder("s-late").status);
        assertEquals(2, ledgerService.getOrder("s-late").quantity);
        assertEquals(2, ledgerService.getTrades(10).size());
    }

    @Test
    void testGeneratedId() {
        var engine = createTradingEngineService();
        OrderResultBean result = engine.submit(request(null, Side.BUY, "1.00", 1), null);
        assertNotNull(result.order().id);
        assertNotNull(ledgerService.getOrder(result.order().id));
    }

    @Test
    void testCancel() {
        var engine = createTradingEngineService();
        engine.submit(request("b1", Side.BUY, "5.00", 10), null);
        engine.submit(request("s1", Side.SELL, "5.00", 4), null);
        assertTrue(engine.cancel("b1"));
        assertTrue(engine.snapshot().buy().isEmpty());
        OrderEntity order = ledgerService.getOrder("b1");
        assertEquals(OrderStatus.CANCELED, order.status);
        assertEquals(0, order.quantity);
        assertEquals(10, order.originalQuantity);
    }

    @Test
    void testCancelTwice() {
        var engine = createTradingEngineService();
        engine.submit(request("b1", Side.BUY, "5.00", 10), null);
        engine.cancel("b1");
        OrderEntity before = ledgerService.getOrder("b1");
        ApiException e = assertThrows(ApiException.class, () -> engine.cancel("b1"));
        assertEquals(ApiError.ORDER_NOT_FOUND, e.error.error());
        assertEquals(before.updatedAt, ledgerService.getOrder("b1").updatedAt);
    }

    @Test
    void testCancelUnknown() {
        var engine = createTradingEngineService();
        ApiException e = assertThrows(ApiException.class, () -> engine.cancel("nope"));
        assertEquals(ApiError.ORDER_NOT_FOUND, e.error.error());
    }

    @Test
    void testCancelFilled() {
        var engine = createTradingEngineService();
        engine.submit(request("s1", Side.SELL, "5.00", 2), null);
        engine.submit(request("b1", Side.BUY, "5.00", 3), null);
        OrderBookBean book = engine.snapshot();
        ApiException e = assertThrows(ApiException.class, () -> engine.cancel("s1"));
        assertEquals(ApiError.ORDER_INVALID_STATE, e.error.error());
        assertEquals(book, engine.snapshot());
        assertEquals(OrderStatus.FILLED, ledgerService.getOrder("s1").status);
        assertEquals(OrderStatus.PARTIAL, ledgerService.getOrder("b1").status);
    }

    @Test
    void testValidationLeavesStateUnchanged() {
        var engine = createTradingEngineService();
        engine.submit(request("b1", Side.BUY, "5.00", 1), null);
        OrderBookBean book = engine.snapshot();
        int updateCount = updates.size();

        assertEquals(ApiError.PARAMETER_INVALID, assertThrows(ApiException.class,
                () -> engine.submit(request("x", Side.SELL, "0", 1), null)).error.error());
        assertEquals(ApiError.PARAMETER_INVALID, assertThrows(ApiException.class,
                () -> engine.submit(request("x", null, "1.00", 1), null)).error.error());
        // id 已在订单簿中
        assertEquals(ApiError.PARAMETER_INVALID, assertThrows(ApiException.class,
                () -> engine.submit(request("b1", Side.SELL, "9.00", 1), null)).error.error());

        assertEquals(book, engine.snapshot());
        assertEquals(updateCount, updates.size());
        assertEquals(1, ledgerService.getOrders(10).size());
    }

    @Test
    void testReusedLedgerIdRejected() {
        var engine = createTradingEngineService();
        engine.submit(request("s0", Side.SELL, "1.00", 1), null);
        engine.submit(request("x1", Side.BUY, "1.00", 1), null);
        engine.submit(request("b3", Side.BUY, "0.50", 1), null);
        engine.cancel("b3");
        engine.submit(request("s2", Side.SELL, "2.00", 2), null);
        OrderBookBean book = engine.snapshot();
        int updateCount = updates.size();

        // x1 已成交，b3 已撤销，都不在簿中但已在账本中
        ApiException e = assertThrows(ApiException.class,
                () -> engine.submit(request("x1", Side.BUY, "2.00", 5), null));
        assertEquals(ApiError.PARAMETER_INVALID, e.error.error());
        assertEquals("id", e.error.data());
        assertEquals(ApiError.PARAMETER_INVALID, assertThrows(ApiException.class,
                () -> engine.submit(request("b3", Side.BUY, "2.00", 1), null)).error.error());

        assertEquals(book, engine.snapshot());
        assertEquals(updateCount, updates.size());
        assertEquals(1, engine.matchEngine.tradeCount());
        OrderEntity x1 = ledgerService.getOrder("x1");
        assertEquals(OrderStatus.FILLED, x1.status);
        assertEquals(0, x1.quantity);
        assertEquals(1, x1.originalQuantity);
        assertEquals(ApiError.ORDER_INVALID_STATE, assertThrows(ApiException.class,
                () -> engine.cancel("x1")).error.error());

        // 之后的成交不会改写旧记录
        OrderResultBean next = engine.submit(request("b4", Side.BUY, "2.00", 2), null);
        assertEquals(List.of(new TradeRecord("b4", "s2", bd("2.00"), 2)), next.trades());
        assertEquals(OrderStatus.FILLED, ledgerService.getOrder("s2").status);
        assertEquals(1, ledgerService.getOrder("x1").originalQuantity);
    }

    @Test
    void testPersistenceFailureKeepsBook() {
        LedgerService ledger = mock(LedgerService.class, delegatesTo(this.ledgerService));
        doThrow(new DataAccessResourceFailureException("ledger unavailable")).when(ledger)
                .recordOrderCycle(argThat(o -> o != null && "b2".equals(o.id)), any(), anyLong(), anyLong(), any());
        var engine = createTradingEngineService(false, ledger);
        engine.submit(request("x1", Side.BUY, "1.00", 1), null);
        engine.submit(request("s2", Side.SELL, "2.00", 1), null);
        int updateCount = updates.size();

        ApiException e = assertThrows(ApiException.class,
                () -> engine.submit(request("b2", Side.BUY, "2.00", 3), null));
        assertEquals(ApiError.PERSISTENCE_FAILED, e.error.error());

        // 订单簿已撮合且不回滚
        assertTrue(engine.snapshot().sell().isEmpty());
        assertEquals(List.of("b2", "x1"), ids(engine.snapshot().buy()));
        assertEquals(2, engine.snapshot().buy().get(0).quantity());
        assertEquals(updateCount, updates.size());
        // 账本保持失败前的状态
        assertNull(ledgerService.getOrder("b2"));
        assertEquals(OrderStatus.OPEN, ledgerService.getOrder("s2").status);
        assertTrue(ledgerService.getTrades(10).isEmpty());

        // 后续周期不受影响
        OrderResultBean next = engine.submit(request("s3", Side.SELL, "2.00", 1), null);
        assertEquals(List.of(new TradeRecord("b2", "s3", bd("2.00"), 1)), next.trades());
        assertEquals(OrderStatus.FILLED, ledgerService.getOrder("s3").status);
        assertEquals(1, ledgerService.getTrades(10).size());
        assertEquals(1, engine.matchEngine.remainingQuantity("b2"));
    }

    @Test
    void testMarketUpdates() {
        var engine = createTradingEngineService();
        engine.submit(request("b1", Side.BUY, "5.00", 10), null);
        engine.submit(request("s1", Side.SELL, "5.00", 4), null);
        engine.cancel("b1");
        assertEquals(3, updates.size());
        MarketUpdateMessage second = updates.get(1);
        assertEquals(MarketUpdateMessage.TYPE, second.type);
        assertEquals(1, second.trades.size());
        assertEquals(6, second.book.buy().get(0).quantity());
        assertTrue(updates.get(2).book.buy().isEmpty());
        assertEquals(engine.recentTrades(), second.trades);
    }

    @Test
    void testListenerFailureIgnored() {
        var engine = createTradingEngineService();
        engine.marketUpdateListener = message -> {
            throw new IllegalStateException("subscriber gone");
        };
        OrderResultBean result = engine.submit(request("b1", Side.BUY, "5.00", 10), null);
        assertEquals(OrderStatus.OPEN, result.order().status);
        assertTrue(engine.cancel("b1"));
    }

    @Test
    void testRestoreBook() {
        var engine = createTradingEngineService();
        engine.submit(request("b1", Side.BUY, "5.00", 10), null);
        engine.submit(request("b2", Side.BUY, "5.00", 2), null);
        engine.submit(request("s1", Side.SELL, "6.00", 3), null);
        engine.submit(request("s2", Side.SELL, "5.00", 4), null);
        engine.submit(request("b3", Side.BUY, "4.00", 1), null);
        engine.cancel("b3");
        OrderBookBean book = engine.snapshot();

        var restored = createTradingEngineService(true);
        assertEquals(describe(book.buy()), describe(restored.snapshot().buy()));
        assertEquals(describe(book.sell()), describe(restored.snapshot().sell()));
        assertEquals(List.of("b1:6/10@5", "b2:2/2@5"), describe(restored.snapshot().buy()));
        // 新周期继续递增
        OrderResultBean r = restored.submit(request("s3", Side.SELL, "5.00", 8), null);
        assertEquals(List.of("b1", "b2"), r.trades().stream().map(TradeRecord::buyOrderId).toList());
        assertTrue(r.order().sequenceId > 5);
    }

    @Test
    void testConcurrentRandom() throws Exception {
        var engine = createTradingEngineService();
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<OrderResultBean>> futures = new ArrayList<>();
            for(int t = 0; t < 8; t++) {
                final Random r = new Random(123456789L + t);
                for(int i = 0; i < 40; i++) {
                    Side side = r.nextBoolean() ? Side.BUY : Side.SELL;
                    String price = (95 + r.nextInt(11)) + "." + (10 + r.nextInt(90));
                    long quantity = 1 + r.nextInt(9);
                    futures.add(callers.submit(() -> engine.submit(request(null, side, price, quantity), null)));
                }
            }
            for(Future<OrderResultBean> f : futures)
                f.get(30, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }
        engine.cycleSequencer.runExclusive(() -> {
            engine.validate();
            return null;
        });

        List<OrderEntity> orders = ledgerService.getOrders(1000);
        List<TradeEntity> trades = ledgerService.getTrades(1000);
        assertEquals(320, orders.size());
        assertEquals(engine.matchEngine.tradeCount(), trades.size());

        Map<String, Long> bought = new HashMap<>();
        Map<String, Long> sold = new HashMap<>();
        for(TradeEntity trade : trades) {
            bought.merge(trade.buyOrderId, trade.quantity, Long::sum);
            sold.merge(trade.sellOrderId, trade.quantity, Long::sum);
        }
        for(OrderEntity order : orders) {
            long filled = order.side == Side.BUY ? bought.getOrDefault(order.id, 0L) : sold.getOrDefault(order.id, 0L);
            assertTrue(filled <= order.originalQuantity);
            // 账本与订单簿一致
            assertEquals(order.originalQuantity - filled, order.quantity, order.toString());
            assertEquals(engine.matchEngine.remainingQuantity(order.id), order.quantity, order.toString());
            assertEquals(OrderStatus.of(order.originalQuantity, order.quantity, false), order.status);
        }
    }

    TradingEngineService createTradingEngineService() {
        return createTradingEngineService(false);
    }

    TradingEngineService createTradingEngineService(boolean restore) {
        return createTradingEngineService(restore, this.ledgerService);
    }

    TradingEngineService createTradingEngineService(boolean restore, LedgerService ledger) {
        CycleSequencer sequencer = new CycleSequencer();
        this.sequencers.add(sequencer);
        var engine = new TradingEngineService();
        engine.matchEngine = new MatchEngine();
        engine.cycleSequencer = sequencer;
        engine.ledgerService = ledger;
        engine.marketUpdateListener = this.updates::add;
        engine.debugMode = true;
        engine.restoreBookOnStartup = restore;
        engine.init();
        return engine;
    }

    OrderRequestBean request(String id, Side side, String price, long quantity) {
        return new OrderRequestBean(id, side, bd(price), BigDecimal.valueOf(quantity));
    }

    List<String> ids(List<OrderBookItemBean> items) {
        return items.stream().map(OrderBookItemBean::id).toList();
    }

    // 账本中的价格精度不同，按数值比较
    List<String> describe(List<OrderBookItemBean> items) {
        return items.stream().map(item -> item.id() + ":" + item.quantity() + "/" + item.originalQuantity()
                + "@" + item.price().stripTrailingZeros().toPlainString()).toList();
    }

    BigDecimal bd(String s) {
        return new BigDecimal(s);
    }
}
