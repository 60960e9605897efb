package com.learn.venue;

import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.OrderRequestBean;
import com.learn.venue.bean.OrderResultBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.OrderStatus;
import com.learn.venue.enums.Side;
import com.learn.venue.match.MatchEngine;
import com.learn.venue.match.MatchResult;
import com.learn.venue.match.Order;
import com.learn.venue.match.OrderBook;
import com.learn.venue.message.MarketUpdateMessage;
import com.learn.venue.model.trade.OrderEntity;
import com.learn.venue.notify.MarketUpdateListener;
import com.learn.venue.sequencer.CycleSequencer;
import com.learn.venue.store.LedgerService;
import com.learn.venue.support.LoggerSupport;
import com.learn.venue.util.IdUtil;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 撮合服务入口。
 * 下单和撤单都经过 {@link CycleSequencer} 串行执行：撮合、刷新快照、写账本、推送行情。
 * 订单簿是剩余数量的唯一依据，账本写入失败时订单簿不回滚。
 */
@Component
public class TradingEngineService extends LoggerSupport {

    @Value("#{exchangeConfiguration.debugMode}")
    boolean debugMode = false;
    @Value("#{exchangeConfiguration.recentTradeLimit}")
    int recentTradeLimit = 50;
    @Value("#{exchangeConfiguration.restoreBookOnStartup}")
    boolean restoreBookOnStartup = false;

    @Autowired
    MatchEngine matchEngine;
    @Autowired
    CycleSequencer cycleSequencer;
    @Autowired
    LedgerService ledgerService;
    @Autowired(required = false)
    MarketUpdateListener marketUpdateListener;

    // 上一个撮合周期的 sequenceId，只在撮合线程中读写
    private long lastSequenceId = 0;

    // 每个周期结束后发布的不可变快照，供其他线程读取
    private volatile OrderBookBean latestOrderBook = OrderBookBean.EMPTY;
    private volatile List<TradeRecord> latestTrades = List.of();

    @PostConstruct
    public void init() {
        cycleSequencer.runExclusive(() -> {
            this.lastSequenceId = ledgerService.getMaxSequenceId();
            if(restoreBookOnStartup)
                restoreBook();
            refreshMarket(this.lastSequenceId);
            logger.info("trading engine started at sequence {}.", this.lastSequenceId);
            return null;
        });
    }

    public OrderResultBean submit(OrderRequestBean request, String userId) {
        request.validate();
        return cycleSequencer.runExclusive(() -> createOrder(request, userId));
    }

    public boolean cancel(String orderId) {
        return cycleSequencer.runExclusive(() -> cancelOrder(orderId));
    }

    public OrderBookBean snapshot() {
        return this.latestOrderBook;
    }

    // 新的在前
    public List<TradeRecord> recentTrades() {
        return this.latestTrades;
    }

    OrderResultBean createOrder(OrderRequestBean request, String userId) {
        String orderId = request.id == null ? IdUtil.generateUniqueId() : request.id;
        if(matchEngine.contains(orderId))
            throw new ApiException(ApiError.PARAMETER_INVALID, "id", "Order id already in book.");
        // 已成交或已撤销的订单 id 不能复用
        if(ledgerService.getOrder(orderId) != null)
            throw new ApiException(ApiError.PARAMETER_INVALID, "id", "Order id already used.");
        long sequenceId = ++this.lastSequenceId;
        long ts = System.currentTimeMillis();
        Order order = new Order(orderId, sequenceId, userId, request.side, request.price, request.longQuantity(), ts);
        if(logger.isDebugEnabled())
            logger.debug("process order at cycle {}: {}", sequenceId, order);
        // 撮合
        MatchResult result = matchEngine.processOrder(order);
        OrderBookBean book = refreshMarket(sequenceId);
        // 写账本
        OrderEntity entity = toEntity(order, sequenceId, ts);
        try {
            ledgerService.recordOrderCycle(entity, result.trades, sequenceId, ts, matchEngine::remainingQuantity);
        } catch (RuntimeException e) {
            logger.error("ledger write failed at cycle {}, order {} needs reconciliation.", sequenceId, orderId, e);
            throw new ApiException(ApiError.PERSISTENCE_FAILED, orderId, "Failed to persist order.", e);
        }
        if(debugMode)
            validate();
        notifyMarketUpdate(ts);
        return new OrderResultBean(entity, result.trades, book);
    }

    boolean cancelOrder(String orderId) {
        OrderEntity order = ledgerService.getOrder(orderId);
        if(order == null || order.status == OrderStatus.CANCELED)
            throw new ApiException(ApiError.ORDER_NOT_FOUND, orderId, "Order not found.");
        if(order.status == OrderStatus.FILLED)
            throw new ApiException(ApiError.ORDER_INVALID_STATE, orderId, "Order already filled.");
        long sequenceId = ++this.lastSequenceId;
        long ts = System.currentTimeMillis();
        if(matchEngine.cancel(orderId) == null)
            logger.warn("order {} is {} in ledger but not in book.", orderId, order.status);
        refreshMarket(sequenceId);
        try {
            ledgerService.markCanceled(orderId, ts);
        } catch (RuntimeException e) {
            logger.error("ledger write failed at cycle {}, canceled order {} needs reconciliation.",
                    sequenceId, orderId, e);
            throw new ApiException(ApiError.PERSISTENCE_FAILED, orderId, "Failed to persist cancel.", e);
        }
        if(debugMode)
            validate();
        notifyMarketUpdate(ts);
        return true;
    }

    private void restoreBook() {
        List<OrderEntity> orders = ledgerService.loadRestingOrders();
        for(OrderEntity e : orders) {
            matchEngine.insert(new Order(e.id, e.sequenceId, e.userId, e.side, e.price,
                    e.quantity, e.originalQuantity, e.createdAt));
        }
        logger.info("restored {} resting orders from ledger.", orders.size());
    }

    private OrderBookBean refreshMarket(long sequenceId) {
        OrderBookBean book = matchEngine.getOrderBook(sequenceId);
        this.latestOrderBook = book;
        this.latestTrades = List.copyOf(matchEngine.getRecentTrades(recentTradeLimit));
        return book;
    }

    private void notifyMarketUpdate(long ts) {
        if(marketUpdateListener == null)
            return;
        try {
            marketUpdateListener.onMarketUpdate(new MarketUpdateMessage(this.latestOrderBook, this.latestTrades, ts));
        } catch (RuntimeException e) {
            logger.warn("market update notification failed.", e);
        }
    }

    static OrderEntity toEntity(Order order, long sequenceId, long ts) {
        OrderEntity entity = new OrderEntity();
        entity.id = order.id;
        entity.sequenceId = sequenceId;
        entity.userId = order.userId;
        entity.side = order.side;
        entity.price = order.price;
        entity.quantity = order.quantity;
        entity.originalQuantity = order.originalQuantity;
        entity.status = OrderStatus.of(order.originalQuantity, order.quantity, false);
        entity.createdAt = ts;
        entity.updatedAt = ts;
        return entity;
    }

    // 验证订单簿完整性
    void validate() {
        logger.debug("start validate...");
        Set<String> ids = new HashSet<>();
        validateBook(matchEngine.buyBook, ids);
        validateBook(matchEngine.sellBook, ids);
        Order bestBuy = matchEngine.buyBook.getFirst();
        Order bestSell = matchEngine.sellBook.getFirst();
        if(bestBuy != null && bestSell != null)
            require(bestBuy.price.compareTo(bestSell.price) < 0, "order book is crossed: " + bestBuy + " / " + bestSell);
        logger.debug("validate done.");
    }

    void validateBook(OrderBook book, Set<String> ids) {
        BigDecimal prevPrice = null;
        long prevSequence = 0;
        for(var item : book.getOrderBook()) {
            Order order = book.get(item.id());
            require(order != null, "order not indexed in " + book.side + " book: " + item);
            require(order.quantity > 0, "resting order must have positive quantity: " + order);
            require(order.quantity <= order.originalQuantity, "remaining exceeds original: " + order);
            require(ids.add(order.id), "duplicate order id in book: " + order.id);
            if(prevPrice != null) {
                int cmp = order.price.compareTo(prevPrice);
                boolean inPriority = book.side == Side.BUY ? cmp <= 0 : cmp >= 0;
                require(inPriority, "book out of price priority: " + order);
                if(cmp == 0)
                    require(order.sequenceId > prevSequence, "book out of time priority: " + order);
            }
            prevPrice = order.price;
            prevSequence = order.sequenceId;
        }
    }

    void require(boolean condition, String errorMessage) {
        if(!condition) {
            logger.error("validated failed: {}", errorMessage);
            throw new IllegalStateException(errorMessage);
        }
    }
}
