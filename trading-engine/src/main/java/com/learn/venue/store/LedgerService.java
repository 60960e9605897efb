package com.learn.venue.store;

import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.OrderStatus;
import com.learn.venue.enums.Side;
import com.learn.venue.model.trade.OrderEntity;
import com.learn.venue.model.trade.TradeEntity;
import com.learn.venue.support.AbstractDbService;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.ToLongFunction;

/**
 * 订单簿的持久化镜像。
 * 每个撮合周期的写入在一个事务内完成，失败时整体回滚，但不回滚内存中的订单簿。
 */
@Component
@Transactional(rollbackFor = Throwable.class)
public class LedgerService extends AbstractDbService {

    public static final String DEMO_PREFIX = "demo_";
    // LIKE 中的 _ 是通配符，需要转义
    static final String DEMO_ID_PATTERN = "demo!_%";

    // demo 前缀保留给模拟行情，不区分大小写
    public static boolean isDemoId(String id) {
        return id != null && id.regionMatches(true, 0, DEMO_PREFIX, 0, DEMO_PREFIX.length());
    }

    /**
     * 写入一次下单周期的结果。
     *
     * @param incoming        本次订单撮合后的最终状态
     * @param trades          本次产生的成交
     * @param remainingInBook 对手单在订单簿中的剩余数量，已不在簿中返回 0
     */
    public void recordOrderCycle(OrderEntity incoming, List<TradeRecord> trades, long sequenceId, long ts,
                                 ToLongFunction<String> remainingInBook) {
        db.insert(incoming);
        for(TradeRecord trade : trades) {
            TradeEntity entity = new TradeEntity();
            entity.sequenceId = sequenceId;
            entity.buyOrderId = trade.buyOrderId();
            entity.sellOrderId = trade.sellOrderId();
            entity.price = trade.price();
            entity.quantity = trade.quantity();
            entity.createdAt = ts;
            db.insert(entity);
            String counterpartyId = incoming.side == Side.BUY ? trade.sellOrderId() : trade.buyOrderId();
            updateResting(counterpartyId, remainingInBook.applyAsLong(counterpartyId), sequenceId, ts);
        }
    }

    private void updateResting(String orderId, long remaining, long sequenceId, long ts) {
        OrderEntity resting = db.fetch(OrderEntity.class, orderId);
        if(resting == null) {
            logger.warn("resting order {} not found in ledger at cycle {}, needs reconciliation.", orderId, sequenceId);
            return;
        }
        resting.quantity = remaining;
        resting.status = OrderStatus.of(resting.originalQuantity, remaining, false);
        resting.updatedAt = ts;
        db.update(resting);
    }

    public OrderEntity getOrder(String id) {
        return db.fetch(OrderEntity.class, id);
    }

    public void markCanceled(String id, long ts) {
        OrderEntity order = db.get(OrderEntity.class, id);
        order.quantity = 0;
        order.status = OrderStatus.of(order.originalQuantity, 0, true);
        order.updatedAt = ts;
        db.update(order);
    }

    // 新的在前
    public List<OrderEntity> getOrders(int maxResults) {
        return db.from(OrderEntity.class).orderBy("sequenceId").desc().orderBy("createdAt").desc()
                .limit(maxResults).list();
    }

    // 新的在前
    public List<TradeEntity> getTrades(int maxResults) {
        return db.from(TradeEntity.class).orderBy("id").desc().limit(maxResults).list();
    }

    // 返回删除的订单数
    public int deleteDemoDataBefore(long ts) {
        String pattern = DEMO_ID_PATTERN;
        int trades = db.getJdbcTemplate().update("DELETE FROM " + db.getTable(TradeEntity.class)
                + " WHERE createdAt < ? AND (buyOrderId LIKE ? ESCAPE '!' OR sellOrderId LIKE ? ESCAPE '!')",
                ts, pattern, pattern);
        int orders = db.getJdbcTemplate().update("DELETE FROM " + db.getTable(OrderEntity.class)
                + " WHERE createdAt < ? AND id LIKE ? ESCAPE '!'", ts, pattern);
        if(logger.isInfoEnabled())
            logger.info("deleted {} demo orders and {} demo trades created before {}.", orders, trades, ts);
        return orders;
    }

    // 仍在订单簿中的订单，按进入顺序
    @Transactional(readOnly = true)
    public List<OrderEntity> loadRestingOrders() {
        return db.from(OrderEntity.class).where("status IN (?, ?) AND quantity > 0",
                OrderStatus.OPEN.name(), OrderStatus.PARTIAL.name()).orderBy("sequenceId").list();
    }

    @Transactional(readOnly = true)
    public long getMaxSequenceId() {
        Long max = db.getJdbcTemplate().queryForObject("SELECT MAX(sequenceId) FROM "
                + db.getTable(OrderEntity.class), Long.class);
        return max == null ? 0 : max;
    }
}
