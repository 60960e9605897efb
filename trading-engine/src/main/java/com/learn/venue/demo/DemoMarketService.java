package com.learn.venue.demo;

import com.learn.venue.TradingEngineService;
import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.OrderRequestBean;
import com.learn.venue.bean.OrderResultBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.enums.Side;
import com.learn.venue.store.LedgerService;
import com.learn.venue.support.LoggerSupport;
import com.learn.venue.util.IdUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Random;

/**
 * 模拟行情：定时生成随机限价单，通过 {@link TradingEngineService#submit} 下单，
 * 与普通调用方走同一条路径。
 */
@Component
public class DemoMarketService extends LoggerSupport {

    static final BigDecimal DEFAULT_MIDPOINT = new BigDecimal("10.00");
    static final int MIDPOINT_TRADES = 20;
    static final long BURST_COOLDOWN_MILLIS = 30_000;
    static final long CLEANUP_INTERVAL_MILLIS = 10 * 60_000;

    @Value("#{exchangeConfiguration.demo.autoStart}")
    boolean autoStart = false;
    @Value("#{exchangeConfiguration.demo.retentionHours}")
    int retentionHours = 24;

    @Autowired
    TradingEngineService tradingEngineService;
    @Autowired
    LedgerService ledgerService;

    Random random = new Random();

    private volatile boolean running = false;
    private long lastBurstTime = 0;

    private Thread tickThread;
    private Thread cleanupThread;

    @PostConstruct
    public void init() {
        if(autoStart)
            start();
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    // 已在运行返回 false
    public synchronized boolean start() {
        if(running)
            return false;
        this.running = true;
        this.lastBurstTime = 0;
        this.tickThread = new Thread(this::runTickThread, "demo-market");
        this.tickThread.setDaemon(true);
        this.tickThread.start();
        this.cleanupThread = new Thread(this::runCleanupThread, "demo-cleanup");
        this.cleanupThread.setDaemon(true);
        this.cleanupThread.start();
        logger.info("demo market started.");
        return true;
    }

    // 未运行返回 false
    public synchronized boolean stop() {
        if(!running)
            return false;
        this.running = false;
        this.tickThread.interrupt();
        this.cleanupThread.interrupt();
        logger.info("demo market stopped.");
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    private void runTickThread() {
        logger.info("start demo market ticks...");
        try {
            tick();
            while(running) {
                // 15% 概率进入连续下单
                if(random.nextDouble() < 0.15)
                    burst();
                Thread.sleep(2000 + random.nextInt(2001));
                if(running)
                    tick();
            }
        } catch (InterruptedException e) {
            logger.info("{} was interrupted.", Thread.currentThread().getName());
        }
    }

    private void runCleanupThread() {
        logger.info("start demo data cleanup...");
        try {
            while(running) {
                cleanup();
                Thread.sleep(CLEANUP_INTERVAL_MILLIS);
            }
        } catch (InterruptedException e) {
            logger.info("{} was interrupted.", Thread.currentThread().getName());
        }
    }

    // 3~5 笔，间隔 150~300ms，两次之间至少间隔 30s
    void burst() throws InterruptedException {
        long now = System.currentTimeMillis();
        if(now - lastBurstTime < BURST_COOLDOWN_MILLIS)
            return;
        lastBurstTime = now;
        int count = 3 + random.nextInt(3);
        for(int i = 0; i < count; i++) {
            tick();
            if(i < count - 1)
                Thread.sleep(150 + random.nextInt(151));
        }
    }

    // 下单失败只记录日志，不中断行情
    OrderResultBean tick() {
        try {
            OrderRequestBean request = generateDemoOrder();
            OrderResultBean result = tradingEngineService.submit(request, null);
            if(logger.isInfoEnabled())
                logger.info("generated demo {} order: {} @ {}, {} trades.", request.side, request.quantity,
                        request.price, result.trades().size());
            return result;
        } catch (RuntimeException e) {
            logger.warn("demo market tick failed.", e);
            return null;
        }
    }

    int cleanup() {
        long before = System.currentTimeMillis() - retentionHours * 3600_000L;
        try {
            return ledgerService.deleteDemoDataBefore(before);
        } catch (RuntimeException e) {
            logger.warn("demo data cleanup failed.", e);
            return 0;
        }
    }

    OrderRequestBean generateDemoOrder() {
        double midpoint = midpoint(tradingEngineService.recentTrades()).doubleValue();
        OrderBookBean book = tradingEngineService.snapshot();
        Side side = random.nextBoolean() ? Side.BUY : Side.SELL;
        // 通常 ±2~4%，10% 概率 ±8%
        boolean spike = random.nextDouble() < 0.1;
        double jitterRange = spike ? 0.08 : 0.02 + random.nextDouble() * 0.02;
        double jitter = (random.nextDouble() - 0.5) * 2 * jitterRange * midpoint;
        double price = Math.max(0.01, midpoint + jitter);
        // 70% 的订单以可成交价格报价
        if(random.nextDouble() < 0.7) {
            if(side == Side.BUY && !book.sell().isEmpty())
                price = Math.max(price, book.sell().get(0).price().doubleValue());
            else if(side == Side.SELL && !book.buy().isEmpty())
                price = Math.min(price, book.buy().get(0).price().doubleValue());
        }
        BigDecimal rounded = BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP);
        if(rounded.signum() <= 0)
            rounded = new BigDecimal("0.01");
        long quantity = 1 + random.nextInt(8);
        return new OrderRequestBean(IdUtil.generateShortId(LedgerService.DEMO_PREFIX), side, rounded,
                BigDecimal.valueOf(quantity));
    }

    // 最近 20 笔成交均价，没有成交时为 10.00
    static BigDecimal midpoint(List<TradeRecord> recentTrades) {
        int n = Math.min(MIDPOINT_TRADES, recentTrades.size());
        if(n == 0)
            return DEFAULT_MIDPOINT;
        BigDecimal sum = BigDecimal.ZERO;
        for(int i = 0; i < n; i++)
            sum = sum.add(recentTrades.get(i).price());
        return sum.divide(BigDecimal.valueOf(n), 8, RoundingMode.HALF_UP);
    }
}
