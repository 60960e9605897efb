package com.learn.venue.notify;

import com.learn.venue.message.MarketUpdateMessage;
import com.learn.venue.redis.RedisCache;
import com.learn.venue.redis.RedisService;
import com.learn.venue.support.LoggerSupport;
import com.learn.venue.util.JsonUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

// 异步推送行情到 Redis，积压时只发送最新的一条
@Component
public class RedisMarketUpdatePublisher extends LoggerSupport implements MarketUpdateListener {

    final RedisService redisService;

    private final Queue<MarketUpdateMessage> notificationQueue = new ConcurrentLinkedQueue<>();

    private Thread notifyThread;

    public RedisMarketUpdatePublisher(@Autowired RedisService redisService) {
        this.redisService = redisService;
    }

    @PostConstruct
    public void init() {
        this.notifyThread = new Thread(this::runNotifyThread, "async-notify");
        this.notifyThread.setDaemon(true);
        this.notifyThread.start();
    }

    @PreDestroy
    public void destroy() {
        if(this.notifyThread != null)
            this.notifyThread.interrupt();
    }

    @Override
    public void onMarketUpdate(MarketUpdateMessage message) {
        this.notificationQueue.add(message);
    }

    private void runNotifyThread() {
        logger.info("start publish market update to redis...");
        for(;;) {
            MarketUpdateMessage latest = null;
            for(;;) {
                MarketUpdateMessage msg = notificationQueue.poll();
                if(msg == null)
                    break;
                latest = msg;
            }
            if(latest != null) {
                publish(latest);
            } else {
                try {
                    Thread.sleep(1);
                } catch (InterruptedException e) {
                    logger.warn("{} was interrupted.", Thread.currentThread().getName());
                    break;
                }
            }
        }
    }

    void publish(MarketUpdateMessage message) {
        try {
            long receivers = redisService.publish(RedisCache.Topic.MARKET_UPDATE, JsonUtil.writeJson(message));
            if(logger.isDebugEnabled())
                logger.debug("market update published to {} subscribers.", receivers);
        } catch (RuntimeException e) {
            logger.warn("publish market update failed: {}", e.getMessage());
        }
    }
}
