package com.learn.venue.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.support.ConnectionPoolSupport;
import jakarta.annotation.PreDestroy;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RedisService {
    final Logger logger = LoggerFactory.getLogger(getClass());

    final RedisClient redisClient;

    final GenericObjectPool<StatefulRedisConnection<String, String>> redisConnectionPool;

    public RedisService(@Autowired RedisConfiguration redisConfig) {
        RedisURI.Builder builder = RedisURI.Builder.redis(redisConfig.getHost(), redisConfig.getPort())
                .withDatabase(redisConfig.getDatabase());
        if(!redisConfig.getPassword().isEmpty())
            builder.withPassword(redisConfig.getPassword().toCharArray());
        this.redisClient = RedisClient.create(builder.build());

        GenericObjectPoolConfig<StatefulRedisConnection<String, String>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(20);
        poolConfig.setMaxIdle(5);
        poolConfig.setTestOnReturn(true);
        poolConfig.setTestWhileIdle(true);
        this.redisConnectionPool = ConnectionPoolSupport.createGenericObjectPool(
                () -> redisClient.connect(), poolConfig);
    }

    @PreDestroy
    public void shutdown() {
        this.redisConnectionPool.close();
        this.redisClient.shutdown();
    }

    public <T> T executeSync(SyncCommandCallback<T> callback) {
        try(StatefulRedisConnection<String, String> conn = redisConnectionPool.borrowObject()) {
            conn.setAutoFlushCommands(true);
            RedisCommands<String, String> commands = conn.sync();
            return callback.doInConnection(commands);
        } catch (Exception e) {
            logger.warn("executeSync redis failed.", e);
            throw new RuntimeException(e);
        }
    }

    // 返回收到消息的订阅者数量
    public long publish(String topic, String data) {
        Long receivers = executeSync(commands -> commands.publish(topic, data));
        return receivers == null ? 0 : receivers;
    }
}
