package com.learn.venue.redis;

public interface RedisCache {

    interface Topic {
        String MARKET_UPDATE = "market_update";
    }
}
