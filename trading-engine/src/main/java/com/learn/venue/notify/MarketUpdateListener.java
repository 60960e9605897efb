package com.learn.venue.notify;

import com.learn.venue.message.MarketUpdateMessage;

// 在撮合线程中回调，实现不得阻塞
public interface MarketUpdateListener {

    void onMarketUpdate(MarketUpdateMessage message);
}
