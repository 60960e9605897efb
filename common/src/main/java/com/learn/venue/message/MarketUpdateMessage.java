package com.learn.venue.message;

import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.TradeRecord;

import java.util.List;

public class MarketUpdateMessage extends AbstractMessage {

    public static final String TYPE = "market_update";

    public OrderBookBean book;

    // 最近成交，新的在前
    public List<TradeRecord> trades;

    public MarketUpdateMessage() {
        this.type = TYPE;
    }

    public MarketUpdateMessage(OrderBookBean book, List<TradeRecord> trades, long createdAt) {
        this.type = TYPE;
        this.book = book;
        this.trades = trades;
        this.createdAt = createdAt;
    }
}
