package com.learn.venue.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Side {
    BUY, SELL;

    // 对手方
    public Side negate() {
        return this == BUY ? SELL : BUY;
    }

    // 接受 buy / sell，不区分大小写
    @JsonCreator
    public static Side of(String value) {
        if(value != null) {
            for(Side side : values()) {
                if(side.name().equalsIgnoreCase(value.trim()))
                    return side;
            }
        }
        throw new IllegalArgumentException("Invalid side: " + value);
    }
}
