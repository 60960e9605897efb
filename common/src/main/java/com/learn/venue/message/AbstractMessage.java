package com.learn.venue.message;

import java.io.Serializable;

// base message object for extends
public class AbstractMessage implements Serializable {
    // 消息类型
    public String type;
    // 消息创建时间
    public long createdAt;
}
