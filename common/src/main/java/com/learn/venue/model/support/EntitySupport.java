package com.learn.venue.model.support;

// 实体类共用的列定义常量
public interface EntitySupport {

    int PRECISION = 36;

    int SCALE = 18;

    int VAR_ENUM = 32;

    int VAR_CHAR_50 = 50;
}
