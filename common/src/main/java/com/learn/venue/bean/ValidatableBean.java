package com.learn.venue.bean;

public interface ValidatableBean {

    // 校验失败抛出 ApiException
    void validate();
}
