package com.learn.venue.support;

import com.learn.venue.db.DbTemplate;
import org.springframework.beans.factory.annotation.Autowired;

// 需要访问数据库的服务继承此类
public abstract class AbstractDbService extends LoggerSupport {
    @Autowired
    protected DbTemplate db;
}
