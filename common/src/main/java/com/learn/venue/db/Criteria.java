package com.learn.venue.db;

import java.util.ArrayList;
import java.util.List;

// 持有条件查询信息
final class Criteria<T> {

    DbTemplate db;
    Mapper<T> mapper;
    String where = null;
    List<Object> whereParams = new ArrayList<>();
    List<String> orderBy = null;
    int offset = 0;
    int maxResults = 0;

    Criteria(DbTemplate db) {
        this.db = db;
    }

    String sql() {
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT * FROM ").append(this.mapper.tableName);
        if(where != null)
            sql.append(" WHERE ").append(where);
        if(orderBy != null)
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        if(maxResults > 0)
            sql.append(" LIMIT ? OFFSET ?");
        return sql.toString();
    }

    Object[] params() {
        List<Object> params = new ArrayList<>();
        if(where != null)
            params.addAll(whereParams);
        if(maxResults > 0) {
            params.add(maxResults);
            params.add(offset);
        }
        return params.toArray();
    }

    List<T> list() {
        String selectSQL = sql();
        if(db.logger.isDebugEnabled())
            db.logger.debug("SQL: {}", selectSQL);
        return db.jdbcTemplate.query(selectSQL, mapper.resultSetExtractor, params());
    }

    T first() {
        this.offset = 0;
        this.maxResults = 1;
        List<T> result = list();
        return result.isEmpty() ? null : result.get(0);
    }
}
