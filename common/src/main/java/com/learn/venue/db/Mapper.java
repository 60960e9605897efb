package com.learn.venue.db;

import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.join;

final class Mapper<T> {
    final Logger logger = LoggerFactory.getLogger(getClass());

    final Class<T> entityClass;
    final Constructor<T> constructor;
    final String tableName;

    final AccessibleProperty id;
    final List<AccessibleProperty> allProperties;
    // 列名(小写) -> 属性，不同数据库返回的列名大小写不一致
    final Map<String, AccessibleProperty> allPropertiesMap;
    final List<AccessibleProperty> insertableProperties;
    final List<AccessibleProperty> updatableProperties;

    final ResultSetExtractor<List<T>> resultSetExtractor;

    final String selectSQL;
    final String insertSQL;
    final String updateSQL;

    public Mapper(Class<T> clazz) throws NoSuchMethodException {
        List<AccessibleProperty> all = getProperties(clazz);
        AccessibleProperty[] ids = all.stream().filter(AccessibleProperty::isId)
                .toArray(AccessibleProperty[]::new);
        if(ids.length != 1)
            throw new RuntimeException("Require unique @Id class: " + clazz);
        this.id = ids[0];
        this.allProperties = all;
        this.allPropertiesMap = buildPropertiesMap(all);
        this.insertableProperties = all.stream().filter(AccessibleProperty::isInsertable).toList();
        this.updatableProperties = all.stream().filter(AccessibleProperty::isUpdatable).toList();
        this.entityClass = clazz;
        this.constructor = clazz.getConstructor();
        this.tableName = getTableName(clazz);
        this.selectSQL = "SELECT * FROM " + this.tableName + " WHERE " + this.id.propertyName + " = ?";
        this.insertSQL = "INSERT INTO " + this.tableName + " (" + join(", ",
                this.insertableProperties.stream().map(p -> p.propertyName).toArray(String[]::new)) +
                ") VALUES (" + numOfQuestions(this.insertableProperties.size()) + ")";
        this.updateSQL = "UPDATE " + this.tableName + " SET " + join(", ",
                this.updatableProperties.stream().map(p -> p.propertyName + " = ?").toArray(String[]::new)) +
                " WHERE " + this.id.propertyName + " = ?";
        this.resultSetExtractor = rs -> {
            final List<T> result = new ArrayList<>();
            final ResultSetMetaData m = rs.getMetaData();
            final int cols = m.getColumnCount();
            final AccessibleProperty[] props = new AccessibleProperty[cols];
            for(int i = 0; i < cols; i++)
                props[i] = allPropertiesMap.get(m.getColumnLabel(i + 1).toLowerCase(Locale.ROOT)); // 第一列是 1
            try {
                while(rs.next()) {
                    T bean = newInstance();
                    for(int i = 0; i < cols; i++) {
                        if(props[i] != null)
                            props[i].set(bean, rs.getObject(i + 1));
                    }
                    result.add(bean);
                }
            } catch (ReflectiveOperationException e) {
                throw new RuntimeException(e);
            }
            return result;
        };
    }

    public T newInstance() throws ReflectiveOperationException {
        return this.constructor.newInstance();
    }

    // 从 Class 获得所有表属性
    private List<AccessibleProperty> getProperties(Class<T> clazz) {
        List<AccessibleProperty> properties = new ArrayList<>();
        for(Field f : clazz.getFields()) {
            if(Modifier.isStatic(f.getModifiers()))
                continue;
            if(f.isAnnotationPresent(Transient.class))
                continue;
            var p = new AccessibleProperty(f);
            logger.debug("found accessible property: {}", p);
            properties.add(p);
        }
        return properties;
    }

    private Map<String, AccessibleProperty> buildPropertiesMap(List<AccessibleProperty> props) {
        Map<String, AccessibleProperty> map = new HashMap<>();
        for(AccessibleProperty prop : props)
            map.put(prop.propertyName.toLowerCase(Locale.ROOT), prop);
        return map;
    }

    private String getTableName(Class<T> clazz) {
        Table table = clazz.getAnnotation(Table.class);
        if(table != null && !table.name().isEmpty())
            return table.name();
        String name = clazz.getSimpleName();
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    // 给定个数 n 返回 ?, ?, ...
    private String numOfQuestions(int n) {
        return join(", ", Collections.nCopies(n, "?"));
    }

    Object getIdValue(Object bean) throws ReflectiveOperationException {
        return this.id.get(bean);
    }

    // 生成的 DDL 同时兼容 MySQL 与 H2(MySQL 模式)
    public String ddl() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("CREATE TABLE IF NOT EXISTS ").append(this.tableName).append(" (\n");
        sb.append(join(",\n", this.allProperties.stream().sorted((o1, o2) -> {
            if(o1.isId())
                return -1;
            if(o2.isId())
                return 1;
            return o1.propertyName.compareTo(o2.propertyName);
        }).map(p -> "  " + p.propertyName + " " + p.columnDefinition).toArray(String[]::new)));
        sb.append(",\n");
        sb.append("  PRIMARY KEY(").append(this.id.propertyName).append(")\n");
        sb.append(");\n");
        return sb.toString();
    }
}
