package com.learn.venue.db;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

// 带有 JPA 规范标识的类字段
class AccessibleProperty {

    private final Field field;

    final Class<?> propertyType;

    // 枚举与字符串之间的转换，非枚举为 null
    final Function<Object, Object> javaToSqlMapper;
    final Function<Object, Object> sqlToJavaMapper;

    final String propertyName;

    final String columnDefinition;

    static final Map<Class<?>, String> DEFAULT_COLUMN_TYPES = new HashMap<>();

    @SuppressWarnings({"unchecked", "rawtypes"})
    public AccessibleProperty(Field f) {
        this.field = f;
        this.propertyType = f.getType();
        this.propertyName = f.getName();
        this.columnDefinition = getColumnDefinition(this.propertyType);
        boolean isEnum = f.getType().isEnum();
        this.javaToSqlMapper = isEnum ? obj -> ((Enum<?>) obj).name() : null;
        this.sqlToJavaMapper = isEnum ? obj ->
                Enum.valueOf((Class<? extends Enum>) this.propertyType, (String) obj) : null;
    }

    public Object get(Object bean) throws ReflectiveOperationException {
        Object obj = this.field.get(bean);
        if(obj != null && this.javaToSqlMapper != null)
            obj = this.javaToSqlMapper.apply(obj);
        return obj;
    }

    public void set(Object bean, Object value) throws ReflectiveOperationException {
        if(value != null && this.sqlToJavaMapper != null)
            value = this.sqlToJavaMapper.apply(value);
        this.field.set(bean, value);
    }

    boolean isId() {
        return this.field.getAnnotation(Id.class) != null;
    }

    // @Id 且 @GeneratedValue(GenerationType.IDENTITY)
    boolean isIdentityId() {
        if(!isId())
            return false;
        GeneratedValue gv = this.field.getAnnotation(GeneratedValue.class);
        if(gv == null)
            return false;
        return gv.strategy() == GenerationType.IDENTITY;
    }

    boolean isInsertable() {
        if(isIdentityId())
            return false;
        Column col = this.field.getAnnotation(Column.class);
        return col == null || col.insertable();
    }

    boolean isUpdatable() {
        if(isId())
            return false;
        Column col = this.field.getAnnotation(Column.class);
        return col == null || col.updatable();
    }

    private String getColumnDefinition(Class<?> type) {
        Column col = this.field.getAnnotation(Column.class);
        if(col == null)
            throw new IllegalArgumentException("@Column not found in field: " + this.field);
        if(!col.name().isEmpty())
            throw new IllegalArgumentException("Not support 'name' value specified in @Column: " + col);
        String colDef;
        if(col.columnDefinition().isEmpty()) {
            if(type.isEnum())
                colDef = "VARCHAR(" + col.length() + ")";
            else
                colDef = getDefaultColumnType(type, col);
        } else {
            colDef = col.columnDefinition().toUpperCase();
        }
        colDef += " " + (col.nullable() ? "NULL" : "NOT NULL");
        if(isIdentityId())
            colDef += " AUTO_INCREMENT";
        if(!isId() && col.unique())
            colDef += " UNIQUE";
        return colDef;
    }

    private static String getDefaultColumnType(Class<?> type, Column col) {
        String ddl = DEFAULT_COLUMN_TYPES.get(type);
        if(ddl == null)
            throw new IllegalArgumentException("Unsupported column type: " + type.getName());
        if(ddl.equals("VARCHAR($1)")) {
            ddl = ddl.replace("$1", String.valueOf(col.length()));
        }
        if(ddl.equals("DECIMAL($1,$2)")) {
            int precision = col.precision();
            if(precision == 0)
                precision = 10; // MySQL 默认 DECIMAL 精度
            ddl = ddl.replace("$1", String.valueOf(precision))
                    .replace("$2", String.valueOf(col.scale()));
        }
        return ddl;
    }

    static {
        DEFAULT_COLUMN_TYPES.put(String.class, "VARCHAR($1)");

        DEFAULT_COLUMN_TYPES.put(boolean.class, "BIT");
        DEFAULT_COLUMN_TYPES.put(Boolean.class, "BIT");

        DEFAULT_COLUMN_TYPES.put(int.class, "INTEGER");
        DEFAULT_COLUMN_TYPES.put(Integer.class, "INTEGER");
        DEFAULT_COLUMN_TYPES.put(long.class, "BIGINT");
        DEFAULT_COLUMN_TYPES.put(Long.class, "BIGINT");

        DEFAULT_COLUMN_TYPES.put(BigDecimal.class, "DECIMAL($1,$2)");
    }

    @Override
    public String toString() {
        return "AccessibleProperty [propertyName=" + propertyName + ", propertyType=" + propertyType
                + ", columnDefinition=" + columnDefinition + "]";
    }
}
