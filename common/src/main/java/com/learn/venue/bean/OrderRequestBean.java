package com.learn.venue.bean;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.learn.venue.ApiError;
import com.learn.venue.ApiException;
import com.learn.venue.enums.Side;
import com.learn.venue.util.IdUtil;

import java.math.BigDecimal;

public class OrderRequestBean implements ValidatableBean {

    // 为空时由撮合引擎生成
    public String id;
    @JsonAlias("type")
    public Side side;
    public BigDecimal price;
    public BigDecimal quantity;

    public OrderRequestBean() {
    }

    public OrderRequestBean(String id, Side side, BigDecimal price, BigDecimal quantity) {
        this.id = id;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
    }

    @Override
    public void validate() {
        if(this.id != null && !IdUtil.isValidStringId(this.id))
            throw new ApiException(ApiError.PARAMETER_INVALID, "id", "id is invalid.");
        if(this.side == null)
            throw new ApiException(ApiError.PARAMETER_INVALID, "side", "side is required.");
        if(this.price == null)
            throw new ApiException(ApiError.PARAMETER_INVALID, "price", "price is required.");
        if(this.price.signum() <= 0)
            throw new ApiException(ApiError.PARAMETER_INVALID, "price", "price must be positive.");
        if(this.price.stripTrailingZeros().scale() > 18)
            throw new ApiException(ApiError.PARAMETER_INVALID, "price", "price has too many decimal places.");
        if(this.quantity == null)
            throw new ApiException(ApiError.PARAMETER_INVALID, "quantity", "quantity is required.");
        if(this.quantity.signum() <= 0)
            throw new ApiException(ApiError.PARAMETER_INVALID, "quantity", "quantity must be positive.");
        try {
            this.quantity = new BigDecimal(this.quantity.toBigIntegerExact().longValueExact());
        } catch (ArithmeticException e) {
            throw new ApiException(ApiError.PARAMETER_INVALID, "quantity", "quantity must be an integer.");
        }
    }

    // 仅在 validate() 之后调用
    public long longQuantity() {
        return this.quantity.longValueExact();
    }
}
