package com.learn.venue;

public enum ApiError {
    // 请求参数错误
    PARAMETER_INVALID(400),

    // 订单不存在或已取消
    ORDER_NOT_FOUND(404),

    // 订单状态不允许该操作
    ORDER_INVALID_STATE(400),

    // 撮合已完成，但账本写入失败
    PERSISTENCE_FAILED(500),

    OPERATION_FORBIDDEN(403),

    INTERNAL_SERVER_ERROR(500);

    // 对应的 HTTP 状态码
    public final int status;

    ApiError(int status) {
        this.status = status;
    }
}
