package com.learn.venue.support;

import com.learn.venue.ApiError;
import com.learn.venue.ApiErrorResponse;
import com.learn.venue.ApiException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;

public abstract class AbstractApiController extends LoggerSupport {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApiException(ApiException ex) {
        if(ex.error.error() == ApiError.PERSISTENCE_FAILED)
            logger.error("api error: {}", ex.error);
        else if(logger.isDebugEnabled())
            logger.debug("api error: {}", ex.error);
        return ResponseEntity.status(ex.error.error().status).body(ex.error);
    }

    // 请求体无法解析（如 side 非法）视为参数错误
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        ApiErrorResponse error = new ApiErrorResponse(ApiError.PARAMETER_INVALID, null, "Invalid request body.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleException(Exception ex) {
        logger.error("unexpected error.", ex);
        ApiException apiEx = new ApiException(ApiError.INTERNAL_SERVER_ERROR, null, ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(apiEx.error);
    }
}
