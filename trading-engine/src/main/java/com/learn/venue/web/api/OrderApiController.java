package com.learn.venue.web.api;

import com.learn.venue.ApiError;
import com.learn.venue.ApiException;
import com.learn.venue.TradingEngineService;
import com.learn.venue.bean.OrderBookBean;
import com.learn.venue.bean.OrderRequestBean;
import com.learn.venue.bean.OrderResultBean;
import com.learn.venue.bean.TradeRecord;
import com.learn.venue.model.trade.OrderEntity;
import com.learn.venue.model.trade.TradeEntity;
import com.learn.venue.store.LedgerService;
import com.learn.venue.support.AbstractApiController;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/orders")
public class OrderApiController extends AbstractApiController {

    public static final String USER_ID_HEADER = "X-User-Id";

    @Autowired
    TradingEngineService tradingEngineService;
    @Autowired
    LedgerService ledgerService;

    @PostMapping
    public OrderResultBean createOrder(@RequestBody OrderRequestBean request,
                                       @RequestHeader(value = USER_ID_HEADER, required = false) String userId) {
        if(request == null)
            throw new ApiException(ApiError.PARAMETER_INVALID, null, "Request body is required.");
        // demo 前缀的订单会被定期清理
        if(LedgerService.isDemoId(request.id))
            throw new ApiException(ApiError.PARAMETER_INVALID, "id", "id prefix is reserved.");
        return tradingEngineService.submit(request, userId);
    }

    @DeleteMapping("/{orderId}")
    public Map<String, Object> cancelOrder(@PathVariable("orderId") String orderId) {
        tradingEngineService.cancel(orderId);
        return Map.of("success", true, "message", "Order cancelled");
    }

    @GetMapping("/book")
    public OrderBookBean getOrderBook() {
        return tradingEngineService.snapshot();
    }

    // 内存中的最近成交
    @GetMapping("/trades")
    public List<TradeRecord> getRecentTrades() {
        return tradingEngineService.recentTrades();
    }

    @GetMapping("/trades/db")
    public List<TradeEntity> getLedgerTrades(
            @RequestParam(value = "maxResults", defaultValue = "50") int maxResults) {
        return ledgerService.getTrades(checkMaxResults(maxResults));
    }

    @GetMapping("/db")
    public List<OrderEntity> getLedgerOrders(
            @RequestParam(value = "maxResults", defaultValue = "100") int maxResults) {
        return ledgerService.getOrders(checkMaxResults(maxResults));
    }

    private static int checkMaxResults(int maxResults) {
        if(maxResults < 1 || maxResults > 1000)
            throw new ApiException(ApiError.PARAMETER_INVALID, "maxResults", "Invalid maxResults value.");
        return maxResults;
    }
}
