package com.learn.venue.web.api;

import com.learn.venue.ApiError;
import com.learn.venue.ApiException;
import com.learn.venue.demo.DemoMarketService;
import com.learn.venue.support.AbstractApiController;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/demo")
public class DemoApiController extends AbstractApiController {

    @Value("#{exchangeConfiguration.demo.allowed}")
    boolean demoAllowed = true;

    @Autowired
    DemoMarketService demoMarketService;

    @PostMapping("/start")
    public Map<String, Object> start() {
        checkAllowed();
        demoMarketService.start();
        return Map.of("success", true, "message", "Demo market started");
    }

    @PostMapping("/stop")
    public Map<String, Object> stop() {
        checkAllowed();
        demoMarketService.stop();
        return Map.of("success", true, "message", "Demo market stopped");
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        checkAllowed();
        return Map.of("running", demoMarketService.isRunning());
    }

    private void checkAllowed() {
        if(!demoAllowed)
            throw new ApiException(ApiError.OPERATION_FORBIDDEN, null, "Demo market is disabled.");
    }
}
