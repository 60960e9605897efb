package com.learn.venue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "exchange.config")
public class ExchangeConfiguration {

    // 每个周期结束后校验订单簿
    private boolean debugMode = false;

    // 行情推送中包含的最近成交数
    private int recentTradeLimit = 50;

    // 启动时从账本恢复挂单
    private boolean restoreBookOnStartup = false;

    private Demo demo = new Demo();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public int getRecentTradeLimit() {
        return recentTradeLimit;
    }

    public void setRecentTradeLimit(int recentTradeLimit) {
        this.recentTradeLimit = recentTradeLimit;
    }

    public boolean isRestoreBookOnStartup() {
        return restoreBookOnStartup;
    }

    public void setRestoreBookOnStartup(boolean restoreBookOnStartup) {
        this.restoreBookOnStartup = restoreBookOnStartup;
    }

    public Demo getDemo() {
        return demo;
    }

    public void setDemo(Demo demo) {
        this.demo = demo;
    }

    public static class Demo {
        private boolean allowed = true;
        private boolean autoStart = false;
        private int retentionHours = 24;

        public boolean isAllowed() {
            return allowed;
        }

        public void setAllowed(boolean allowed) {
            this.allowed = allowed;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getRetentionHours() {
            return retentionHours;
        }

        public void setRetentionHours(int retentionHours) {
            this.retentionHours = retentionHours;
        }
    }
}
