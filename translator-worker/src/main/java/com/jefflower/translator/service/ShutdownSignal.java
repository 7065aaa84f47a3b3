package com.jefflower.translator.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 可被关闭信号打断的等待。限流间隔、重试退避都通过这里等待。
 */
@Component
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void signal() {
        latch.countDown();
    }

    public boolean isSignalled() {
        return latch.getCount() == 0;
    }

    /**
     * 等待指定时间
     *
     * @return 等待期间（或之前）收到关闭信号时返回 true
     */
    public boolean await(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return isSignalled();
        }
        try {
            return latch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
