package com.feedwatch.engine.domain.platform;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One fair permit per platform account. Holding the permit for the duration of a fetch keeps
 * requests made with the same credentials from overlapping; fetches on different accounts, or
 * without an account, are not affected.
 */
@Slf4j
@Component
public class AccountPermits {

    private final ConcurrentMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    public <T> T withPermit(String account, Supplier<T> action) {
        var permit = permits.computeIfAbsent(account, name -> new Semaphore(1, true));
        try {
            if (!permit.tryAcquire()) {
                log.debug("Waiting for account {}", account);
                permit.acquire();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for account " + account);
        }
        try {
            return action.get();
        } finally {
            permit.release();
        }
    }
}
