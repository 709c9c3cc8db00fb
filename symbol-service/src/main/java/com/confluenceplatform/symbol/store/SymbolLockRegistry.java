package com.confluenceplatform.symbol.store;

import com.confluenceplatform.common.model.TrackedSymbol;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per tracked symbol, created up front for the whole catalog.
 *
 * <p>Every mutation of a symbol's levels or views, and every read snapshot of them, runs
 * inside that symbol's lock. Different symbols never contend. Only in-memory work may run
 * while a lock is held; no I/O.
 */
@Component
public class SymbolLockRegistry {

    private final Map<TrackedSymbol, ReentrantLock> locks;

    public SymbolLockRegistry() {
        Map<TrackedSymbol, ReentrantLock> map = new EnumMap<>(TrackedSymbol.class);
        for (TrackedSymbol symbol : TrackedSymbol.values()) {
            map.put(symbol, new ReentrantLock());
        }
        this.locks = Collections.unmodifiableMap(map);
    }

    public <T> T withLock(TrackedSymbol symbol, Supplier<T> action) {
        ReentrantLock lock = locks.get(symbol);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
