package com.vth.domain.model;

import com.vth.domain.exception.TradeException;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A user's wallet, base currency and trade history.
 * <p>
 * Every mutation runs under the write lock, so the debit and credit of one trade are never
 * observed separately. Reads take the read lock and may run concurrently with each other.
 */
public class Portfolio {

    @Getter
    private final String userId;
    @Getter
    private final Currency baseCurrency;

    private final Wallet wallet;
    private final List<TradeReceipt> trades;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Portfolio(String userId, Currency baseCurrency) {
        this(userId, baseCurrency, Map.of(), List.of());
    }

    public Portfolio(String userId, Currency baseCurrency, Map<Currency, BigDecimal> balances, List<TradeReceipt> trades) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        this.userId = userId;
        this.baseCurrency = Objects.requireNonNull(baseCurrency, "baseCurrency");
        this.wallet = new Wallet(balances);
        this.trades = new ArrayList<>(trades);
    }

    /**
     * New portfolio for a freshly registered user, optionally seeded in the base currency
     */
    public static Portfolio open(String userId, Currency baseCurrency, BigDecimal seed) {
        if (seed != null && seed.signum() < 0) {
            throw TradeException.invalidAmount(seed);
        }
        if (seed == null || seed.signum() == 0) {
            return new Portfolio(userId, baseCurrency);
        }
        return new Portfolio(userId, baseCurrency, Map.of(baseCurrency, seed), List.of());
    }

    public BigDecimal balanceOf(Currency currency) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return wallet.balanceOf(currency);
        } finally {
            read.unlock();
        }
    }

    /**
     * Consistent copy of all non-zero balances
     */
    public Map<Currency, BigDecimal> balances() {
        Lock read = lock.readLock();
        read.lock();
        try {
            return wallet.snapshot();
        } finally {
            read.unlock();
        }
    }

    public List<TradeReceipt> trades() {
        Lock read = lock.readLock();
        read.lock();
        try {
            return List.copyOf(trades);
        } finally {
            read.unlock();
        }
    }

    /**
     * Balances and history captured under one lock, for persistence
     */
    public Snapshot snapshot() {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new Snapshot(userId, baseCurrency, wallet.snapshot(), Collections.unmodifiableList(new ArrayList<>(trades)));
        } finally {
            read.unlock();
        }
    }

    public void deposit(Currency currency, BigDecimal amount) {
        if (!Amounts.isPositive(amount)) {
            throw TradeException.invalidAmount(amount);
        }
        Lock write = lock.writeLock();
        write.lock();
        try {
            wallet.credit(currency, amount);
        } finally {
            write.unlock();
        }
    }

    /**
     * Post both legs of a trade and record its receipt.
     * The debit leg is checked first; when it fails nothing is changed.
     *
     * @throws TradeException INSUFFICIENT_FUNDS
     */
    public void apply(TradeReceipt receipt) {
        if (!userId.equals(receipt.getUserId()) || baseCurrency != receipt.getBaseCurrency()) {
            throw new IllegalArgumentException("Receipt " + receipt.getId() + " does not belong to portfolio of " + userId);
        }
        Lock write = lock.writeLock();
        write.lock();
        try {
            if (receipt.isBuy()) {
                wallet.debit(baseCurrency, receipt.getBaseCurrencyDelta().negate());
                wallet.credit(receipt.getCurrency(), receipt.getAmount());
            } else {
                wallet.debit(receipt.getCurrency(), receipt.getAmount());
                wallet.credit(baseCurrency, receipt.getBaseCurrencyDelta());
            }
            trades.add(receipt);
        } finally {
            write.unlock();
        }
    }

    public record Snapshot(
            String userId,
            Currency baseCurrency,
            Map<Currency, BigDecimal> balances,
            List<TradeReceipt> trades
    ) {}
}
