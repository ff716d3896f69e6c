package com.vth.domain.model;

import com.vth.domain.exception.TradeException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-currency balances of one portfolio. A missing currency has a balance of zero.
 * <p>
 * Not thread-safe: only {@link Portfolio} mutates a wallet, under its own lock.
 */
public class Wallet {

    private final Map<Currency, BigDecimal> balances = new EnumMap<>(Currency.class);

    Wallet() {
    }

    Wallet(Map<Currency, BigDecimal> initial) {
        initial.forEach((currency, balance) -> {
            if (balance == null || balance.signum() < 0) {
                throw new IllegalArgumentException("Balance of " + currency + " must not be negative: " + balance);
            }
            if (balance.signum() > 0) {
                balances.put(currency, balance);
            }
        });
    }

    BigDecimal balanceOf(Currency currency) {
        return balances.getOrDefault(currency, BigDecimal.ZERO);
    }

    void credit(Currency currency, BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Credit amount must not be negative: " + amount);
        }
        if (amount.signum() > 0) {
            balances.merge(currency, amount, BigDecimal::add);
        }
    }

    /**
     * @throws TradeException INSUFFICIENT_FUNDS when the balance would go negative; nothing changes then
     */
    void debit(Currency currency, BigDecimal amount) {
        BigDecimal available = balanceOf(currency);
        if (amount.compareTo(available) > 0) {
            throw TradeException.insufficientFunds(currency, available, amount);
        }
        BigDecimal remaining = available.subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(currency);
        } else {
            balances.put(currency, remaining);
        }
    }

    Map<Currency, BigDecimal> snapshot() {
        Map<Currency, BigDecimal> copy = new EnumMap<>(Currency.class);
        copy.putAll(balances);
        return Collections.unmodifiableMap(copy);
    }
}
