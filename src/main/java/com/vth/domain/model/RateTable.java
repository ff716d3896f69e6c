package com.vth.domain.model;

import com.vth.domain.exception.ConversionException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned snapshot of currency prices in the base currency.
 * <p>
 * The base currency always has an entry of exactly 1 that is never fetched. {@code asOf} is the
 * oldest {@code fetchedAt} among fetched entries, so a table is only as fresh as its oldest rate.
 * A table holding only the base entry has {@code asOf == Instant.EPOCH}.
 * <p>
 * A new table is produced by {@link #merge}; an existing table is never modified.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RateTable {

    private final long version;
    private final Currency baseCurrency;
    private final Map<Currency, RateEntry> entries;
    private final Instant asOf;
    private final Instant createdAt;

    private RateTable(long version, Currency baseCurrency, Map<Currency, RateEntry> entries, Instant createdAt) {
        this.version = version;
        this.baseCurrency = baseCurrency;
        this.entries = Collections.unmodifiableMap(entries);
        this.createdAt = createdAt;
        this.asOf = entries.values().stream()
                .filter(entry -> !entry.isBase())
                .map(RateEntry::getFetchedAt)
                .min(Instant::compareTo)
                .orElse(Instant.EPOCH);
    }

    /**
     * Table used before any refresh: the base currency only
     */
    public static RateTable baseOnly(Currency baseCurrency, Instant now) {
        Map<Currency, RateEntry> entries = new EnumMap<>(Currency.class);
        entries.put(baseCurrency, RateEntry.base(baseCurrency, now));
        return new RateTable(0, baseCurrency, entries, now);
    }

    /**
     * Rebuild a table from stored entries. A stored base entry is replaced by a fresh synthesized one.
     */
    public static RateTable of(long version, Currency baseCurrency, Collection<RateEntry> entries, Instant createdAt) {
        Map<Currency, RateEntry> map = new EnumMap<>(Currency.class);
        for (RateEntry entry : entries) {
            if (entry.getCurrency() != baseCurrency) {
                map.put(entry.getCurrency(), entry);
            }
        }
        map.put(baseCurrency, RateEntry.base(baseCurrency, createdAt));
        return new RateTable(version, baseCurrency, map, createdAt);
    }

    /**
     * Overlay freshly fetched entries on this table and return the next version.
     * Currencies absent from {@code fetched} keep their previous entry, including its fetch time.
     * Entries for the base currency are ignored.
     */
    public RateTable merge(Collection<RateEntry> fetched, Instant now) {
        Map<Currency, RateEntry> merged = new EnumMap<>(Currency.class);
        merged.putAll(entries);
        for (RateEntry entry : fetched) {
            if (entry.getCurrency() != baseCurrency) {
                merged.put(entry.getCurrency(), entry);
            }
        }
        return new RateTable(version + 1, baseCurrency, merged, now);
    }

    public Optional<RateEntry> entry(Currency currency) {
        return Optional.ofNullable(entries.get(currency));
    }

    public boolean contains(Currency currency) {
        return entries.containsKey(currency);
    }

    public Set<Currency> currencies() {
        return entries.isEmpty() ? EnumSet.noneOf(Currency.class) : EnumSet.copyOf(entries.keySet());
    }

    /**
     * Price of one unit of {@code currency} in the base currency
     */
    public BigDecimal rate(Currency currency) {
        RateEntry entry = entries.get(currency);
        if (entry == null) {
            throw ConversionException.noRate(currency.getCode());
        }
        return entry.getPriceInBase();
    }

    /**
     * {@code amount * rate(from) / rate(to)}
     */
    public BigDecimal convert(BigDecimal amount, Currency from, Currency to) {
        BigDecimal fromRate = rate(from);
        BigDecimal toRate = rate(to);
        if (from == to) {
            return amount;
        }
        return amount.multiply(fromRate, Amounts.MATH_CONTEXT).divide(toRate, Amounts.MATH_CONTEXT);
    }

    public boolean isStale(Duration maxAge, Instant now) {
        return Duration.between(asOf, now).compareTo(maxAge) > 0;
    }

    public boolean hasFetchedRates() {
        return !Instant.EPOCH.equals(asOf);
    }
}
