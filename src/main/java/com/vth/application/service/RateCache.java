package com.vth.application.service;

import com.vth.application.port.out.RateSource;
import com.vth.application.port.out.RateTableRepository;
import com.vth.domain.exception.RefreshException;
import com.vth.domain.model.Currency;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import com.vth.domain.model.RateTable;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current rate table and a bounded history of the tables it replaced.
 * <p>
 * Readers get the current table through a single atomic read and never block. A refresh fetches
 * from every source in parallel, isolates per-source failures, overlays what succeeded on the
 * previous table and publishes the result by swapping the reference. At most one refresh runs
 * at a time; {@link #refresh()} joins a running one.
 */
@Slf4j
public class RateCache {

    private final Currency baseCurrency;
    private final List<RateSource> sources;
    private final RateTableRepository repository;
    private final int historySize;
    private final Clock clock;

    private final AtomicReference<RateTable> current;
    private final Deque<RateTable> history = new ArrayDeque<>();    // newest first, guarded by publishLock
    private final Object publishLock = new Object();
    private final AtomicReference<Future<RateTable>> inFlight = new AtomicReference<>();

    public RateCache(
            Currency baseCurrency,
            List<RateSource> sources,
            RateTableRepository repository,
            int historySize,
            Clock clock
    ) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must not be negative: " + historySize);
        }
        this.baseCurrency = baseCurrency;
        this.sources = List.copyOf(sources);
        this.repository = repository;
        this.historySize = historySize;
        this.clock = clock;
        this.current = new AtomicReference<>(RateTable.baseOnly(baseCurrency, clock.instant()));
    }

    public Currency baseCurrency() {
        return baseCurrency;
    }

    /**
     * Latest published table; the base-only table until the first refresh or restore
     */
    public RateTable current() {
        return current.get();
    }

    public boolean isStale(Duration maxAge) {
        return current().isStale(maxAge, clock.instant());
    }

    public BigDecimal convert(BigDecimal amount, Currency from, Currency to) {
        return current().convert(amount, from, to);
    }

    /**
     * Replaced tables, newest first
     */
    public List<RateTable> history() {
        synchronized (publishLock) {
            return List.copyOf(history);
        }
    }

    public boolean isRefreshInProgress() {
        return inFlight.get() != null;
    }

    /**
     * Seed the cache with persisted state. Only applies while nothing has been published yet.
     *
     * @param table      last saved table
     * @param pastTables saved history, oldest first
     * @return true when the table was installed
     */
    public boolean restore(RateTable table, List<RateTable> pastTables) {
        if (table.getBaseCurrency() != baseCurrency) {
            log.warn("Ignoring stored rate table in {}: cache base currency is {}", table.getBaseCurrency(), baseCurrency);
            return false;
        }
        synchronized (publishLock) {
            if (current.get().getVersion() != 0) {
                log.info("Rate table already published, stored table version {} ignored", table.getVersion());
                return false;
            }
            history.clear();
            for (RateTable past : pastTables) {
                if (past.getBaseCurrency() == baseCurrency && past.getVersion() < table.getVersion()) {
                    history.addFirst(past);
                }
            }
            trimHistory();
            current.set(table);
        }
        log.info("Restored rate table version {} as of {} ({} history entries)",
                table.getVersion(), table.getAsOf(), history().size());
        return true;
    }

    /**
     * Refresh from all sources, or join the refresh already in progress.
     *
     * @return the published table, or a failed future with {@link RefreshException} when every
     *         source failed; the current table is unchanged in that case
     */
    public Future<RateTable> refresh() {
        while (true) {
            Future<RateTable> running = inFlight.get();
            if (running != null) {
                log.info("Rate refresh already in progress, waiting for its result");
                return running;
            }
            Promise<RateTable> promise = Promise.promise();
            if (inFlight.compareAndSet(null, promise.future())) {
                runRefresh(promise);
                return promise.future();
            }
        }
    }

    /**
     * Start a refresh only if none is running
     *
     * @return empty when a refresh is already in progress
     */
    public Optional<Future<RateTable>> refreshIfIdle() {
        Promise<RateTable> promise = Promise.promise();
        if (!inFlight.compareAndSet(null, promise.future())) {
            return Optional.empty();
        }
        runRefresh(promise);
        return Optional.of(promise.future());
    }

    private void runRefresh(Promise<RateTable> promise) {
        log.info("Refreshing rates from {} sources...", sources.size());

        // Start every fetch before waiting on any of them
        List<Future<SourceResult>> fetches = new ArrayList<>();
        for (RateSource source : sources) {
            fetches.add(fetchIsolated(source));
        }

        Future<List<SourceResult>> collected = Future.succeededFuture(new ArrayList<>());
        for (Future<SourceResult> fetch : fetches) {
            collected = collected.compose(results -> fetch.map(result -> {
                results.add(result);
                return results;
            }));
        }

        collected.compose(this::publish)
                .onComplete(ar -> {
                    inFlight.set(null);
                    promise.handle(ar);
                });
    }

    private Future<SourceResult> fetchIsolated(RateSource source) {
        RateProvider provider = source.provider();
        Set<Currency> wanted = EnumSet.noneOf(Currency.class);
        wanted.addAll(source.supportedCurrencies());
        wanted.remove(baseCurrency);

        Future<List<RateEntry>> fetch;
        try {
            fetch = source.fetch(wanted);
        } catch (RuntimeException e) {
            fetch = Future.failedFuture(e);
        }
        if (fetch == null) {
            fetch = Future.failedFuture(new IllegalStateException(provider.getValue() + " returned no result"));
        }

        return fetch
                .map(entries -> SourceResult.success(provider, accepted(provider, wanted, entries)))
                .recover(error -> {
                    log.warn("Rate source {} failed, keeping its previous rates: {}", provider.getValue(), error.getMessage());
                    return Future.succeededFuture(SourceResult.failure(provider, error));
                });
    }

    private List<RateEntry> accepted(RateProvider provider, Set<Currency> wanted, List<RateEntry> entries) {
        List<RateEntry> accepted = new ArrayList<>();
        for (RateEntry entry : entries) {
            if (entry != null && wanted.contains(entry.getCurrency())) {
                accepted.add(entry);
            } else {
                log.debug("Dropping unrequested entry from {}: {}", provider.getValue(), entry);
            }
        }
        log.debug("Rate source {} returned {} entries", provider.getValue(), accepted.size());
        return accepted;
    }

    private Future<RateTable> publish(List<SourceResult> results) {
        List<Throwable> failures = new ArrayList<>();
        List<RateEntry> fetched = new ArrayList<>();
        for (SourceResult result : results) {
            if (result.failure() != null) {
                failures.add(result.failure());
            } else {
                fetched.addAll(result.entries());
            }
        }

        if (failures.size() == results.size()) {
            RefreshException error = RefreshException.allSourcesFailed(failures);
            log.error(error.getMessage());
            return Future.failedFuture(error);
        }

        RateTable next;
        synchronized (publishLock) {
            RateTable previous = current.get();
            next = previous.merge(fetched, clock.instant());
            if (previous.getVersion() > 0) {
                history.addFirst(previous);
                trimHistory();
            }
            current.set(next);
        }

        log.info("Rates refreshed: version {} with {} entries as of {} ({} of {} sources succeeded)",
                next.getVersion(), next.getEntries().size(), next.getAsOf(),
                results.size() - failures.size(), results.size());

        RateTable published = next;
        repository.save(published)
                .onFailure(error -> log.error("Failed to persist rate table version {}", published.getVersion(), error));

        return Future.succeededFuture(published);
    }

    private void trimHistory() {
        while (history.size() > historySize) {
            history.removeLast();
        }
    }

    private record SourceResult(RateProvider provider, List<RateEntry> entries, Throwable failure) {

        static SourceResult success(RateProvider provider, List<RateEntry> entries) {
            return new SourceResult(provider, entries, null);
        }

        static SourceResult failure(RateProvider provider, Throwable failure) {
            return new SourceResult(provider, List.of(), failure);
        }
    }
}
