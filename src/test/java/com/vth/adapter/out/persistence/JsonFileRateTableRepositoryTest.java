package com.vth.adapter.out.persistence;

import com.vth.domain.model.Currency;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import com.vth.domain.model.RateTable;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for JsonFileRateTableRepository on a temporary directory
 */
class JsonFileRateTableRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @TempDir
    Path dataDir;

    private Vertx vertx;
    private JsonFileRateTableRepository repository;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        repository = new JsonFileRateTableRepository(vertx, dataDir.toString(), 3);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        await(vertx.close());
    }

    static <T> AsyncResult<T> await(Future<T> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<AsyncResult<T>> result = new AtomicReference<>();
        future.onComplete(ar -> {
            result.set(ar);
            latch.countDown();
        });
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        return result.get();
    }

    private static List<RateTable> tables(int count) {
        List<RateTable> tables = new ArrayList<>();
        RateTable table = RateTable.baseOnly(Currency.USD, T0);
        for (int i = 1; i <= count; i++) {
            Instant at = T0.plusSeconds(60L * i);
            table = table.merge(List.of(
                    new RateEntry(Currency.EUR, new BigDecimal("1.10").add(BigDecimal.valueOf(i, 3)), at, RateProvider.EXCHANGE_RATE_API),
                    new RateEntry(Currency.BTC, new BigDecimal("60000.12345678"), at, RateProvider.COINGECKO)
            ), at);
            tables.add(table);
        }
        return tables;
    }

    @Test
    void load_withoutStoredFilesShouldBeEmpty() throws InterruptedException {
        AsyncResult<Optional<RateTable>> loaded = await(repository.load());
        AsyncResult<List<RateTable>> history = await(repository.loadHistory());

        assertTrue(loaded.succeeded());
        assertTrue(loaded.result().isEmpty());
        assertTrue(history.succeeded());
        assertTrue(history.result().isEmpty());
    }

    @Test
    void save_thenLoadShouldRestoreTheTable() throws InterruptedException {
        RateTable table = tables(1).get(0);

        assertTrue(await(repository.save(table)).succeeded());
        RateTable loaded = await(repository.load()).result().orElseThrow();

        assertEquals(table.getVersion(), loaded.getVersion());
        assertEquals(Currency.USD, loaded.getBaseCurrency());
        assertEquals(table.getCreatedAt(), loaded.getCreatedAt());
        assertEquals(table.getAsOf(), loaded.getAsOf());
        assertEquals(table.entry(Currency.EUR), loaded.entry(Currency.EUR));
        assertEquals(table.entry(Currency.BTC), loaded.entry(Currency.BTC));
        assertTrue(loaded.entry(Currency.USD).orElseThrow().isBase());
        assertTrue(Files.exists(dataDir.resolve(JsonFileRateTableRepository.CURRENT_FILE)));
    }

    @Test
    void save_shouldKeepABoundedHistoryOldestFirst() throws InterruptedException {
        for (RateTable table : tables(5)) {
            assertTrue(await(repository.save(table)).succeeded());
        }

        List<RateTable> history = await(repository.loadHistory()).result();

        assertEquals(List.of(3L, 4L, 5L), history.stream().map(RateTable::getVersion).collect(Collectors.toList()));
        assertEquals(5, await(repository.load()).result().orElseThrow().getVersion());
    }

    @Test
    void save_concurrentCallsShouldBeAppliedInOrder() throws InterruptedException {
        List<Future<Void>> saves = new ArrayList<>();
        for (RateTable table : tables(3)) {
            saves.add(repository.save(table));
        }
        for (Future<Void> save : saves) {
            assertTrue(await(save).succeeded());
        }

        assertEquals(3, await(repository.load()).result().orElseThrow().getVersion());
        assertEquals(List.of(1L, 2L, 3L), await(repository.loadHistory()).result().stream()
                .map(RateTable::getVersion).collect(Collectors.toList()));
    }

    @Test
    void save_shouldNotLeaveTemporaryFiles() throws InterruptedException, IOException {
        await(repository.save(tables(1).get(0)));

        try (Stream<Path> files = Files.list(dataDir)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void load_corruptedFileShouldFail() throws InterruptedException, IOException {
        Files.writeString(dataDir.resolve(JsonFileRateTableRepository.CURRENT_FILE), "{ not json");

        assertTrue(await(repository.load()).failed());
    }
}
