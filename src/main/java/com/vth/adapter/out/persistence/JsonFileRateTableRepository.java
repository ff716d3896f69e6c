package com.vth.adapter.out.persistence;

import com.vth.application.port.out.RateTableRepository;
import com.vth.domain.model.RateTable;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.JsonArray;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON file implementation of RateTableRepository.
 * {@code exchange_rates.json} holds the current table, {@code rates_history.json} the last
 * {@code maxHistoryEntries} saved tables, oldest first. Saves are applied one after another.
 */
@Slf4j
public class JsonFileRateTableRepository implements RateTableRepository {

    static final String CURRENT_FILE = "exchange_rates.json";
    static final String HISTORY_FILE = "rates_history.json";

    private final FileSystem fs;
    private final String dataDir;
    private final String currentPath;
    private final String historyPath;
    private final int maxHistoryEntries;
    private Future<Void> lastWrite = Future.succeededFuture();

    public JsonFileRateTableRepository(Vertx vertx, String dataDir, int maxHistoryEntries) {
        this.fs = vertx.fileSystem();
        this.dataDir = dataDir;
        this.currentPath = Paths.get(dataDir, CURRENT_FILE).toString();
        this.historyPath = Paths.get(dataDir, HISTORY_FILE).toString();
        this.maxHistoryEntries = maxHistoryEntries;
    }

    @Override
    public Future<Optional<RateTable>> load() {
        return JsonFiles.readIfExists(fs, currentPath)
                .map(content -> content.map(buffer -> RateTableJsonCodec.decode(buffer.toJsonObject())))
                .onSuccess(table -> table.ifPresentOrElse(
                        t -> log.info("Loaded rate table version {} from {}", t.getVersion(), currentPath),
                        () -> log.info("No stored rate table at {}", currentPath)))
                .onFailure(error -> log.error("Failed to load rate table from {}: {}", currentPath, error.getMessage()));
    }

    @Override
    public synchronized Future<Void> save(RateTable table) {
        lastWrite = lastWrite.transform(ignored -> write(table));
        return lastWrite;
    }

    @Override
    public Future<List<RateTable>> loadHistory() {
        return readHistory()
                .map(array -> {
                    List<RateTable> tables = new ArrayList<>();
                    for (int i = 0; i < array.size(); i++) {
                        tables.add(RateTableJsonCodec.decode(array.getJsonObject(i)));
                    }
                    return tables;
                })
                .onFailure(error -> log.error("Failed to load rate history from {}: {}", historyPath, error.getMessage()));
    }

    private Future<Void> write(RateTable table) {
        return JsonFiles.writeAtomically(fs, dataDir, currentPath, RateTableJsonCodec.encode(table).toBuffer())
                .compose(v -> readHistory())
                .compose(history -> {
                    history.add(RateTableJsonCodec.encode(table));
                    while (history.size() > maxHistoryEntries) {
                        history.remove(0);
                    }
                    return JsonFiles.writeAtomically(fs, dataDir, historyPath, history.toBuffer());
                })
                .onSuccess(v -> log.debug("Saved rate table version {} to {}", table.getVersion(), currentPath))
                .onFailure(error -> log.error("Failed to save rate table version {}: {}", table.getVersion(), error.getMessage()));
    }

    private Future<JsonArray> readHistory() {
        return JsonFiles.readIfExists(fs, historyPath)
                .map(content -> content.map(buffer -> buffer.toJsonArray()).orElseGet(JsonArray::new));
    }
}
