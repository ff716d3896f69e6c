package com.vth.adapter.out.persistence;

import com.vth.application.port.out.PortfolioRepository;
import com.vth.domain.model.Portfolio;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.file.FileSystem;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * JSON file implementation of PortfolioRepository, one file per user under {@code portfolios/}.
 * Writes for one user are applied in order, each capturing the portfolio as it is when it runs.
 */
@Slf4j
public class JsonFilePortfolioRepository implements PortfolioRepository {

    private static final Pattern SAFE_USER_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final FileSystem fs;
    private final String portfolioDir;
    private final Map<String, Future<Void>> lastWrites = new ConcurrentHashMap<>();

    public JsonFilePortfolioRepository(Vertx vertx, String dataDir) {
        this.fs = vertx.fileSystem();
        this.portfolioDir = Paths.get(dataDir, "portfolios").toString();
    }

    @Override
    public Future<Optional<Portfolio>> load(String userId) {
        String path;
        try {
            path = pathOf(userId);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return JsonFiles.readIfExists(fs, path)
                .map(content -> content.map(buffer -> PortfolioJsonCodec.decode(buffer.toJsonObject())))
                .onSuccess(portfolio -> portfolio.ifPresent(p -> log.debug("Loaded portfolio of user {}", userId)))
                .onFailure(error -> log.error("Failed to load portfolio of user {}: {}", userId, error.getMessage()));
    }

    @Override
    public Future<Void> save(Portfolio portfolio) {
        String userId = portfolio.getUserId();
        String path;
        try {
            path = pathOf(userId);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return lastWrites.compute(userId, (id, previous) ->
                (previous == null ? Future.<Void>succeededFuture() : previous)
                        .transform(ignored -> write(path, portfolio)));
    }

    private Future<Void> write(String path, Portfolio portfolio) {
        Portfolio.Snapshot snapshot = portfolio.snapshot();
        return JsonFiles.writeAtomically(fs, portfolioDir, path, PortfolioJsonCodec.encode(snapshot).toBuffer())
                .onSuccess(v -> log.debug("Saved portfolio of user {} ({} trades)", snapshot.userId(), snapshot.trades().size()))
                .onFailure(error -> log.error("Failed to save portfolio of user {}: {}", snapshot.userId(), error.getMessage()));
    }

    private String pathOf(String userId) {
        if (userId == null || !SAFE_USER_ID.matcher(userId).matches()) {
            throw new IllegalArgumentException("Invalid user id for storage: " + userId);
        }
        return Paths.get(portfolioDir, userId + ".json").toString();
    }
}
