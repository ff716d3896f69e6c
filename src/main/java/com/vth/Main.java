package com.vth;

import com.vth.adapter.in.web.HttpServerVerticle;
import com.vth.infrastructure.config.AppConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting ValutaTrade Hub...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        JsonObject config;
        try {
            config = AppConfig.loadYaml("application.yml");
            log.info("Loaded configuration from application.yml");
        } catch (RuntimeException e) {
            log.error("Failed to load application.yml: {}", e.getMessage());
            vertx.close();
            throw e;
        }

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    // Add shutdown hook
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down ValutaTrade Hub...");
                        vertx.close();
                    }));

                    log.info("ValutaTrade Hub is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
