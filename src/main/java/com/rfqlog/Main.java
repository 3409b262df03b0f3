package com.rfqlog;

import com.rfqlog.adapter.in.web.HttpServerVerticle;
import com.rfqlog.infrastructure.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Part Revision Log...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        // Load configuration from application.yml
        JsonObject config = ConfigLoader.load();

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Part Revision Log...");
                        vertx.close();
                    }));

                    log.info("Part Revision Log is ready!");
                    log.info("History Endpoint: http://localhost:{}/api/parts/:id/revisions",
                            config.getJsonObject("http", new JsonObject()).getInteger("port", 8080));
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }
}
