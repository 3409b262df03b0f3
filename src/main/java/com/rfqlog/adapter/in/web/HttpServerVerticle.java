package com.rfqlog.adapter.in.web;

import com.rfqlog.adapter.in.web.history.RevisionHistoryHandler;
import com.rfqlog.adapter.out.persistence.JdbcEntityDirectoryAdapter;
import com.rfqlog.adapter.out.persistence.JdbcRevisionPersistenceAdapter;
import com.rfqlog.adapter.out.persistence.SchemaInitializer;
import com.rfqlog.application.port.in.RecordChangesUseCase;
import com.rfqlog.application.port.in.RevisionHistoryUseCase;
import com.rfqlog.application.port.out.EntityDirectory;
import com.rfqlog.application.port.out.RevisionRepository;
import com.rfqlog.application.service.DiffEngine;
import com.rfqlog.application.service.RecordChangesUseCaseImpl;
import com.rfqlog.application.service.RevisionHistoryUseCaseImpl;
import com.rfqlog.application.service.RevisionTreeBuilder;
import com.rfqlog.application.service.SnapshotValidator;
import com.rfqlog.domain.model.PartFieldSchema;
import com.rfqlog.infrastructure.config.RevisionSettings;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - wires the revision log and serves the history endpoint.
 * The use cases are also exposed for in-process callers (the part dialog's save hook).
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;
    private static final String DEFAULT_VALIDATION_QUERY = "SELECT 1";

    private JDBCPool jdbcPool;
    private RevisionSettings settings;
    private RecordChangesUseCase recordChangesUseCase;
    private RevisionHistoryUseCase revisionHistoryUseCase;
    private RevisionHistoryHandler historyHandler;
    private int actualPort;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeDatabase()
                .compose(v -> {
                    log.info("Database initialized successfully");
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort);
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    public RecordChangesUseCase getRecordChangesUseCase() {
        return recordChangesUseCase;
    }

    public RevisionHistoryUseCase getRevisionHistoryUseCase() {
        return revisionHistoryUseCase;
    }

    public int getActualPort() {
        return actualPort;
    }

    private Future<Void> initializeDatabase() {
        try {
            JsonObject dbConfig = config().getJsonObject("database");
            if (dbConfig == null) {
                return Future.failedFuture("Database configuration not found in application.yml");
            }

            log.info("Connecting to database: {}", dbConfig.getString("url"));

            JsonObject poolConfig = new JsonObject()
                    .put("url", dbConfig.getString("url"))
                    .put("user", dbConfig.getString("user"))
                    .put("password", dbConfig.getString("password"))
                    .put("driver_class", dbConfig.getString("driver_class"))
                    .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

            jdbcPool = JDBCPool.pool(vertx, poolConfig);

            Future<Void> connected = jdbcPool.query(dbConfig.getString("validation-query", DEFAULT_VALIDATION_QUERY)).execute()
                    .onSuccess(result -> log.info("Database connection test successful"))
                    .onFailure(error -> log.error("Database connection failed", error))
                    .mapEmpty();

            if (!dbConfig.getBoolean("init-schema", false)) {
                return connected;
            }
            return connected.compose(v -> new SchemaInitializer(jdbcPool).initialize());

        } catch (Exception e) {
            log.error("Error initializing database", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> initializeServices() {
        try {
            settings = RevisionSettings.from(config());
        } catch (IllegalStateException e) {
            return Future.failedFuture(e);
        }

        // Output ports (adapters)
        RevisionRepository revisionRepository = new JdbcRevisionPersistenceAdapter(jdbcPool);
        EntityDirectory entityDirectory = null;
        if (settings.isEntityCheckEnabled()) {
            entityDirectory = new JdbcEntityDirectoryAdapter(jdbcPool, settings.getEntityTable(), settings.getEntityIdColumn());
            log.info("Entity existence check enabled against {}.{}", settings.getEntityTable(), settings.getEntityIdColumn());
        }

        // Application services (use cases)
        SnapshotValidator validator = new SnapshotValidator();
        recordChangesUseCase = new RecordChangesUseCaseImpl(
                new DiffEngine(validator),
                validator,
                revisionRepository,
                jdbcPool,
                Clock.systemUTC()
        );
        revisionHistoryUseCase = new RevisionHistoryUseCaseImpl(
                revisionRepository,
                new RevisionTreeBuilder(settings.getTimeZone()),
                entityDirectory
        );

        // Input adapters (handlers)
        historyHandler = new RevisionHistoryHandler(revisionHistoryUseCase, PartFieldSchema.PART, settings.getTimeZone());

        log.info("Services wired up, history dates in {}", settings.getTimeZone());
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        // Setup routes
        WebRouter webRouter = new WebRouter(router, historyHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> {
                    actualPort = server.actualPort();
                    log.info("HTTP server listening on port {}", actualPort);
                })
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }
}
