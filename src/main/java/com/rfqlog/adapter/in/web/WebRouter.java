package com.rfqlog.adapter.in.web;

import com.rfqlog.adapter.in.web.history.RevisionHistoryHandler;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for revision endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final RevisionHistoryHandler revisionHistoryHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/parts/:entityId/revisions").handler(ctx -> {
            ctx.response().setStatusCode(204).end();
        });

        // Revision history of a part
        router.get("/api/parts/:entityId/revisions")
                .handler(revisionHistoryHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"part-revision-log\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Part Revision Log\",\"version\":\"1.0.0\"}");
                });
    }
}
