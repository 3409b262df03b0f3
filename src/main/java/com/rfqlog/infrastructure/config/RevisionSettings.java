package com.rfqlog.infrastructure.config;

import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Typed view of the "revision" configuration section
 */
@Value
public class RevisionSettings {

    public static final String DEFAULT_TIME_ZONE = "UTC";

    ZoneId timeZone;
    String entityTable;     // null when existence checks are off
    String entityIdColumn;

    public boolean isEntityCheckEnabled() {
        return entityTable != null;
    }

    public static RevisionSettings from(JsonObject config) {
        JsonObject revision = config.getJsonObject("revision", new JsonObject());

        String zoneId = revision.getString("time-zone", DEFAULT_TIME_ZONE);
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid revision.time-zone: " + zoneId, e);
        }

        JsonObject entityCheck = revision.getJsonObject("entity-check");
        if (entityCheck == null || entityCheck.getString("table") == null) {
            return new RevisionSettings(zone, null, null);
        }
        return new RevisionSettings(zone, entityCheck.getString("table"), entityCheck.getString("id-column", "ID"));
    }
}
