package com.rfqlog.application.port.out;

import io.vertx.core.Future;

/**
 * Output port - tells whether an audited entity exists
 */
public interface EntityDirectory {

    Future<Boolean> exists(Long entityId);
}
