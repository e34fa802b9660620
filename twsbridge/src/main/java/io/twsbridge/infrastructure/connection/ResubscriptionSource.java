package io.twsbridge.infrastructure.connection;

import io.twsbridge.domain.request.ClientRequest;

import java.util.List;

/**
 * Supplies the subscribe requests to replay after a reconnect.
 * Each request keeps the id it was first issued with.
 */
@FunctionalInterface
public interface ResubscriptionSource {

    List<ClientRequest> activeRequests();
}
