package io.github.chirino.checkin.api;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;

/**
 * The caller's address as seen by the server socket. Deployments behind a proxy enable {@code
 * quarkus.http.proxy.proxy-address-forwarding} so that this reflects the forwarded client.
 */
final class ClientAddress {

    private ClientAddress() {}

    static String of(HttpServerRequest request) {
        if (request == null) {
            return null;
        }
        SocketAddress address = request.remoteAddress();
        return address == null ? null : address.hostAddress();
    }
}
