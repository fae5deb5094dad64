package com.codeheadsystems.delegate.client.model;

import java.net.URI;

/**
 * Network connection details for a session key server.
 *
 * @param endpoint    base URI of the server (e.g. http://host:8080)
 * @param bearerToken owner token sent as {@code Authorization: Bearer ...}, null for none
 */
public record ServerConnectionInfo(URI endpoint, String bearerToken) {
}
