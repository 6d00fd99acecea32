package org.neurobagel.api.server.controller;

/**
 * Body returned for failed requests.
 *
 * @param code    stable machine-readable error code
 * @param message human-readable description
 */
public record ErrorResponse(String code, String message) {
}
