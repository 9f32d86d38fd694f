package com.flexboard.agent.connector.http;

import java.net.http.HttpClient;

/**
 * One pooled HTTP-API handle. Each handle has its own client, so discarding a handle after an
 * I/O failure also drops the connections it held.
 *
 * @param client http client used only by the current checkout
 */
public record HttpApiHandle(HttpClient client) {
}
