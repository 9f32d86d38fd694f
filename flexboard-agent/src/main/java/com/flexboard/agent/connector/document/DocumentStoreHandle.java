package com.flexboard.agent.connector.document;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoDatabase;

/**
 * One pooled document-store handle: an exclusive driver session on the pool's client.
 *
 * @param session client session owned by the current checkout
 * @param database configured database
 */
public record DocumentStoreHandle(ClientSession session, MongoDatabase database) {
}
