package com.flexboard.agent.connector.document;

import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.QueryDispatchException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.error.TransientBackendException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

/**
 * Maps MongoDB driver failures onto the dispatch error taxonomy.
 */
final class DocumentStoreErrors {

    private DocumentStoreErrors() {
    }

    static QueryDispatchException classify(MongoException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof MongoExecutionTimeoutException) {
            return new QueryTimeoutException("Query exceeded maxTime: " + message, e);
        }
        if (e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e instanceof MongoNotPrimaryException
                || e instanceof MongoNodeIsRecoveringException
                || e instanceof MongoInterruptedException
                || e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
            return new TransientBackendException(message, e);
        }
        if (e instanceof MongoSecurityException) {
            return new PermanentBackendException(message, e);
        }
        if (e instanceof MongoCommandException) {
            // the server rejected the command; the session is still usable
            return new PermanentBackendException(message + " (code " + e.getCode() + ")", null, e, true);
        }
        return new PermanentBackendException(message, e);
    }
}
