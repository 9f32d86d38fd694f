package com.flexboard.agent.connector.http;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.pool.HandleFactory;

import java.net.http.HttpClient;

public class HttpApiHandleFactory implements HandleFactory<HttpApiHandle> {
    private final BackendProperties props;

    public HttpApiHandleFactory(BackendProperties props) {
        this.props = props;
    }

    @Override
    public HttpApiHandle create() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return new HttpApiHandle(client);
    }

    /**
     * HttpClient has no close on this JDK; its connections go with the last reference.
     */
    @Override
    public void destroy(HttpApiHandle handle) {
    }
}
