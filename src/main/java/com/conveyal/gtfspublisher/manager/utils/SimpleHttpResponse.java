package com.conveyal.gtfspublisher.manager.utils;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The status and body of an HTTP response, read eagerly so that the connection can be released.
 */
public class SimpleHttpResponse {
    private static final Logger LOG = LoggerFactory.getLogger(SimpleHttpResponse.class);
    public final int status;
    public final String body;

    public SimpleHttpResponse(HttpResponse httpResponse) throws IOException {
        status = httpResponse.getStatusLine().getStatusCode();
        HttpEntity entity = httpResponse.getEntity();
        try {
            body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Could not read body of HTTP {} response", status, e);
            throw e;
        }
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
