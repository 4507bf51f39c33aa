package com.conveyal.gtfspublisher.manager.utils;

import org.apache.http.NameValuePair;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HttpUtils {
    private static final Logger LOG = LoggerFactory.getLogger(HttpUtils.class);

    /**
     * POST the parameters as a UTF-8 form body. The same timeout applies to leasing, connecting and reading. The body is
     * fully read before the client is closed.
     */
    public static SimpleHttpResponse postForm(URI uri, int connectionTimeout, Map<String, String> params)
        throws IOException {
        RequestConfig timeouts = RequestConfig.custom()
            .setConnectionRequestTimeout(connectionTimeout)
            .setConnectTimeout(connectionTimeout)
            .setSocketTimeout(connectionTimeout)
            .build();

        List<NameValuePair> form = new ArrayList<>(params.size());
        params.forEach((key, value) -> form.add(new BasicNameValuePair(key, value)));
        HttpPost post = new HttpPost(uri);
        post.setConfig(timeouts);
        post.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));

        try (CloseableHttpClient client = HttpClients.createDefault();
             CloseableHttpResponse response = client.execute(post)) {
            return new SimpleHttpResponse(response);
        } catch (IOException e) {
            LOG.error("POST to {} failed", uri, e);
            throw e;
        }
    }
}
