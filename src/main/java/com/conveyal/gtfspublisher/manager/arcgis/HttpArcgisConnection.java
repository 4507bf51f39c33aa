package com.conveyal.gtfspublisher.manager.arcgis;

import com.conveyal.gtfspublisher.manager.utils.HttpUtils;
import com.conveyal.gtfspublisher.manager.utils.SimpleHttpResponse;
import com.conveyal.gtfspublisher.manager.utils.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;

/**
 * {@link ArcgisConnection} backed by the ArcGIS REST API. Every operation is a form-encoded POST that asks for a JSON
 * response. The connection holds no mutable state.
 */
public class HttpArcgisConnection implements ArcgisConnection {
    private static final Logger LOG = LoggerFactory.getLogger(HttpArcgisConnection.class);
    public static final int DEFAULT_CONNECTION_TIMEOUT = 60_000;

    private final String restUrl;
    private final String username;
    private final String token;
    private final int connectionTimeout;
    private final boolean shareWithEveryone;
    private final boolean shareWithOrg;

    public HttpArcgisConnection(
        String portalUrl,
        String username,
        String token,
        int connectionTimeout,
        boolean shareWithEveryone,
        boolean shareWithOrg
    ) {
        String base = portalUrl.endsWith("/") ? portalUrl.substring(0, portalUrl.length() - 1) : portalUrl;
        this.restUrl = base + "/sharing/rest";
        this.username = username;
        this.token = token;
        this.connectionTimeout = connectionTimeout;
        this.shareWithEveryone = shareWithEveryone;
        this.shareWithOrg = shareWithOrg;
    }

    @Override
    public String createGroup(String title, String access, String description) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("title", title);
        params.put("access", access);
        params.put("description", description);
        params.put("tags", "gtfs");
        JsonNode response = post(restUrl + "/community/createGroup", params);
        return requireText(response.path("group"), "id", "createGroup");
    }

    @Override
    public String addItem(String title, String type, String tags, String text) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("title", title);
        params.put("type", type);
        params.put("tags", tags);
        params.put("text", text);
        JsonNode response = post(userContentUrl() + "/addItem", params);
        return requireText(response, "id", "addItem");
    }

    @Override
    public ServiceConnection createService(ObjectNode createParameters) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("createParameters", createParameters.toString());
        params.put("outputType", "featureService");
        JsonNode response = post(userContentUrl() + "/createService", params);
        String itemId = response.hasNonNull("serviceItemId")
            ? response.get("serviceItemId").asText()
            : requireText(response, "itemId", "createService");
        String serviceUrl = requireText(response, "serviceurl", "createService");
        return new ServiceConnection(itemId, createParameters.path("name").asText(), serviceUrl);
    }

    @Override
    public Map<String, Integer> addToDefinition(ServiceConnection service, ObjectNode definition)
        throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("addToDefinition", definition.toString());
        JsonNode response = post(service.adminUrl + "/addToDefinition", params);
        requireSuccess(response, "addToDefinition");
        Map<String, Integer> layerIds = new LinkedHashMap<>();
        for (JsonNode layer : response.path("layers")) {
            layerIds.put(layer.path("name").asText(), layer.path("id").asInt());
        }
        return layerIds;
    }

    @Override
    public ObjectNode analyze(String csvText) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("text", csvText);
        params.put("filetype", "csv");
        params.put("analyzeParameters", objectMapper.createObjectNode()
            .put("enableGlobalGeocoding", false)
            .put("sourceLocale", "en")
            .toString());
        JsonNode response = post(restUrl + "/content/features/analyze", params);
        JsonNode publishParameters = response.get("publishParameters");
        if (publishParameters == null || !publishParameters.isObject()) {
            throw new ArcgisException("analyze response did not contain publishParameters");
        }
        return (ObjectNode) publishParameters;
    }

    @Override
    public List<GeneratedFeature> generate(String csvText, ObjectNode publishParameters) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("text", csvText);
        params.put("filetype", "csv");
        params.put("publishParameters", publishParameters.toString());
        JsonNode response = post(restUrl + "/content/features/generate", params);
        JsonNode layers = response.path("featureCollection").path("layers");
        if (!layers.isArray() || layers.size() == 0) {
            throw new ArcgisException("generate response did not contain a feature collection layer");
        }
        List<GeneratedFeature> features = new ArrayList<>();
        for (JsonNode feature : layers.get(0).path("featureSet").path("features")) {
            JsonNode geometry = feature.path("geometry");
            JsonNode attributes = feature.path("attributes");
            features.add(new GeneratedFeature(
                geometry.isObject() ? (ObjectNode) geometry : objectMapper.createObjectNode(),
                attributes.isObject() ? (ObjectNode) attributes : objectMapper.createObjectNode()
            ));
        }
        return features;
    }

    @Override
    public int addFeatures(ServiceConnection service, int layerId, ArrayNode features) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("features", features.toString());
        params.put("rollbackOnFailure", "true");
        JsonNode response = post(service.layerUrl(layerId) + "/addFeatures", params);
        int added = 0;
        for (JsonNode result : response.path("addResults")) {
            if (!result.path("success").asBoolean(false)) {
                throw new ArcgisException(String.format(
                    "addFeatures to layer %d of %s failed: %s",
                    layerId,
                    service.name,
                    result.path("error").path("description").asText("unknown error")
                ));
            }
            added++;
        }
        return added;
    }

    @Override
    public void share(String itemId, String groupId) throws ArcgisException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("everyone", Boolean.toString(shareWithEveryone));
        params.put("org", Boolean.toString(shareWithOrg));
        params.put("groups", groupId);
        JsonNode response = post(String.format("%s/content/items/%s/share", restUrl, itemId), params);
        for (JsonNode notShared : response.path("notSharedWith")) {
            if (groupId.equals(notShared.asText())) {
                throw new ArcgisException(String.format("Item %s was not shared with group %s", itemId, groupId));
            }
        }
    }

    private String userContentUrl() {
        return String.format("%s/content/users/%s", restUrl, username);
    }

    /**
     * POST the parameters (plus format and token) and return the parsed JSON body. ArcGIS reports most errors with an
     * HTTP 200 and an error object in the body, so both the status and the body are checked.
     */
    private JsonNode post(String url, Map<String, String> params) throws ArcgisException {
        Map<String, String> form = new LinkedHashMap<>(params);
        form.put("f", "json");
        if (token != null) form.put("token", token);
        SimpleHttpResponse response;
        try {
            response = HttpUtils.postForm(new URI(url), connectionTimeout, form);
        } catch (URISyntaxException e) {
            throw new ArcgisException(String.format("Invalid ArcGIS url %s", url), e);
        } catch (IOException e) {
            throw new ArcgisException(String.format("Request to %s failed: %s", url, e.getMessage()), e);
        }
        if (!response.isSuccess()) {
            throw new ArcgisException(
                String.format("Request to %s returned HTTP %d", url, response.status),
                response.status
            );
        }
        JsonNode json;
        try {
            json = JsonUtil.getJsonNodeFromResponse(response);
        } catch (IOException e) {
            throw new ArcgisException(String.format("Could not parse response from %s", url), e);
        }
        JsonNode error = json.get("error");
        if (error != null) {
            String message = error.path("message").asText("unknown error");
            JsonNode details = error.path("details");
            if (details.isArray() && details.size() > 0) {
                List<String> detailMessages = new ArrayList<>();
                details.forEach(detail -> detailMessages.add(detail.asText()));
                message = String.format("%s (%s)", message, String.join("; ", detailMessages));
            }
            LOG.warn("ArcGIS error from {}: {}", url, message);
            throw new ArcgisException(message, error.path("code").asInt(-1));
        }
        return json;
    }

    private static void requireSuccess(JsonNode response, String operation) throws ArcgisException {
        if (response.has("success") && !response.get("success").asBoolean()) {
            throw new ArcgisException(String.format("%s was not successful", operation));
        }
    }

    private static String requireText(JsonNode node, String field, String operation) throws ArcgisException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new ArcgisException(String.format("%s response is missing %s", operation, field));
        }
        return value.asText();
    }
}
