package com.conveyal.gtfspublisher.manager.arcgis;

/**
 * Handle on a hosted feature service created during an import. Immutable, so that it can be shared by every task that
 * talks to the service.
 */
public class ServiceConnection {
    public final String itemId;
    public final String name;
    /** Service endpoint, e.g. https://services.arcgis.com/org/arcgis/rest/services/name/FeatureServer */
    public final String serviceUrl;
    /** Administrative endpoint used to change the service definition. */
    public final String adminUrl;

    public ServiceConnection(String itemId, String name, String serviceUrl) {
        this.itemId = itemId;
        this.name = name;
        this.serviceUrl = stripTrailingSlash(serviceUrl);
        this.adminUrl = this.serviceUrl.replace("/rest/services/", "/rest/admin/services/");
    }

    public String layerUrl(int layerId) {
        return String.format("%s/%d", serviceUrl, layerId);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return String.format("ServiceConnection{%s %s}", itemId, serviceUrl);
    }
}
