package com.conveyal.gtfspublisher.manager.arcgis;

/**
 * A failed call to the ArcGIS portal. Checked so that every remote call site has to decide where the failure is
 * recorded.
 */
public class ArcgisException extends Exception {
    /** ArcGIS error code if the portal returned one, HTTP status otherwise, or -1 when no response was received. */
    public final int code;

    public ArcgisException(String message) {
        super(message);
        this.code = -1;
    }

    public ArcgisException(String message, int code) {
        super(message);
        this.code = code;
    }

    public ArcgisException(String message, Throwable cause) {
        super(message, cause);
        this.code = -1;
    }
}
