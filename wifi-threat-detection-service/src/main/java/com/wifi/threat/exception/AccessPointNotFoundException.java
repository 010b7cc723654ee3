package com.wifi.threat.exception;

/**
 * Exception thrown when no access point record exists for a requested BSSID.
 */
public class AccessPointNotFoundException extends RuntimeException {

    private final String bssid;

    public AccessPointNotFoundException(String bssid) {
        super("Network not found: " + bssid);
        this.bssid = bssid;
    }

    public String getBssid() {
        return bssid;
    }
}
