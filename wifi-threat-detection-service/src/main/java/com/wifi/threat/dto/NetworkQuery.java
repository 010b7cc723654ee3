package com.wifi.threat.dto;

import lombok.Builder;

/**
 * Filter, search and ordering options for listing access point records.
 *
 * @param status persisted status to match; {@code null} or {@code "all"} disables the filter
 * @param search case-insensitive substring matched against SSID and BSSID
 * @param limit maximum number of records returned
 * @param sortBy record field to order by
 * @param order {@code asc} or {@code desc}
 */
@Builder
public record NetworkQuery(String status, String search, int limit, String sortBy, String order) {

    public static final int DEFAULT_LIMIT = 100;
    public static final String DEFAULT_SORT_BY = "lastSeen";
    public static final String DEFAULT_ORDER = "desc";

    public boolean hasStatusFilter() {
        return status != null && !status.isBlank() && !"all".equalsIgnoreCase(status);
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }

    public boolean isDescending() {
        return !"asc".equalsIgnoreCase(order);
    }
}
