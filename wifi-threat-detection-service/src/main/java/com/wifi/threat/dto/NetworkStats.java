package com.wifi.threat.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Dashboard counters over the stored access point records. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NetworkStats {
    private long total;
    /** Records whose last observation falls inside the trailing activity window. */
    private long recentlyActive;
    private long trusted;
    private long unknown;
    private long suspicious;
}
