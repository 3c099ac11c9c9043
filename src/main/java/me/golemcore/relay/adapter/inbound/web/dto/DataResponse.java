package me.golemcore.relay.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Stored records, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataResponse {
    private boolean success;
    private List<Map<String, Object>> data;
    private int total;
    private String lastUpdated;
}
