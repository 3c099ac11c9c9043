package me.golemcore.relay.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiveResponse {
    private boolean success;
    private String message;
    private String documentId;
    private String timestamp;
}
