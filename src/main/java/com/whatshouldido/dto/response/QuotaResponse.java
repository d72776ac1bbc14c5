package com.whatshouldido.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaResponse {
    private String userId;
    private int remaining;
    private int limit;
    private boolean premium;
}
