package com.whatshouldido.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionRequest {
    private String placeId;
    private String placeName;
    private String reason;
    private Integer days; // null 이면 영구 제외
}
