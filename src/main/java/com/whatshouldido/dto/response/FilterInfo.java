package com.whatshouldido.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 실제로 적용된 필터 값
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterInfo {
    private Integer radius;
    private Integer walkingDistance;
    private String budget;
    private List<String> include;
    private List<String> exclude;
    private List<String> dietary;
    private boolean appliedVariety;
    private boolean appliedContextual;
}
