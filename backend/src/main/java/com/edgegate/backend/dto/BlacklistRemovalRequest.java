package com.edgegate.backend.dto;

import com.edgegate.backend.model.ConditionDimension;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistRemovalRequest {

    @NotBlank
    private String strategyId;

    @NotEmpty
    private Map<ConditionDimension, String> conditions;
}
