package com.example.hybridretrieval.domain.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RetrievalRequest {

    @NotBlank
    private String query;

    // vector | keyword | hybrid; defaults to hybrid
    private String mode;

    @Positive
    @Max(1000)
    private Integer k;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double alpha;
}
