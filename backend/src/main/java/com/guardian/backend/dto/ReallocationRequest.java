package com.guardian.backend.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReallocationRequest {

    @Valid
    @Builder.Default
    private List<OpportunityRequest> opportunities = new ArrayList<>();
}
