package com.vtb.auditor.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class BreakdownStats {
    int total;
    int passed;
    int failed;
}
