package com.example.sidelight.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SidecarResponse {
    private String sourceFile;
    private boolean raw;
    private String preset;
    private NativeParameterSet params;     // sanitized, exactly what the pp3 was rendered from
    private Map<String, String> documents; // format -> sidecar text
}
