package com.example.sidelight.config;

import com.example.sidelight.dto.NativeParameterSet;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named style presets, each a complete native parameter set, loaded from a classpath JSON file
 * of the form {@code {"presets": [{"name": ..., "description": ..., "params": {...}}]}}.
 */
@Slf4j
@Configuration
public class PresetConfig {

    private final ObjectMapper mapper;
    private final String presetsFile;

    private final Map<String, NativeParameterSet> presets = new LinkedHashMap<>();

    @Getter
    private List<Map<String, Object>> presetList = List.of(); // raw catalogue for the API

    public PresetConfig(ObjectMapper mapper, @Value("${sidelight.presets-file:presets.json}") String presetsFile) {
        this.mapper = mapper;
        this.presetsFile = presetsFile;
    }

    @PostConstruct
    public void loadPresets() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(presetsFile)) {
            if (inputStream == null) {
                log.warn("Preset file {} not found on classpath, no presets available", presetsFile);
                return;
            }
            Map<String, List<Map<String, Object>>> json = mapper.readValue(inputStream, new TypeReference<>() {});
            presetList = json.getOrDefault("presets", List.of());

            presets.clear();
            for (Map<String, Object> preset : presetList) {
                String name = (String) preset.get("name");
                if (name == null || preset.get("params") == null) {
                    log.warn("Skipping preset without name or params: {}", preset);
                    continue;
                }
                NativeParameterSet params = mapper.convertValue(preset.get("params"), NativeParameterSet.class);
                presets.put(name.toLowerCase(Locale.ROOT), params);
            }

            log.info("Loaded {} presets from {}", presets.size(), presetsFile);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load {}", presetsFile, e);
        }
    }

    /**
     * @return a fresh copy of the preset's parameters, so callers may not alter the catalogue
     */
    public Optional<NativeParameterSet> getPreset(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(presets.get(name.trim().toLowerCase(Locale.ROOT)))
                .map(NativeParameterSet::copy);
    }

    public int size() {
        return presets.size();
    }
}
