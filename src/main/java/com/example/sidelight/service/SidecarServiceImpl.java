package com.example.sidelight.service;

import com.example.sidelight.config.PresetConfig;
import com.example.sidelight.dto.NativeParameterSet;
import com.example.sidelight.dto.SidecarExportResponse;
import com.example.sidelight.dto.SidecarRequest;
import com.example.sidelight.dto.SidecarResponse;
import com.example.sidelight.grading.SidecarCompiler;
import com.example.sidelight.grading.XmpSidecarWriter;
import com.example.sidelight.util.ImageFormats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarServiceImpl implements SidecarService {

    static final String PP3 = "pp3";
    static final String XMP = "xmp";

    private final SidecarCompiler compiler;
    private final XmpSidecarWriter xmpWriter;
    private final PresetConfig presetConfig;

    @Value("${sidelight.output-dir:./sidecars}")
    private String outputDir;

    @Value("${sidelight.default-format:pp3}")
    private String defaultFormat;

    @Override
    public SidecarResponse compile(SidecarRequest request) {
        Set<String> formats = resolveFormats(request.getFormats());
        boolean raw = isRaw(request);
        Map<String, String> documents = new LinkedHashMap<>();

        NativeParameterSet sanitized = null;
        String appliedPreset = null;

        if (formats.contains(PP3)) {
            Optional<NativeParameterSet> preset = presetConfig.getPreset(request.getPreset());
            if (request.getPreset() != null && preset.isEmpty()) {
                log.warn("Unknown preset '{}', ignoring it", request.getPreset());
            }

            SidecarCompiler.Compilation compilation;
            if (preset.isPresent()) {
                // a preset replaces the individual values completely
                appliedPreset = request.getPreset();
                compilation = compiler.compile(preset.get(), raw);
            } else if (request.getNativeParams() != null) {
                compilation = compiler.compile(request.getNativeParams(), raw);
            } else if (request.getConsumer() != null) {
                compilation = compiler.compile(request.getConsumer(), raw);
            } else {
                throw new IllegalArgumentException("No grading parameters to process");
            }
            sanitized = compilation.getParameters();
            documents.put(PP3, compilation.getDocument().render());
        }

        if (formats.contains(XMP)) {
            if (request.getConsumer() == null) {
                throw new IllegalArgumentException("XMP output needs slider-style (consumer) parameters");
            }
            documents.put(XMP, xmpWriter.write(request.getConsumer(), raw));
        }

        log.info("Compiled {} for {} (raw={}, preset={})", documents.keySet(), request.getSourceFile(), raw, appliedPreset);

        return SidecarResponse.builder()
                .sourceFile(request.getSourceFile())
                .raw(raw)
                .preset(appliedPreset)
                .params(sanitized)
                .documents(documents)
                .build();
    }

    @Override
    public SidecarExportResponse export(SidecarRequest request) throws IOException {
        SidecarResponse compiled = compile(request);

        Path dir = Paths.get(outputDir);
        Files.createDirectories(dir);
        String baseName = ImageFormats.baseName(request.getSourceFile());

        Map<String, String> written = new LinkedHashMap<>();
        for (Map.Entry<String, String> doc : compiled.getDocuments().entrySet()) {
            Path target = dir.resolve(baseName + "." + doc.getKey());
            Files.writeString(target, doc.getValue(), StandardCharsets.UTF_8);
            written.put(doc.getKey(), target.toString());
            log.info("Wrote {} sidecar: {}", doc.getKey(), target);
        }

        return SidecarExportResponse.builder()
                .sourceFile(request.getSourceFile())
                .raw(compiled.isRaw())
                .files(written)
                .build();
    }

    boolean isRaw(SidecarRequest request) {
        if (request.getRaw() != null) {
            return request.getRaw();
        }
        return ImageFormats.isRaw(request.getSourceFile());
    }

    /**
     * Normalizes requested format names: {@code rt} is an alias of pp3, {@code all} expands to
     * pp3 and xmp, duplicates collapse.
     */
    Set<String> resolveFormats(List<String> requested) {
        List<String> names = requested == null || requested.isEmpty() ? List.of(defaultFormat) : requested;
        Set<String> formats = new LinkedHashSet<>();
        for (String name : names) {
            String format = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            switch (format) {
                case PP3, "rt" -> formats.add(PP3);
                case XMP -> formats.add(XMP);
                case "all" -> {
                    formats.add(PP3);
                    formats.add(XMP);
                }
                default -> throw new IllegalArgumentException("Unsupported sidecar format: " + name);
            }
        }
        return formats;
    }

    void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    void setDefaultFormat(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }
}
