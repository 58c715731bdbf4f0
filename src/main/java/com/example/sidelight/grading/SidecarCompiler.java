package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import com.example.sidelight.dto.NativeParameterSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Runs the grading pipeline in its only valid order: convert (slider input only), sanitize,
 * then validate curves and serialize. There is no path around the sanitizer.
 * <p>
 * Stateless; safe to call concurrently.
 */
@Component
@RequiredArgsConstructor
public class SidecarCompiler {

    private final CrossSpaceConverter converter;
    private final ParameterSanitizer sanitizer;
    private final SidecarSerializer serializer;

    public Compilation compile(ConsumerParameterSet params, boolean raw) {
        return compile(converter.convert(params), raw);
    }

    public Compilation compile(NativeParameterSet params, boolean raw) {
        NativeParameterSet sanitized = sanitizer.sanitize(params);
        return new Compilation(sanitized, serializer.serialize(sanitized, raw));
    }

    /**
     * The sanitized parameters together with the document rendered from them.
     */
    public static class Compilation {

        private final NativeParameterSet parameters;
        private final SidecarDocument document;

        Compilation(NativeParameterSet parameters, SidecarDocument document) {
            this.parameters = parameters;
            this.document = document;
        }

        public NativeParameterSet getParameters() {
            return parameters;
        }

        public SidecarDocument getDocument() {
            return document;
        }
    }
}
