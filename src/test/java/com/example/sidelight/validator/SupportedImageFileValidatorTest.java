package com.example.sidelight.validator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SupportedImageFileValidatorTest {

    private final SupportedImageFileValidator validator = new SupportedImageFileValidator();

    @Test
    void acceptsRawAndRenderedImages() {
        assertTrue(validator.isValid("IMG_0001.CR2", null));
        assertTrue(validator.isValid("export.jpg", null));
    }

    @Test
    void rejectsMissingOrForeignFiles() {
        assertFalse(validator.isValid(null, null));
        assertFalse(validator.isValid("   ", null));
        assertFalse(validator.isValid("clip.mov", null));
    }
}
