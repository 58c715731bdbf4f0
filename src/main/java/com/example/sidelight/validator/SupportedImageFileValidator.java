package com.example.sidelight.validator;

import com.example.sidelight.util.ImageFormats;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class SupportedImageFileValidator implements ConstraintValidator<SupportedImageFile, String> {

    @Override
    public boolean isValid(String fileName, ConstraintValidatorContext context) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return false; // a source name is always required
        }
        return ImageFormats.isSupported(fileName);
    }
}
