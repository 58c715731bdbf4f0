package com.example.sidelight.util;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies source images by file extension.
 */
public final class ImageFormats {

    public static final Set<String> RAW_EXTENSIONS = Set.of("arw", "cr2", "cr3", "nef", "orf", "dng", "raf");
    public static final Set<String> RENDERED_EXTENSIONS = Set.of("jpg", "jpeg", "png");

    private ImageFormats() {
    }

    public static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = fileName.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int dot = name.lastIndexOf('.');
        if (dot <= slash || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** A mosaic sensor capture that still needs demosaicing and white balance. */
    public static boolean isRaw(String fileName) {
        return RAW_EXTENSIONS.contains(extension(fileName));
    }

    public static boolean isSupported(String fileName) {
        String ext = extension(fileName);
        return RAW_EXTENSIONS.contains(ext) || RENDERED_EXTENSIONS.contains(ext);
    }

    /**
     * File name without directories and extension, e.g. {@code DSC_0042} for
     * {@code /photos/DSC_0042.NEF}.
     */
    public static String baseName(String fileName) {
        String name = fileName.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
