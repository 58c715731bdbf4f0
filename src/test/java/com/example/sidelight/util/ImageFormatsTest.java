package com.example.sidelight.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageFormatsTest {

    @Test
    void rawExtensions_areCaseInsensitive() {
        assertTrue(ImageFormats.isRaw("DSC_0042.NEF"));
        assertTrue(ImageFormats.isRaw("/photos/img.cr3"));
        assertFalse(ImageFormats.isRaw("holiday.jpg"));
        assertFalse(ImageFormats.isRaw(null));
    }

    @Test
    void supportedFormats() {
        assertTrue(ImageFormats.isSupported("holiday.JPEG"));
        assertTrue(ImageFormats.isSupported("scan.png"));
        assertTrue(ImageFormats.isSupported("a.dng"));
        assertFalse(ImageFormats.isSupported("movie.mp4"));
        assertFalse(ImageFormats.isSupported("no_extension"));
        assertFalse(ImageFormats.isSupported("trailing."));
    }

    @Test
    void extension_ignoresDotsInDirectories() {
        assertEquals("", ImageFormats.extension("/tmp/v1.2/README"));
        assertEquals("arw", ImageFormats.extension("C:\\shots\\x.ARW"));
    }

    @Test
    void baseName_stripsDirectoriesAndExtension() {
        assertEquals("DSC_0042", ImageFormats.baseName("/photos/DSC_0042.NEF"));
        assertEquals("x", ImageFormats.baseName("C:\\shots\\x.ARW"));
        assertEquals("archive.tar", ImageFormats.baseName("archive.tar.png"));
        assertEquals(".hidden", ImageFormats.baseName(".hidden"));
    }
}
