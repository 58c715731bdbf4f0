package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class XmpSidecarWriterTest {

    private final XmpSidecarWriter writer = new XmpSidecarWriter();

    private static Document parse(String xmp) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xmp)));
    }

    private static Element description(String xmp) throws Exception {
        return (Element) parse(xmp).getElementsByTagNameNS(XmpSidecarWriter.NS_RDF, "Description").item(0);
    }

    private static String crs(Element description, String name) {
        return description.hasAttributeNS(XmpSidecarWriter.NS_CRS, name)
                ? description.getAttributeNS(XmpSidecarWriter.NS_CRS, name)
                : null;
    }

    @Test
    void packetHasTheXmpEnvelope() throws Exception {
        String xmp = writer.write(new ConsumerParameterSet(), true);
        Document doc = parse(xmp);

        assertTrue(xmp.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"));
        Element root = doc.getDocumentElement();
        assertEquals(XmpSidecarWriter.NS_X, root.getNamespaceURI());
        assertEquals("xmpmeta", root.getLocalName());
        assertEquals("Sidelight", root.getAttributeNS(XmpSidecarWriter.NS_X, "xmptk"));
        assertEquals(1, doc.getElementsByTagNameNS(XmpSidecarWriter.NS_RDF, "RDF").getLength());

        Element description = description(xmp);
        assertEquals("", description.getAttributeNS(XmpSidecarWriter.NS_RDF, "about"));
        assertEquals("11.0", crs(description, "ProcessVersion"));
        assertEquals("True", crs(description, "HasSettings"));
    }

    @Test
    void settingsUseTheUsualPrefixes() {
        String xmp = writer.write(ConsumerParameterSet.builder().contrast(20).build(), true);

        assertTrue(xmp.contains("<x:xmpmeta"), xmp);
        assertTrue(xmp.contains("<rdf:Description"), xmp);
        assertTrue(xmp.contains("crs:Contrast2012="), xmp);
    }

    @Test
    void zeroValues_areOmitted() throws Exception {
        Element description = description(writer.write(ConsumerParameterSet.builder().contrast(20).build(), true));

        assertEquals("20", crs(description, "Contrast2012"));
        assertNull(crs(description, "Highlights2012"));
        assertNull(crs(description, "Exposure2012"));
        assertNull(crs(description, "Temperature"));
    }

    @Test
    void exposure_isTrimmedAndClamped() throws Exception {
        assertEquals("0.5", crs(description(writer.write(ConsumerParameterSet.builder().exposure(0.5).build(), true)), "Exposure2012"));
        assertEquals("5", crs(description(writer.write(ConsumerParameterSet.builder().exposure(7).build(), true)), "Exposure2012"));
        assertEquals("-1.23", crs(description(writer.write(ConsumerParameterSet.builder().exposure(-1.234).build(), true)), "Exposure2012"));
        assertNull(crs(description(writer.write(ConsumerParameterSet.builder().exposure(Double.NaN).build(), true)), "Exposure2012"));
    }

    @Test
    void sliders_areClamped() throws Exception {
        Element description = description(writer.write(ConsumerParameterSet.builder().contrast(150).sharpness(400).build(), true));

        assertEquals("100", crs(description, "Contrast2012"));
        assertEquals("150", crs(description, "Sharpness"));
    }

    @Test
    void renderedSource_keepsItsOwnWhiteBalance() throws Exception {
        ConsumerParameterSet params = ConsumerParameterSet.builder().temperature(6500).tint(10).build();

        Element rendered = description(writer.write(params, false));
        assertEquals("Embedded", crs(rendered, "CameraProfile"));
        assertNull(crs(rendered, "Temperature"));
        assertNull(crs(rendered, "Tint"));

        Element raw = description(writer.write(params, true));
        assertNull(crs(raw, "CameraProfile"));
        assertEquals("6500", crs(raw, "Temperature"));
        assertEquals("10", crs(raw, "Tint"));
    }

    @Test
    void hslAndSplitToning_areWritten() throws Exception {
        ConsumerParameterSet params = ConsumerParameterSet.builder()
                .hueRed(10).saturationBlue(-30).luminanceOrange(15)
                .splitShadowHue(220).splitShadowSaturation(20).splitBalance(-10)
                .build();

        Element description = description(writer.write(params, true));

        assertEquals("10", crs(description, "HueAdjustmentRed"));
        assertEquals("-30", crs(description, "SaturationAdjustmentBlue"));
        assertEquals("15", crs(description, "LuminanceAdjustmentOrange"));
        assertEquals("220", crs(description, "SplitToningShadowHue"));
        assertEquals("20", crs(description, "SplitToningShadowSaturation"));
        assertEquals("-10", crs(description, "SplitToningBalance"));
    }
}
