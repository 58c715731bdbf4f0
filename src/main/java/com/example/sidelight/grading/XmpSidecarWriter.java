package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Writes slider-style parameters as an XMP packet of camera-raw settings, for editors that read
 * that format directly. Zero values are omitted; values are clamped to the slider ranges.
 * <p>
 * The {@code x:xmpmeta} envelope and its namespace declarations are written on the StAX writer;
 * the {@code rdf:RDF} body is marshalled from {@link XmpRdf} by Jackson into the same stream.
 */
@Component
public class XmpSidecarWriter {

    static final String NS_X = "adobe:ns:meta/";
    static final String NS_RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    static final String NS_CRS = "http://ns.adobe.com/camera-raw-settings/1.0/";
    static final String PROCESS_VERSION = "11.0";
    static final String TOOLKIT = "Sidelight";
    static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private static final XmlMapper XML_MAPPER = new XmlMapper();
    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    public String write(ConsumerParameterSet p, boolean raw) {
        StringWriter out = new StringWriter();
        out.write(XML_HEADER);
        try {
            XMLStreamWriter xml = OUTPUT_FACTORY.createXMLStreamWriter(out);
            xml.writeStartElement("x", "xmpmeta", NS_X);
            xml.writeNamespace("x", NS_X);
            xml.writeNamespace("rdf", NS_RDF);
            xml.writeNamespace("crs", NS_CRS);
            xml.setPrefix("x", NS_X);
            xml.setPrefix("rdf", NS_RDF);
            xml.setPrefix("crs", NS_CRS);
            xml.writeAttribute("x", NS_X, "xmptk", TOOLKIT);

            XML_MAPPER.writeValue(xml, new XmpRdf(describe(p, raw)));

            xml.writeEndElement();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write XMP packet", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        out.write('\n');
        return out.toString();
    }

    XmpDescription describe(ConsumerParameterSet p, boolean raw) {
        XmpDescription d = new XmpDescription();
        d.setProcessVersion(PROCESS_VERSION);
        d.setHasSettings("True");
        if (!raw) {
            // rendered sources keep their own colour rendition and white balance
            d.setCameraProfile("Embedded");
        }

        d.setExposure2012(decimal(Math.max(-5.0, Math.min(5.0, finite(p.getExposure())))));
        d.setContrast2012(slider(p.getContrast()));
        d.setHighlights2012(slider(p.getHighlights()));
        d.setShadows2012(slider(p.getShadows()));
        d.setWhites2012(slider(p.getWhites()));
        d.setBlacks2012(slider(p.getBlacks()));

        d.setTexture(slider(p.getTexture()));
        d.setClarity2012(slider(p.getClarity()));
        d.setDehaze(slider(p.getDehaze()));
        d.setVibrance(slider(p.getVibrance()));
        d.setSaturation(slider(p.getSaturation()));

        if (raw) {
            d.setTemperature(integer(p.getTemperature(), 2000, 50000));
            d.setTint(integer(p.getTint(), -150, 150));
        }

        d.setSharpness(integer(p.getSharpness(), 0, 150));
        d.setLuminanceSmoothing(integer(p.getLuminanceNoiseReduction(), 0, 100));
        d.setColorNoiseReduction(integer(p.getColorNoiseReduction(), 0, 100));
        d.setPostCropVignetteAmount(slider(p.getVignetteAmount()));

        d.setHueAdjustmentRed(slider(p.getHueRed()));
        d.setHueAdjustmentOrange(slider(p.getHueOrange()));
        d.setHueAdjustmentYellow(slider(p.getHueYellow()));
        d.setHueAdjustmentGreen(slider(p.getHueGreen()));
        d.setHueAdjustmentAqua(slider(p.getHueAqua()));
        d.setHueAdjustmentBlue(slider(p.getHueBlue()));
        d.setHueAdjustmentPurple(slider(p.getHuePurple()));
        d.setHueAdjustmentMagenta(slider(p.getHueMagenta()));

        d.setSaturationAdjustmentRed(slider(p.getSaturationRed()));
        d.setSaturationAdjustmentOrange(slider(p.getSaturationOrange()));
        d.setSaturationAdjustmentYellow(slider(p.getSaturationYellow()));
        d.setSaturationAdjustmentGreen(slider(p.getSaturationGreen()));
        d.setSaturationAdjustmentAqua(slider(p.getSaturationAqua()));
        d.setSaturationAdjustmentBlue(slider(p.getSaturationBlue()));
        d.setSaturationAdjustmentPurple(slider(p.getSaturationPurple()));
        d.setSaturationAdjustmentMagenta(slider(p.getSaturationMagenta()));

        d.setLuminanceAdjustmentRed(slider(p.getLuminanceRed()));
        d.setLuminanceAdjustmentOrange(slider(p.getLuminanceOrange()));
        d.setLuminanceAdjustmentYellow(slider(p.getLuminanceYellow()));
        d.setLuminanceAdjustmentGreen(slider(p.getLuminanceGreen()));
        d.setLuminanceAdjustmentAqua(slider(p.getLuminanceAqua()));
        d.setLuminanceAdjustmentBlue(slider(p.getLuminanceBlue()));
        d.setLuminanceAdjustmentPurple(slider(p.getLuminancePurple()));
        d.setLuminanceAdjustmentMagenta(slider(p.getLuminanceMagenta()));

        d.setSplitToningShadowHue(integer(p.getSplitShadowHue(), 0, 360));
        d.setSplitToningShadowSaturation(integer(p.getSplitShadowSaturation(), 0, 100));
        d.setSplitToningHighlightHue(integer(p.getSplitHighlightHue(), 0, 360));
        d.setSplitToningHighlightSaturation(integer(p.getSplitHighlightSaturation(), 0, 100));
        d.setSplitToningBalance(slider(p.getSplitBalance()));
        return d;
    }

    private static String slider(int value) {
        return integer(value, -100, 100);
    }

    /** @return the clamped value, or null for zero so the attribute is left out */
    private static String integer(int value, int min, int max) {
        if (value == 0) {
            return null;
        }
        return Integer.toString(Math.max(min, Math.min(max, value)));
    }

    private static String decimal(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
        return rounded.signum() == 0 ? null : rounded.stripTrailingZeros().toPlainString();
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
