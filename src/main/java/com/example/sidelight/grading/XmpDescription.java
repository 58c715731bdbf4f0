package com.example.sidelight.grading;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * The {@code rdf:Description} element of an XMP packet: one {@code crs:} attribute per
 * camera-raw setting. Unset (null) settings are not written.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class XmpDescription {

    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_RDF, localName = "about")
    private String about = "";

    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "ProcessVersion")
    private String processVersion;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HasSettings")
    private String hasSettings;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "CameraProfile")
    private String cameraProfile;

    // basic tone
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Exposure2012")
    private String exposure2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Contrast2012")
    private String contrast2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Highlights2012")
    private String highlights2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Shadows2012")
    private String shadows2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Whites2012")
    private String whites2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Blacks2012")
    private String blacks2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Texture")
    private String texture;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Clarity2012")
    private String clarity2012;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Dehaze")
    private String dehaze;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Vibrance")
    private String vibrance;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Saturation")
    private String saturation;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Temperature")
    private String temperature;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Tint")
    private String tint;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "Sharpness")
    private String sharpness;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceSmoothing")
    private String luminanceSmoothing;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "ColorNoiseReduction")
    private String colorNoiseReduction;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "PostCropVignetteAmount")
    private String postCropVignetteAmount;

    // HSL mixer
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentRed")
    private String hueAdjustmentRed;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentOrange")
    private String hueAdjustmentOrange;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentYellow")
    private String hueAdjustmentYellow;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentGreen")
    private String hueAdjustmentGreen;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentAqua")
    private String hueAdjustmentAqua;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentBlue")
    private String hueAdjustmentBlue;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentPurple")
    private String hueAdjustmentPurple;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "HueAdjustmentMagenta")
    private String hueAdjustmentMagenta;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentRed")
    private String saturationAdjustmentRed;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentOrange")
    private String saturationAdjustmentOrange;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentYellow")
    private String saturationAdjustmentYellow;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentGreen")
    private String saturationAdjustmentGreen;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentAqua")
    private String saturationAdjustmentAqua;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentBlue")
    private String saturationAdjustmentBlue;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentPurple")
    private String saturationAdjustmentPurple;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SaturationAdjustmentMagenta")
    private String saturationAdjustmentMagenta;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentRed")
    private String luminanceAdjustmentRed;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentOrange")
    private String luminanceAdjustmentOrange;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentYellow")
    private String luminanceAdjustmentYellow;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentGreen")
    private String luminanceAdjustmentGreen;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentAqua")
    private String luminanceAdjustmentAqua;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentBlue")
    private String luminanceAdjustmentBlue;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentPurple")
    private String luminanceAdjustmentPurple;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "LuminanceAdjustmentMagenta")
    private String luminanceAdjustmentMagenta;

    // split toning
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SplitToningShadowHue")
    private String splitToningShadowHue;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SplitToningShadowSaturation")
    private String splitToningShadowSaturation;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SplitToningHighlightHue")
    private String splitToningHighlightHue;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SplitToningHighlightSaturation")
    private String splitToningHighlightSaturation;
    @JacksonXmlProperty(isAttribute = true, namespace = XmpSidecarWriter.NS_CRS, localName = "SplitToningBalance")
    private String splitToningBalance;
}
