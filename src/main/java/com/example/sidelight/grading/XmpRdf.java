package com.example.sidelight.grading;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(namespace = XmpSidecarWriter.NS_RDF, localName = "RDF")
public class XmpRdf {

    @JacksonXmlProperty(namespace = XmpSidecarWriter.NS_RDF, localName = "Description")
    private XmpDescription description;
}
