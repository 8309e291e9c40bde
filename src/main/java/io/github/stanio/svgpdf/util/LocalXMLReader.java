/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.util;

import java.io.IOException;
import java.io.StringReader;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.XMLReader;
import org.xml.sax.ext.DefaultHandler2;

/**
 * Thread-local, namespace-aware {@code XMLReader} with secure processing.
 * External entities and DTDs are never fetched: they resolve to empty
 * content.
 */
public class LocalXMLReader {

    public static final String FEATURE = "http://xml.org/sax/features/";
    public static final String PROPERTY = "http://xml.org/sax/properties/";
    static final String LEXICAL_HANDLER = PROPERTY + "lexical-handler";

    private static final Logger log = Logger.getLogger(LocalXMLReader.class.getName());

    private final ThreadLocal<XMLReader> localInstance;

    private final ThreadLocal<Boolean> parsing = ThreadLocal.withInitial(() -> false);

    protected LocalXMLReader() {
        this.localInstance = ThreadLocal.withInitial(LocalXMLReader::newXMLReader);
    }

    public static LocalXMLReader newInstance() {
        return new LocalXMLReader();
    }

    public XMLReader get() {
        return localInstance.get();
    }

    private static XMLReader newXMLReader() {
        XMLReader xmlReader;
        try {
            SAXParserFactory spf = SAXParserFactory.newInstance();
            spf.setNamespaceAware(true);
            spf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            xmlReader = spf.newSAXParser().getXMLReader();
            xmlReader.setFeature(FEATURE + "namespace-prefixes", true);
            xmlReader.setFeature(FEATURE + "external-general-entities", false);
            xmlReader.setFeature(FEATURE + "external-parameter-entities", false);
        } catch (SAXException | ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
        return xmlReader;
    }

    /**
     * Parses the given input with the given handler receiving the content,
     * lexical, and error events.  The handler is detached from the
     * (reusable) reader when done.  A nested invocation from within a
     * handler callback uses a new reader.
     *
     * @param   input  the document source
     * @param   handler  the event handler
     * @throws  SAXException  parse error, or error reported by the handler
     * @throws  IOException  I/O error reading the input
     */
    public void parse(InputSource input, DefaultHandler2 handler)
            throws SAXException, IOException {
        boolean nested = parsing.get();
        XMLReader xmlReader = nested ? newXMLReader() : get();
        xmlReader.setContentHandler(handler);
        xmlReader.setErrorHandler(handler);
        xmlReader.setEntityResolver((publicId, systemId) -> emptyEntity());
        try {
            xmlReader.setProperty(LEXICAL_HANDLER, handler);
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.log(Level.FINE, "Lexical events not available", e);
        }

        parsing.set(true);
        try {
            xmlReader.parse(input);
        } finally {
            reset(xmlReader);
            parsing.set(nested);
        }
    }

    private static InputSource emptyEntity() {
        return new InputSource(new StringReader(""));
    }

    public static void reset(XMLReader xmlReader) {
        xmlReader.setEntityResolver(null);
        xmlReader.setContentHandler(null);
        xmlReader.setErrorHandler(null);
        xmlReader.setDTDHandler(null);
        try {
            xmlReader.setProperty(LEXICAL_HANDLER, null);
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.log(Level.FINE, "reset(XMLReader)", e);
        }
    }

}
