package com.evpn.auditor.transport.netconf;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Разбор ответов NETCONF.
 */
final class NetconfReplyParser {

    private NetconfReplyParser() {
    }

    static Document parse(String xml) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Некорректный XML в ответе NETCONF: " + e.getMessage(), e);
        }
    }

    /**
     * Тексты сообщений {@code rpc-error}. Пустой список, если ошибок нет.
     * Ошибки с severity=warning не считаются отказом.
     */
    static List<String> rpcErrors(Document reply) {
        List<String> errors = new ArrayList<>();
        NodeList nodes = reply.getElementsByTagNameNS("*", "rpc-error");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element error = (Element) nodes.item(i);
            String severity = childText(error, "error-severity");
            if ("warning".equalsIgnoreCase(severity)) {
                continue;
            }
            String message = childText(error, "error-message");
            errors.add(message != null && !message.isBlank() ? message.trim() : "rpc-error без сообщения");
        }
        return errors;
    }

    /**
     * Текст всех элементов с указанным локальным именем на любой глубине, в порядке документа.
     */
    static List<String> texts(Document reply, String localName) {
        NodeList nodes = reply.getElementsByTagNameNS("*", localName);
        List<String> values = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            String text = nodes.item(i).getTextContent();
            values.add(text != null ? text : "");
        }
        return values;
    }

    private static String childText(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() == 0) {
            return null;
        }
        return nodes.item(0).getTextContent();
    }
}
