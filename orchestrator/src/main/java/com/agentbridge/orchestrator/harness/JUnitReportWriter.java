package com.agentbridge.orchestrator.harness;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes a {@link SuiteReport} as JUnit XML so CI servers pick it up like any
 * other test report. One {@code <testcase>} per harness case; a
 * {@code <failure>} element only for cases that did not pass.
 */
public final class JUnitReportWriter {

    private JUnitReportWriter() {}

    public static void write(SuiteReport report, Writer out) {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("testsuite");
            xml.writeAttribute("name", report.name());
            xml.writeAttribute("tests", Integer.toString(report.results().size()));
            xml.writeAttribute("failures", Integer.toString(report.failed()));
            xml.writeAttribute("errors", "0");
            xml.writeAttribute("time", seconds(report.durationMs()));

            xml.writeStartElement("properties");
            property(xml, "meanFidelity", String.format(Locale.ROOT, "%.6f", report.meanFidelity()));
            if (report.baselineMean() != null) {
                property(xml, "baselineMean", String.format(Locale.ROOT, "%.6f", report.baselineMean()));
                property(xml, "regressedAgainstBaseline", Boolean.toString(report.regressedAgainstBaseline()));
            }
            xml.writeEndElement();

            for (HarnessResult r : report.results()) {
                xml.writeStartElement("testcase");
                xml.writeAttribute("name", r.name());
                xml.writeAttribute("classname", r.targetProtocol() == null
                        ? r.sourceProtocol()
                        : r.sourceProtocol() + "." + r.targetProtocol());
                xml.writeAttribute("time", seconds(r.durationMs()));
                if (!r.passed()) {
                    xml.writeStartElement("failure");
                    xml.writeAttribute("message", r.failureMessage());
                    xml.writeAttribute("type", "FidelityBelowThreshold");
                    xml.writeCharacters(String.format(Locale.ROOT, "fidelity=%.6f min=%.6f",
                            r.fidelity(), r.minFidelity()));
                    xml.writeEndElement();
                }
                xml.writeEndElement();
            }

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Cannot write JUnit report for suite " + report.name(), e);
        }
    }

    public static String toXml(SuiteReport report) {
        StringWriter out = new StringWriter();
        write(report, out);
        return out.toString();
    }

    public static void write(SuiteReport report, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(report, out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write JUnit report to " + file, e);
        }
    }

    private static void property(XMLStreamWriter xml, String name, String value) throws XMLStreamException {
        xml.writeEmptyElement("property");
        xml.writeAttribute("name", name);
        xml.writeAttribute("value", value);
    }

    private static String seconds(long millis) {
        return String.format(Locale.ROOT, "%.3f", millis / 1000.0);
    }
}
