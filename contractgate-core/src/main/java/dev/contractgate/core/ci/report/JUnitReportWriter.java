package dev.contractgate.core.ci.report;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.ci.CIResult;
import dev.contractgate.core.ci.CIViolation;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * JUnit XML output: one suite per contract, one failed testcase per violation and one
 * bare testcase per passing check.
 */
public class JUnitReportWriter implements ReportWriter {

    private static final String NO_CONTRACT = "contractgate";

    private final XMLOutputFactory factory = XMLOutputFactory.newFactory();

    @Override
    public String format() {
        return "junit";
    }

    @Override
    public String render(CIResult result) {
        Map<String, Suite> suites = new TreeMap<>();
        for (CIViolation violation : result.violations()) {
            suites.computeIfAbsent(suiteName(violation.contractId()), Suite::new).failures.add(violation);
        }
        for (CheckResult passed : result.passedChecks()) {
            suites.computeIfAbsent(suiteName(passed.contractId()), Suite::new).passed.add(passed);
        }

        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement("testsuites");
            xml.writeAttribute("name", "contractgate");
            xml.writeAttribute("tests", Integer.toString(result.violations().size() + result.passedChecks().size()));
            xml.writeAttribute("failures", Integer.toString(result.violations().size()));
            xml.writeAttribute("errors", Integer.toString(result.errors().size()));
            xml.writeAttribute("time", seconds(result));
            for (Suite suite : suites.values()) {
                writeSuite(xml, suite);
            }
            for (String error : result.errors()) {
                xml.writeCharacters("\n  ");
                xml.writeStartElement("testsuite");
                xml.writeAttribute("name", "runtime");
                xml.writeAttribute("tests", "1");
                xml.writeAttribute("errors", "1");
                xml.writeStartElement("testcase");
                xml.writeAttribute("name", "run");
                xml.writeAttribute("classname", "runtime");
                xml.writeStartElement("error");
                xml.writeAttribute("message", error);
                xml.writeEndElement();
                xml.writeEndElement();
                xml.writeEndElement();
            }
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Cannot render JUnit XML", e);
        }
        return out.toString();
    }

    private static void writeSuite(XMLStreamWriter xml, Suite suite) throws XMLStreamException {
        xml.writeCharacters("\n  ");
        xml.writeStartElement("testsuite");
        xml.writeAttribute("name", suite.name);
        xml.writeAttribute("tests", Integer.toString(suite.failures.size() + suite.passed.size()));
        xml.writeAttribute("failures", Integer.toString(suite.failures.size()));
        for (CIViolation violation : suite.failures) {
            xml.writeCharacters("\n    ");
            xml.writeStartElement("testcase");
            xml.writeAttribute("name", violation.checkId() + "@" + violation.location());
            xml.writeAttribute("classname", suite.name);
            xml.writeStartElement("failure");
            xml.writeAttribute("message", violation.message());
            xml.writeAttribute("type", violation.severity().value());
            xml.writeCharacters("File: " + violation.filePath() + "\nLine: "
                    + (violation.line() == null ? "N/A" : violation.line()) + "\n\n" + violation.message());
            xml.writeEndElement();
            xml.writeEndElement();
        }
        for (CheckResult passed : suite.passed) {
            xml.writeCharacters("\n    ");
            xml.writeEmptyElement("testcase");
            xml.writeAttribute("name", passed.checkId());
            xml.writeAttribute("classname", suite.name);
        }
        xml.writeCharacters("\n  ");
        xml.writeEndElement();
    }

    private static String suiteName(String contractId) {
        return contractId == null ? NO_CONTRACT : contractId;
    }

    private static String seconds(CIResult result) {
        return String.format(Locale.ROOT, "%.3f", result.duration().toMillis() / 1000.0);
    }

    private static final class Suite {
        private final String name;
        private final List<CIViolation> failures = new ArrayList<>();
        private final List<CheckResult> passed = new ArrayList<>();

        private Suite(String name) {
            this.name = name;
        }
    }
}
