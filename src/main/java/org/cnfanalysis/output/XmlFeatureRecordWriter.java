package org.cnfanalysis.output;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Record in XML:
 * <pre>
 * &lt;features&gt;
 *   &lt;file timestamp=".." version=".." filename=".." md5sum=".." sha1sum=".."&gt;
 *     &lt;featuring name="clauses_count" value="2"/&gt;
 *   &lt;/file&gt;
 * &lt;/features&gt;
 * </pre>
 */
public final class XmlFeatureRecordWriter implements FeatureRecordWriter {

    private static final String INDENT = "  ";

    private final XMLOutputFactory factory = XMLOutputFactory.newInstance();

    @Override
    public void write(FeatureRecord record, OutputStream out) throws IOException {
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out, "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement("features");
            xml.writeCharacters("\n" + INDENT);

            xml.writeStartElement("file");
            for (Map.Entry<String, Object> entry : record.metadata().entrySet()) {
                // '@' non è ammesso nei nomi di attributo
                xml.writeAttribute(entry.getKey().substring(1), String.valueOf(entry.getValue()));
            }

            for (Map.Entry<String, Object> feature : record.features().asMap().entrySet()) {
                xml.writeCharacters("\n" + INDENT + INDENT);
                xml.writeEmptyElement("featuring");
                xml.writeAttribute("name", feature.getKey());
                xml.writeAttribute("value", String.valueOf(feature.getValue()));
            }

            xml.writeCharacters("\n" + INDENT);
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Scrittura XML fallita per " + record.filename(), e);
        }
        out.flush();
    }
}
