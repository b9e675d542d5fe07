package org.stianloader.picoprune.plist;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.internal.XMLUtil;
import org.stianloader.picoprune.internal.XMLUtil.ChildElementIterable;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Reader and writer for XML property lists, the format used for descriptors, manifests and removal lists.
 *
 * <p>Values are mapped as follows: {@code dict} to an insertion-ordered {@link Map} with {@link String} keys,
 * {@code array} to a mutable {@link List}, {@code string} to {@link String}, {@code integer} to {@link Long},
 * {@code real} to {@link Double}, {@code true}/{@code false} to {@link Boolean}, {@code date} to {@link Instant}
 * and {@code data} to {@code byte[]}. Writing accepts the same types plus any other {@link Number}
 * (written as integer unless it is a {@link Float} or {@link Double}).
 *
 * <p>The binary property list format is not supported.
 */
public final class PropertyLists {

    @NotNull
    private static final String DOCTYPE_PUBLIC = "-//Apple//DTD PLIST 1.0//EN";

    @NotNull
    private static final String DOCTYPE_SYSTEM = "http://www.apple.com/DTDs/PropertyList-1.0.dtd";

    @NotNull
    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        // Property lists reference Apple's DTD by URL, which must never be fetched
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setIgnoringComments(true);
        factory.setCoalescing(true);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }

    @NotNull
    public static Object read(@NotNull Path path) throws PropertyListException {
        try (InputStream is = Files.newInputStream(path)) {
            return PropertyLists.read(is, path);
        } catch (IOException e) {
            throw new PropertyListException(path, "Unable to read property list: " + e.getMessage(), e);
        }
    }

    @NotNull
    public static Object read(@NotNull InputStream is, @Nullable Path source) throws PropertyListException {
        Document document;
        try {
            document = PropertyLists.newDocumentBuilder().parse(is);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new PropertyListException(source, "Malformed property list: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        if (!root.getTagName().equals("plist")) {
            throw new PropertyListException(source, "Root element is <" + root.getTagName() + ">, expected <plist>");
        }
        List<@NotNull Element> children = XMLUtil.getChildElements(root);
        if (children.size() != 1) {
            throw new PropertyListException(source, "A property list must contain exactly one root value, found " + children.size());
        }
        return PropertyLists.readValue(children.get(0), source);
    }

    /**
     * Reads a property list whose root value is a dictionary.
     *
     * @param path The file to read
     * @return The root dictionary
     * @throws PropertyListException If the file is not a property list or its root is not a dictionary
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public static Map<String, Object> readDictionary(@NotNull Path path) throws PropertyListException {
        Object root = PropertyLists.read(path);
        if (!(root instanceof Map)) {
            throw new PropertyListException(path, "Root value is not a dictionary");
        }
        return (Map<String, Object>) root;
    }

    @NotNull
    private static Object readValue(@NotNull Element element, @Nullable Path source) throws PropertyListException {
        String tag = element.getTagName();
        switch (tag) {
        case "dict": {
            Map<String, Object> dict = new LinkedHashMap<>();
            Iterator<@NotNull Element> it = new ChildElementIterable(element).iterator();
            while (it.hasNext()) {
                Element key = it.next();
                if (!key.getTagName().equals("key")) {
                    throw new PropertyListException(source, "Expected <key> in dictionary, found <" + key.getTagName() + ">");
                }
                if (!it.hasNext()) {
                    throw new PropertyListException(source, "Dictionary key \"" + key.getTextContent() + "\" has no value");
                }
                dict.put(key.getTextContent(), PropertyLists.readValue(it.next(), source));
            }
            return dict;
        }
        case "array": {
            List<Object> array = new ArrayList<>();
            for (Element child : new ChildElementIterable(element)) {
                array.add(PropertyLists.readValue(child, source));
            }
            return array;
        }
        case "string":
            return element.getTextContent();
        case "integer":
            try {
                return Long.valueOf(element.getTextContent().trim());
            } catch (NumberFormatException e) {
                throw new PropertyListException(source, "Invalid integer \"" + element.getTextContent() + "\"", e);
            }
        case "real":
            try {
                return Double.valueOf(element.getTextContent().trim());
            } catch (NumberFormatException e) {
                throw new PropertyListException(source, "Invalid real \"" + element.getTextContent() + "\"", e);
            }
        case "true":
            return Boolean.TRUE;
        case "false":
            return Boolean.FALSE;
        case "date":
            try {
                return Instant.parse(element.getTextContent().trim());
            } catch (DateTimeParseException e) {
                throw new PropertyListException(source, "Invalid date \"" + element.getTextContent() + "\"", e);
            }
        case "data":
            try {
                return Base64.getMimeDecoder().decode(element.getTextContent().trim());
            } catch (IllegalArgumentException e) {
                throw new PropertyListException(source, "Invalid base64 data", e);
            }
        default:
            throw new PropertyListException(source, "Unknown property list element <" + tag + ">");
        }
    }

    /**
     * Writes a property list to a file. The document is written to a temporary file next to the target first
     * which then replaces the target, so a failure leaves the previous file intact.
     *
     * @param root The root value
     * @param path The file to write
     * @throws PropertyListException If the value cannot be serialized or the file cannot be written
     */
    public static void write(@NotNull Object root, @NotNull Path path) throws PropertyListException {
        Path absolute = path.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temporary;
        try {
            temporary = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        } catch (IOException e) {
            throw new PropertyListException(path, "Unable to write property list: " + e.getMessage(), e);
        }
        try {
            try (OutputStream out = Files.newOutputStream(temporary)) {
                PropertyLists.write(root, out, path);
            }
            try {
                Files.move(temporary, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PropertyListException(path, "Unable to write property list: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(temporary);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().warn(PropertyLists.class, "Unable to delete temporary file {}", temporary, e);
            }
        }
    }

    public static void write(@NotNull Object root, @NotNull OutputStream out, @Nullable Path target) throws PropertyListException {
        Document document;
        try {
            document = PropertyLists.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new PropertyListException(target, "XML support is unavailable", e);
        }
        Element plist = document.createElement("plist");
        plist.setAttribute("version", "1.0");
        document.appendChild(plist);
        plist.appendChild(PropertyLists.writeValue(document, root, target));

        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.DOCTYPE_PUBLIC, PropertyLists.DOCTYPE_PUBLIC);
            transformer.setOutputProperty(OutputKeys.DOCTYPE_SYSTEM, PropertyLists.DOCTYPE_SYSTEM);
            transformer.transform(new DOMSource(document), new StreamResult(out));
        } catch (TransformerException e) {
            throw new PropertyListException(target, "Unable to serialize property list: " + e.getMessage(), e);
        }
    }

    @NotNull
    public static String writeToString(@NotNull Object root) throws PropertyListException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PropertyLists.write(root, out, null);
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @NotNull
    private static Element writeValue(@NotNull Document document, @Nullable Object value, @Nullable Path target) throws PropertyListException {
        Element element;
        if (value instanceof Map) {
            element = document.createElement("dict");
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                Element key = document.createElement("key");
                key.setTextContent(String.valueOf(entry.getKey()));
                element.appendChild(key);
                element.appendChild(PropertyLists.writeValue(document, entry.getValue(), target));
            }
        } else if (value instanceof Iterable) {
            element = document.createElement("array");
            for (Object child : (Iterable<?>) value) {
                element.appendChild(PropertyLists.writeValue(document, child, target));
            }
        } else if (value instanceof String) {
            element = document.createElement("string");
            element.setTextContent((String) value);
        } else if (value instanceof Boolean) {
            element = document.createElement(((Boolean) value) ? "true" : "false");
        } else if (value instanceof Double || value instanceof Float) {
            element = document.createElement("real");
            element.setTextContent(value.toString());
        } else if (value instanceof Number) {
            element = document.createElement("integer");
            element.setTextContent(value.toString());
        } else if (value instanceof Instant) {
            element = document.createElement("date");
            element.setTextContent(((Instant) value).truncatedTo(ChronoUnit.SECONDS).toString());
        } else if (value instanceof byte[]) {
            element = document.createElement("data");
            element.setTextContent(Base64.getEncoder().encodeToString((byte[]) value));
        } else {
            throw new PropertyListException(target, "Value of type " + (value == null ? "null" : value.getClass().getName()) + " cannot be stored in a property list");
        }
        return element;
    }

    private PropertyLists() {
        throw new UnsupportedOperationException();
    }
}
