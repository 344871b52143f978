package com.ddm.rhea.provider.file;

import com.ddm.rhea.ConfigurationPath;
import com.ddm.rhea.provider.ConfigurationEntry;
import com.ddm.rhea.utils.ConfigurationKeys;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * XML 文件配置提供者。
 *
 * <p>规则：
 * <ul>
 *   <li>根元素名不进入键</li>
 *   <li>属性与子元素都作为键，元素文本是该元素键的值</li>
 *   <li>带 {@code name} 属性的元素额外增加一段路径：{@code <Db name="Main"><Url>..</Url></Db> → Db:Main:Url}</li>
 *   <li>同名的兄弟元素按出现顺序加下标 {@code :0}、{@code :1} …</li>
 *   <li>重复的键与命名空间视为格式错误</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public class XmlConfigurationProvider extends FileConfigurationProvider {

    private static final XMLInputFactory INPUT_FACTORY = createInputFactory();

    public XmlConfigurationProvider(FileSource file) {
        super(file);
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = new XmlFactory().getXMLInputFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    @Override
    protected Map<String, ConfigurationEntry> parse(InputStream in) throws IOException {
        Element root;
        try {
            root = read(in);
        } catch (XMLStreamException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        Map<String, ConfigurationEntry> data = new HashMap<>();
        if (root != null) {
            Deque<String> prefix = new ArrayDeque<>();
            if (root.name != null) {
                prefix.addLast(root.name);
            }
            processElement(prefix, root, data);
        }
        return data;
    }

    private static Element read(InputStream in) throws XMLStreamException {
        XMLStreamReader reader = INPUT_FACTORY.createXMLStreamReader(in);
        try {
            Element root = null;
            Deque<Element> current = new ArrayDeque<>();
            while (reader.hasNext()) {
                switch (reader.next()) {
                    case XMLStreamConstants.START_ELEMENT: {
                        Element element = Element.of(reader);
                        Element parent = current.peek();
                        if (parent == null) {
                            root = element;
                        } else {
                            parent.children.computeIfAbsent(element.siblingName, k -> new ArrayList<>()).add(element);
                        }
                        current.push(element);
                        break;
                    }
                    case XMLStreamConstants.END_ELEMENT:
                        current.pop();
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA: {
                        Element parent = current.peek();
                        if (parent != null && !reader.isWhiteSpace()) {
                            parent.text = reader.getText();
                        }
                        break;
                    }
                    default:
                        break;
                }
            }
            return root;
        } finally {
            reader.close();
        }
    }

    private static void processElement(Deque<String> prefix, Element element, Map<String, ConfigurationEntry> data) {
        for (Map.Entry<String, String> attribute : element.attributes.entrySet()) {
            prefix.addLast(attribute.getKey());
            add(prefix, attribute.getValue(), data);
            prefix.removeLast();
        }
        if (element.text != null) {
            add(prefix, element.text, data);
        }
        for (List<Element> siblings : element.children.values()) {
            if (siblings.size() == 1) {
                processChild(prefix, siblings.get(0), -1, data);
            } else {
                for (int i = 0; i < siblings.size(); i++) {
                    processChild(prefix, siblings.get(i), i, data);
                }
            }
        }
    }

    private static void processChild(Deque<String> prefix, Element child, int index, Map<String, ConfigurationEntry> data) {
        int depth = prefix.size();
        prefix.addLast(child.elementName);
        if (child.name != null) {
            prefix.addLast(child.name);
        }
        if (index >= 0) {
            prefix.addLast(Integer.toString(index));
        }
        processElement(prefix, child, data);
        while (prefix.size() > depth) {
            prefix.removeLast();
        }
    }

    private static void add(Deque<String> prefix, String value, Map<String, ConfigurationEntry> data) {
        String key = ConfigurationPath.combine(prefix);
        if (key.isEmpty()) {
            // 根元素的文本没有对应的键
            return;
        }
        ConfigurationEntry previous = data.put(ConfigurationKeys.normalize(key), new ConfigurationEntry(key, value));
        if (previous != null) {
            throw new IllegalArgumentException("A duplicate key '" + previous.key() + "' was found.");
        }
    }

    private static final class Element {
        private final String elementName;
        private final String name;
        private final String siblingName;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final Map<String, List<Element>> children = new LinkedHashMap<>();
        private String text;

        private Element(String elementName, String name) {
            this.elementName = elementName;
            this.name = name;
            String upper = ConfigurationKeys.normalize(elementName);
            this.siblingName = name == null ? upper : ConfigurationPath.combine(upper, ConfigurationKeys.normalize(name));
        }

        private static Element of(XMLStreamReader reader) {
            requireNoNamespace(reader.getNamespaceURI());
            String name = null;
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < reader.getAttributeCount(); i++) {
                requireNoNamespace(reader.getAttributeNamespace(i));
                String attributeName = reader.getAttributeLocalName(i);
                String value = reader.getAttributeValue(i);
                if (name == null && attributeName.equalsIgnoreCase("name")) {
                    name = value;
                }
                attributes.put(attributeName, value);
            }
            Element element = new Element(reader.getLocalName(), name);
            element.attributes.putAll(attributes);
            return element;
        }

        private static void requireNoNamespace(String namespace) {
            if (namespace != null && !namespace.isEmpty()) {
                throw new IllegalArgumentException("XML namespaces are not supported.");
            }
        }
    }
}
