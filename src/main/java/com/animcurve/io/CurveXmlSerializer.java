package com.animcurve.io;

import com.animcurve.core.CurveSettings;
import com.animcurve.curve.Curve;
import com.animcurve.curve.InterpolationMethod;
import com.animcurve.curve.Keyframe;
import com.animcurve.event.EventData;
import com.animcurve.event.EventFrame;
import com.animcurve.event.StringHash;
import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads a {@link Curve} as XML.
 *
 * <h3>Format</h3>
 * <pre>{@code
 * <attributeanimation interpolation="spline" splinetension="0.5">
 *   <keyframe time="0.0" type="Vector3" value="0.0 1.0 0.0"/>
 *   <eventframe time="1.0" eventtype="2166136261">
 *     <eventdata>
 *       <variant name="sound" type="String" value="step.wav"/>
 *     </eventdata>
 *   </eventframe>
 * </attributeanimation>
 * }</pre>
 * <ul>
 *   <li>Keyframes and event frames are written in the curve's current order.</li>
 *   <li>{@code type} is {@link ValueKind#typeName}; values use {@link Value#toValueString()}.</li>
 *   <li>{@code eventtype} is the unsigned decimal {@link StringHash}.</li>
 *   <li>{@code interpolation} and {@code splinetension} are optional on load.</li>
 * </ul>
 *
 * <h3>Error handling</h3>
 * <p>{@link #load} parses the whole document into a fresh curve and throws
 * {@link CurveFormatException} on the first missing or invalid field. {@link #loadInto} only
 * touches its target once the whole document has loaded.</p>
 */
public final class CurveXmlSerializer {

    public static final String ROOT = "attributeanimation";

    private CurveXmlSerializer() {} // utility class

    // ═════════════════════════════════════════════════════════════════════════
    // Save
    // ═════════════════════════════════════════════════════════════════════════

    public static String save(Curve curve) {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element root = doc.createElement(ROOT);
            doc.appendChild(root);
            root.setAttribute("interpolation", curve.getMethod().name().toLowerCase());
            root.setAttribute("splinetension", Float.toString(curve.getTension()));

            for (Keyframe kf : curve.getKeyframes()) {
                Element e = doc.createElement("keyframe");
                e.setAttribute("time", Float.toString(kf.time));
                writeValue(e, kf.value);
                root.appendChild(e);
            }

            for (EventFrame ef : curve.getEventFrames()) {
                Element e = doc.createElement("eventframe");
                e.setAttribute("time", Float.toString(ef.time));
                e.setAttribute("eventtype", ef.eventId.toString());
                Element data = doc.createElement("eventdata");
                for (Map.Entry<String, Object> entry : ef.data.asMap().entrySet()) {
                    Element v = doc.createElement("variant");
                    v.setAttribute("name", entry.getKey());
                    writeVariant(v, entry.getValue());
                    data.appendChild(v);
                }
                e.appendChild(data);
                root.appendChild(e);
            }

            Transformer tf = TransformerFactory.newInstance().newTransformer();
            tf.setOutputProperty(OutputKeys.INDENT, "yes");
            tf.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter out = new StringWriter();
            tf.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("XML writer unavailable: " + e.getMessage(), e);
        }
    }

    public static void save(Curve curve, Path path) throws IOException {
        Files.writeString(path, save(curve));
    }

    private static void writeValue(Element e, Value value) {
        e.setAttribute("type", value.getKind().typeName);
        e.setAttribute("value", value.toValueString());
    }

    private static void writeVariant(Element e, Object value) {
        if (value instanceof Value) {
            writeValue(e, (Value) value);
            return;
        }
        String type;
        if (value instanceof String)       type = "String";
        else if (value instanceof Integer) type = "Int";
        else if (value instanceof Float)   type = "Float";
        else                               type = "Bool";
        e.setAttribute("type", type);
        e.setAttribute("value", String.valueOf(value));
    }

    // ═════════════════════════════════════════════════════════════════════════
    // Load
    // ═════════════════════════════════════════════════════════════════════════

    public static Curve load(String xml) {
        return load(xml, CurveSettings.DEFAULTS);
    }

    /**
     * Parses {@code xml} into a new curve built from {@code settings}.
     *
     * @throws CurveFormatException if the document is malformed or any field is missing or invalid
     */
    public static Curve load(String xml, CurveSettings settings) {
        Element root;
        try {
            Document doc = parserFactory()
                .newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            doc.getDocumentElement().normalize();
            root = doc.getDocumentElement();
        } catch (Exception e) {
            throw new CurveFormatException("Failed to parse curve XML: " + e.getMessage(), e);
        }
        if (!ROOT.equals(root.getTagName()))
            throw new CurveFormatException("Expected <" + ROOT + "> root, found <" + root.getTagName() + ">");

        Curve curve = new Curve(settings);
        if (root.hasAttribute("splinetension"))
            curve.setTension(floatAttr(root, "splinetension"));

        // ── Keyframes ─────────────────────────────────────────────────────────
        for (Element e : children(root, "keyframe")) {
            float time  = timeAttr(e);
            Value value = readValue(e);
            if (!curve.insertKeyframe(time, value))
                throw new CurveFormatException("Keyframe at t=" + time + " is " + value.getKind()
                    + " but the curve is " + curve.getKind());
        }

        // Method after keyframes so integer kinds are already fixed to linear.
        if (root.hasAttribute("interpolation"))
            curve.setMethod(methodAttr(root));

        // ── Event frames ──────────────────────────────────────────────────────
        for (Element e : children(root, "eventframe")) {
            float time = timeAttr(e);
            StringHash eventId;
            try {
                eventId = StringHash.parse(requireAttr(e, "eventtype"));
            } catch (NumberFormatException x) {
                throw new CurveFormatException("Invalid eventtype on <eventframe> at t=" + time, x);
            }
            EventData data = new EventData();
            List<Element> dataElems = children(e, "eventdata");
            if (!dataElems.isEmpty()) {
                for (Element v : children(dataElems.get(0), "variant"))
                    readVariant(v, data);
            }
            curve.insertEvent(time, eventId, data);
        }

        if (settings.logLoads)
            System.out.printf("[CurveXmlSerializer] Loaded %s curve: %d keyframe(s), %d event(s)%n",
                curve.getKind(), curve.getNumKeyframes(), curve.getEventFrames().size());
        return curve;
    }

    public static Curve load(Path path) throws IOException {
        return load(Files.readString(path));
    }

    /**
     * Loads {@code xml} and swaps the result into {@code target} only if the whole document is
     * valid. On failure the reason is logged and {@code target} is left exactly as it was.
     *
     * @return whether {@code target} was replaced
     */
    public static boolean loadInto(Curve target, String xml) {
        Curve staged;
        try {
            staged = load(xml);
        } catch (CurveFormatException e) {
            System.err.println("[CurveXmlSerializer] Load failed, curve left unchanged: " + e.getMessage());
            return false;
        }
        target.assign(staged);
        return true;
    }

    // ── Field readers ─────────────────────────────────────────────────────────

    private static Value readValue(Element e) {
        String typeName = requireAttr(e, "type");
        ValueKind kind = ValueKind.fromTypeName(typeName);
        if (kind == null)
            throw new CurveFormatException("Unknown value type '" + typeName + "' on <" + e.getTagName() + ">");
        try {
            return Value.parse(kind, requireAttr(e, "value"));
        } catch (IllegalArgumentException x) {
            throw new CurveFormatException("Invalid " + typeName + " value on <" + e.getTagName() + ">: "
                + x.getMessage(), x);
        }
    }

    private static void readVariant(Element e, EventData data) {
        String name = requireAttr(e, "name");
        String type = requireAttr(e, "type");
        String text = requireAttr(e, "value");
        try {
            switch (type) {
                case "String" -> data.put(name, text);
                case "Int"    -> data.put(name, Integer.parseInt(text.trim()));
                case "Float"  -> data.put(name, Float.parseFloat(text.trim()));
                case "Bool"   -> data.put(name, parseBool(name, text.trim()));
                default       -> data.put(name, readValue(e));
            }
        } catch (NumberFormatException x) {
            throw new CurveFormatException("Invalid " + type + " event data '" + name + "'", x);
        }
    }

    private static boolean parseBool(String name, String text) {
        if (text.equalsIgnoreCase("true"))  return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new CurveFormatException("Invalid Bool event data '" + name + "': '" + text + "'");
    }

    private static InterpolationMethod methodAttr(Element e) {
        String s = e.getAttribute("interpolation").trim();
        for (InterpolationMethod m : InterpolationMethod.values())
            if (m.name().equalsIgnoreCase(s)) return m;
        throw new CurveFormatException("Unknown interpolation method '" + s + "'");
    }

    private static float floatAttr(Element e, String name) {
        String s = requireAttr(e, name);
        try {
            return Float.parseFloat(s.trim());
        } catch (NumberFormatException x) {
            throw new CurveFormatException("Invalid " + name + " '" + s + "' on <" + e.getTagName() + ">", x);
        }
    }

    private static float timeAttr(Element e) {
        float t = floatAttr(e, "time");
        if (!Float.isFinite(t))
            throw new CurveFormatException("Non-finite time " + t + " on <" + e.getTagName() + ">");
        return t;
    }

    // ── XML helpers ───────────────────────────────────────────────────────────

    /** DOM factory with DOCTYPE declarations and external entities disabled. */
    private static DocumentBuilderFactory parserFactory() throws ParserConfigurationException {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        f.setExpandEntityReferences(false);
        f.setXIncludeAware(false);
        return f;
    }

    private static String requireAttr(Element e, String name) {
        if (!e.hasAttribute(name))
            throw new CurveFormatException("Missing attribute '" + name + "' on <" + e.getTagName() + ">");
        return e.getAttribute(name);
    }

    /** Direct children named {@code tag}, in document order. */
    private static List<Element> children(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        NodeList list = parent.getChildNodes();
        for (int i = 0; i < list.getLength(); i++) {
            Node n = list.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(n.getNodeName()))
                out.add((Element) n);
        }
        return out;
    }
}
