package io.abrserver.asset;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.imageio.ImageIO;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class ColormapPreview {
    public static final int PREVIEW_WIDTH = 200;
    public static final int PREVIEW_HEIGHT = 30;

    private final List<ControlPoint> points;

    ColormapPreview(List<ControlPoint> points) {
        List<ControlPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(ControlPoint::x));
        this.points = List.copyOf(sorted);
    }

    public static ColormapPreview fromXml(String xml) {
        Document document = parse(xml);
        Element root = document.getDocumentElement();
        Element colormap = root;
        if ("ColorMaps".equals(root.getTagName())) {
            NodeList maps = root.getElementsByTagName("ColorMap");
            if (maps.getLength() == 0) {
                throw new IllegalArgumentException("Colormap XML has no ColorMap element");
            }
            colormap = (Element) maps.item(0);
        }
        List<ControlPoint> points = new ArrayList<>();
        NodeList children = colormap.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element point = (Element) node;
            points.add(new ControlPoint(
                    attribute(point, "x"),
                    new double[]{attribute(point, "r"), attribute(point, "g"), attribute(point, "b")}
            ));
        }
        return new ColormapPreview(points);
    }

    public int size() {
        return points.size();
    }

    public double[] lookup(double value) {
        if (points.isEmpty()) {
            return new double[]{0.0, 0.0, 0.0};
        }
        if (points.size() == 1) {
            return points.get(0).rgb().clone();
        }
        ControlPoint first = points.get(0);
        ControlPoint last = points.get(points.size() - 1);
        if (value >= last.x()) {
            return last.rgb().clone();
        }
        if (value <= first.x()) {
            return first.rgb().clone();
        }
        int upper = 1;
        while (points.get(upper).x() < value) {
            upper++;
        }
        ControlPoint lo = points.get(upper - 1);
        ControlPoint hi = points.get(upper);
        double alpha = (value - lo.x()) / (hi.x() - lo.x());
        double[] lab1 = rgbToLab(lo.rgb());
        double[] lab2 = rgbToLab(hi.rgb());
        double[] mixed = new double[3];
        for (int c = 0; c < 3; c++) {
            mixed[c] = lab1[c] * (1.0 - alpha) + lab2[c] * alpha;
        }
        return labToRgb(mixed);
    }

    public BufferedImage render(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int col = 0; col < width; col++) {
            double[] rgb = lookup(col / (double) width);
            row[col] = (toByte(rgb[0]) << 16) | (toByte(rgb[1]) << 8) | toByte(rgb[2]);
        }
        for (int y = 0; y < height; y++) {
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public void writePng(Path target, int width, int height) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(render(width, height), "png", target.toFile())) {
            throw new IOException("No PNG writer available for " + target);
        }
    }

    static double[] rgbToLab(double[] rgb) {
        double r = linearize(rgb[0]);
        double g = linearize(rgb[1]);
        double b = linearize(rgb[2]);

        double x = labF((r * 0.4124 + g * 0.3576 + b * 0.1805) / 0.95047);
        double y = labF((r * 0.2126 + g * 0.7152 + b * 0.0722) / 1.00000);
        double z = labF((r * 0.0193 + g * 0.1192 + b * 0.9505) / 1.08883);

        return new double[]{(116.0 * y) - 16.0, 500.0 * (x - y), 200.0 * (y - z)};
    }

    static double[] labToRgb(double[] lab) {
        double y = (lab[0] + 16.0) / 116.0;
        double x = lab[1] / 500.0 + y;
        double z = y - lab[2] / 200.0;

        x = 0.95047 * labFInverse(x);
        y = 1.00000 * labFInverse(y);
        z = 1.08883 * labFInverse(z);

        double r = x * 3.2406 + y * -1.5372 + z * -0.4986;
        double g = x * -0.96890 + y * 1.8758 + z * 0.0415;
        double b = x * 0.05570 + y * -0.2040 + z * 1.0570;

        return new double[]{clamp01(gamma(r)), clamp01(gamma(g)), clamp01(gamma(b))};
    }

    private static double linearize(double c) {
        return c > 0.04045 ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
    }

    private static double gamma(double c) {
        return c > 0.0031308 ? 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055 : 12.92 * c;
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : (7.787 * t) + 16.0 / 116.0;
    }

    private static double labFInverse(double t) {
        double cube = t * t * t;
        return cube > 0.008856 ? cube : (t - 16.0 / 116.0) / 7.787;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static int toByte(double c) {
        return (int) (clamp01(c) * 255);
    }

    private static double attribute(Element element, String name) {
        String raw = element.getAttribute(name);
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Colormap point is missing attribute '" + name + "'");
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Colormap point attribute '" + name + "' is not a number: " + raw, e);
        }
    }

    private static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml == null ? "" : xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalArgumentException("Malformed colormap XML: " + e.getMessage(), e);
        }
    }

    record ControlPoint(double x, double[] rgb) {
    }
}
