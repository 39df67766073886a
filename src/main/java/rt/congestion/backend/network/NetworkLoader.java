package rt.congestion.backend.network;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/*
 * NetworkLoader
 *
 * Liest die SUMO net.xml einmal komplett (DOM) und baut daraus das RoadNetwork:
 * - <location>   -> netOffset + projParameter
 * - <edge>       -> RoadSegment (interne Kanten werden nicht übernommen)
 * - <lane>       -> Anzahl, Geschwindigkeit, Länge, Shape
 * - <roundabout> -> Kreisverkehr-Markierung
 */
public final class NetworkLoader {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkLoader.class);

    private NetworkLoader() {
    }

    /**
     * @param netFile SUMO network file
     * @return the parsed network
     * @throws IllegalStateException if the file is missing or not a parsable net file
     */
    public static RoadNetwork load(Path netFile) {
        if (!Files.isRegularFile(netFile)) {
            throw new IllegalStateException("net.xml nicht gefunden: " + netFile);
        }

        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(netFile.toFile());
            doc.getDocumentElement().normalize();
        } catch (ParserConfigurationException | SAXException | IOException ex) {
            throw new IllegalStateException("Fehler beim Lesen der net.xml: " + netFile, ex);
        }

        NetworkProjection projection = readLocation(doc);
        Set<String> roundaboutEdges = readRoundabouts(doc);
        List<RoadSegment> segments = readEdges(doc, roundaboutEdges);

        LOG.info("[NET] {} segments, {} roundabout edges, projection={}",
                segments.size(), roundaboutEdges.size(), projection.getProjParameter());

        return new RoadNetwork(segments, projection);
    }

    // -----------------------------
    // <location>
    // -----------------------------
    private static NetworkProjection readLocation(Document doc) {
        NodeList nodes = doc.getElementsByTagName("location");
        if (nodes.getLength() == 0) {
            LOG.warn("[NET] no <location> element, coordinates are used as lon/lat");
            return NetworkProjection.identity();
        }

        Element location = (Element) nodes.item(0);
        double offsetX = 0.0;
        double offsetY = 0.0;

        String netOffset = location.getAttribute("netOffset");
        if (!netOffset.isEmpty()) {
            String[] xy = netOffset.split(",");
            if (xy.length != 2) {
                throw new IllegalStateException("Ungültiger netOffset: " + netOffset);
            }
            try {
                offsetX = Double.parseDouble(xy[0].trim());
                offsetY = Double.parseDouble(xy[1].trim());
            } catch (NumberFormatException ex) {
                throw new IllegalStateException("Ungültiger netOffset: " + netOffset, ex);
            }
        }

        return new NetworkProjection(offsetX, offsetY, location.getAttribute("projParameter"));
    }

    // -----------------------------
    // <roundabout edges="a b c">
    // -----------------------------
    private static Set<String> readRoundabouts(Document doc) {
        Set<String> result = new HashSet<>();
        NodeList nodes = doc.getElementsByTagName("roundabout");
        for (int i = 0; i < nodes.getLength(); i++) {
            String edges = ((Element) nodes.item(i)).getAttribute("edges");
            for (String id : edges.trim().split("\\s+")) {
                if (!id.isBlank()) {
                    result.add(id);
                }
            }
        }
        return result;
    }

    // -----------------------------
    // <edge> + <lane>
    // -----------------------------
    private static List<RoadSegment> readEdges(Document doc, Set<String> roundaboutEdges) {
        List<RoadSegment> result = new ArrayList<>();
        int skipped = 0;

        NodeList edgeNodes = doc.getElementsByTagName("edge");
        for (int i = 0; i < edgeNodes.getLength(); i++) {
            Node node = edgeNodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE)
                continue;
            Element edgeElem = (Element) node;

            String edgeId = edgeElem.getAttribute("id");
            if (edgeId.isEmpty())
                continue;

            // interne Kanten (Junction-Hilfsstücke) braucht die Karte nicht
            if ("internal".equals(edgeElem.getAttribute("function")) || edgeId.startsWith(":"))
                continue;

            List<LaneShape> lanes = readLanes(edgeElem);
            if (lanes.isEmpty()) {
                skipped++;
                continue;
            }

            List<Coordinate> shape;
            if (edgeElem.hasAttribute("shape")) {
                shape = parseShapePoints(edgeElem.getAttribute("shape"));
            } else {
                shape = centerLine(lanes);
            }
            if (shape.size() < 2) {
                skipped++;
                continue;
            }

            double speed = 0.0;
            double length = 0.0;
            for (LaneShape lane : lanes) {
                speed = Math.max(speed, lane.speedMs);
                length = Math.max(length, lane.lengthM);
            }

            result.add(new RoadSegment(edgeId, lanes.size(), speed, length, shape,
                    roundaboutEdges.contains(edgeId)));
        }

        if (skipped > 0) {
            LOG.warn("[NET] {} edges without usable lanes/shape skipped", skipped);
        }
        return result;
    }

    private static List<LaneShape> readLanes(Element edgeElem) {
        List<LaneShape> lanes = new ArrayList<>();
        NodeList laneNodes = edgeElem.getElementsByTagName("lane");

        for (int j = 0; j < laneNodes.getLength(); j++) {
            Element laneElem = (Element) laneNodes.item(j);

            List<Coordinate> polyline = parseShapePoints(laneElem.getAttribute("shape"));
            if (polyline.size() < 2)
                continue;

            int index = parseInt(laneElem.getAttribute("index"), j);
            double speed = parseDouble(laneElem.getAttribute("speed"), 0.0);
            double length = parseDouble(laneElem.getAttribute("length"), 0.0);

            lanes.add(new LaneShape(index, speed, length, polyline));
        }

        // Lanes pro Edge sortieren: 0,1,2,...
        lanes.sort(Comparator.comparingInt(a -> a.index));
        return lanes;
    }

    // Mittellinie einer Kante ohne eigenes shape-Attribut:
    // gleiche Punktanzahl -> Punkt i über alle Lanes mitteln,
    // sonst die mittlere Lane nehmen.
    static List<Coordinate> centerLine(List<LaneShape> lanes) {
        if (lanes.size() == 1) {
            return lanes.get(0).shape;
        }

        int n = lanes.get(0).shape.size();
        for (LaneShape lane : lanes) {
            if (lane.shape.size() != n) {
                return lanes.get(lanes.size() / 2).shape;
            }
        }

        List<Coordinate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double x = 0.0;
            double y = 0.0;
            for (LaneShape lane : lanes) {
                x += lane.shape.get(i).x;
                y += lane.shape.get(i).y;
            }
            out.add(new Coordinate(x / lanes.size(), y / lanes.size()));
        }
        return out;
    }

    // shape="x,y x,y x,y ..." -> Liste von Punkten, kaputte Paare werden übersprungen
    static List<Coordinate> parseShapePoints(String shapeAttr) {
        List<Coordinate> pts = new ArrayList<>();
        if (shapeAttr == null || shapeAttr.isBlank())
            return pts;

        String[] pairs = shapeAttr.trim().split("\\s+");
        for (String pair : pairs) {
            String[] xy = pair.split(",");
            // 3D-Shapes haben x,y,z -> z ignorieren
            if (xy.length < 2 || xy.length > 3)
                continue;

            try {
                double x = Double.parseDouble(xy[0]);
                double y = Double.parseDouble(xy[1]);
                pts.add(new Coordinate(x, y));
            } catch (NumberFormatException ex) {
                LOG.debug("[NET] bad shape point '{}'", pair);
            }
        }
        return pts;
    }

    private static int parseInt(String s, int fallback) {
        if (s == null || s.isEmpty())
            return fallback;
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String s, double fallback) {
        if (s == null || s.isEmpty())
            return fallback;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    // Lane-Daten nur während des Ladens
    static final class LaneShape {
        final int index;
        final double speedMs;
        final double lengthM;
        final List<Coordinate> shape;

        LaneShape(int index, double speedMs, double lengthM, List<Coordinate> shape) {
            this.index = index;
            this.speedMs = speedMs;
            this.lengthM = lengthM;
            this.shape = shape;
        }
    }
}
