package edge.choice.logit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static, acyclic nest tree of one sector: mode groups down to (vehicle type, technology) leaves.
 * Shared by all regions; regional differences only show up as unavailable leaves.
 */
public final class NestTopology {
    private static final Logger log = LoggerFactory.getLogger(NestTopology.class);

    private final NestNode root;
    private final ImmutableMap<String, NestNode> nodes;
    private final ImmutableList<NestNode> alternatives;

    private NestTopology(NestNode root, Map<String, NestNode> nodes) {
        this.root = root;
        this.nodes = ImmutableMap.copyOf(nodes);
        ImmutableList.Builder<NestNode> leaves = ImmutableList.builder();
        collectAlternatives(root, leaves);
        this.alternatives = leaves.build();
    }

    private static void collectAlternatives(NestNode node, ImmutableList.Builder<NestNode> leaves) {
        if (node.isAlternative()) {
            leaves.add(node);
        } else {
            for (NestNode child : node.getChildren()) {
                collectAlternatives(child, leaves);
            }
        }
    }

    public NestNode getRoot() {
        return root;
    }

    public String getSector() {
        return root.getName();
    }

    public NestNode getNode(String name) {
        NestNode node = nodes.get(name);
        Preconditions.checkArgument(node != null, "Unknown nest node %s", name);
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public ImmutableList<NestNode> getAlternatives() {
        return alternatives;
    }

    public ImmutableList<NestNode> getNodes() {
        return nodes.values().asList();
    }

    /**
     * Internal nodes ordered so that every node comes after all of its descendants.
     */
    public List<NestNode> getNestsBottomUp() {
        List<NestNode> ordered = new ArrayList<>();
        addPostOrder(root, ordered);
        return ordered;
    }

    private static void addPostOrder(NestNode node, List<NestNode> ordered) {
        if (node.isAlternative()) return;
        for (NestNode child : node.getChildren()) {
            addPostOrder(child, ordered);
        }
        ordered.add(node);
    }

    public String toString() {
        return root.toStringRecursive(0);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a topology from nested XML:
     * <pre>
     * &lt;nest name="passenger" exponent="0.5"&gt;
     *   &lt;nest name="4W" exponent="0.25"&gt;
     *     &lt;alternative name="car_BEV" vehicleType="Midsize Car" technology="BEV" energyCarrier="Electricity"/&gt;
     *   &lt;/nest&gt;
     * &lt;/nest&gt;
     * </pre>
     */
    public static NestTopology fromXml(String topologyAsXml) {
        SAXBuilder saxBuilder = new SAXBuilder();
        InputStream stream = new ByteArrayInputStream(topologyAsXml.getBytes(StandardCharsets.UTF_8));
        try {
            Document document = saxBuilder.build(stream);
            Builder builder = builder();
            addElement(builder, document.getRootElement(), null, 0);
            return builder.build();
        } catch (JDOMException | IOException e) {
            throw new IllegalArgumentException("Could not parse nest topology XML", e);
        }
    }

    private static void addElement(Builder builder, Element elem, String parentName, int level) {
        String name = elem.getAttributeValue("name");
        switch (elem.getName().toLowerCase()) {
            case "nest":
                builder.addNest(level, name, parentName, Double.parseDouble(elem.getAttributeValue("exponent")));
                for (Object child : elem.getChildren()) {
                    addElement(builder, (Element) child, name, level + 1);
                }
                break;
            case "alternative":
                builder.addAlternative(level, name, parentName, elem.getAttributeValue("vehicleType"),
                        elem.getAttributeValue("technology"), elem.getAttributeValue("energyCarrier"));
                break;
            default:
                log.warn("Ignoring unknown element <{}> in nest topology", elem.getName());
        }
    }

    public static final class Builder {
        private final Map<String, NestNode> nodes = new LinkedHashMap<>();
        private final Map<String, String> parents = new LinkedHashMap<>();

        public Builder addNest(int level, String name, String parentName, double exponent) {
            Preconditions.checkArgument(exponent > 0.0 && !Double.isInfinite(exponent),
                    "Exponent of nest %s must be strictly positive, got %s", name, exponent);
            return add(new NestNode(name, level, exponent, null, null, null), parentName);
        }

        public Builder addAlternative(int level, String name, String parentName, String vehicleType, String technology,
                                      String energyCarrier) {
            Preconditions.checkArgument(StringUtils.isNotBlank(vehicleType) && StringUtils.isNotBlank(technology),
                    "Alternative %s needs both a vehicle type and a technology", name);
            return add(new NestNode(name, level, Double.NaN, vehicleType, technology,
                    StringUtils.defaultIfBlank(energyCarrier, technology)), parentName);
        }

        private Builder add(NestNode node, String parentName) {
            Preconditions.checkArgument(StringUtils.isNotBlank(node.getName()), "Nest node without a name");
            Preconditions.checkArgument(!nodes.containsKey(node.getName()), "Duplicate nest node %s", node.getName());
            nodes.put(node.getName(), node);
            parents.put(node.getName(), StringUtils.trimToNull(parentName));
            return this;
        }

        public NestTopology build() {
            NestNode root = null;
            for (Map.Entry<String, String> entry : parents.entrySet()) {
                NestNode node = nodes.get(entry.getKey());
                if (entry.getValue() == null) {
                    Preconditions.checkArgument(root == null, "Nest topology has two roots: %s and %s", root, node);
                    root = node;
                } else {
                    NestNode parent = nodes.get(entry.getValue());
                    Preconditions.checkArgument(parent != null, "Parent %s of %s is not defined", entry.getValue(), node);
                    Preconditions.checkArgument(!Double.isNaN(parent.getExponent()),
                            "Alternative %s cannot have children", parent);
                    parent.addChild(node);
                }
            }
            Preconditions.checkArgument(root != null, "Nest topology has no root");
            Preconditions.checkArgument(!Double.isNaN(root.getExponent()), "Root %s must be a nest", root);

            root.freeze();
            Set<String> reached = new HashSet<>();
            Set<String> leafKeys = new HashSet<>();
            checkReachable(root, reached, leafKeys);
            Preconditions.checkArgument(reached.size() == nodes.size(),
                    "Nest topology contains a cycle or nodes unreachable from root %s", root);
            return new NestTopology(root, nodes);
        }

        private static void checkReachable(NestNode node, Set<String> reached, Set<String> leafKeys) {
            Preconditions.checkArgument(reached.add(node.getName()), "Nest node %s reached twice", node);
            if (node.isAlternative()) {
                Preconditions.checkArgument(node.getVehicleType() != null, "Nest %s has no children", node);
                Preconditions.checkArgument(leafKeys.add(node.getVehicleType() + "/" + node.getTechnology()),
                        "Two alternatives map to %s/%s", node.getVehicleType(), node.getTechnology());
                return;
            }
            for (NestNode child : node.getChildren()) {
                checkReachable(child, reached, leafKeys);
            }
        }
    }
}
