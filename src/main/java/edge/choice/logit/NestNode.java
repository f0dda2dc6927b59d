package edge.choice.logit;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of the nest tree. Internal nodes carry the logit exponent that governs the choice among
 * their children; leaves stand for exactly one (vehicle type, technology) alternative.
 */
public final class NestNode {

    private final String name;
    private final int level;
    private final double exponent;
    private final String vehicleType;
    private final String technology;
    private final String energyCarrier;
    private NestNode parent;
    private final List<NestNode> children = new ArrayList<>();
    private ImmutableList<NestNode> frozenChildren;

    NestNode(String name, int level, double exponent, String vehicleType, String technology, String energyCarrier) {
        this.name = name;
        this.level = level;
        this.exponent = exponent;
        this.vehicleType = vehicleType;
        this.technology = technology;
        this.energyCarrier = energyCarrier;
    }

    void addChild(NestNode child) {
        child.parent = this;
        children.add(child);
    }

    void freeze() {
        frozenChildren = ImmutableList.copyOf(children);
        for (NestNode child : frozenChildren) {
            child.freeze();
        }
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Sharpness of the choice among this node's children; smaller means more substitutable.
     * Not defined for leaves.
     */
    public double getExponent() {
        return exponent;
    }

    public String getVehicleType() {
        return vehicleType;
    }

    public String getTechnology() {
        return technology;
    }

    public String getEnergyCarrier() {
        return energyCarrier;
    }

    public NestNode getParent() {
        return parent;
    }

    public ImmutableList<NestNode> getChildren() {
        return frozenChildren;
    }

    public boolean isAlternative() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public String toString() {
        return name;
    }

    public String toStringRecursive(int depth) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            result.append("  ");
        }
        result.append(name);
        if (isAlternative()) {
            result.append(" [").append(vehicleType).append('/').append(technology).append("]\n");
        } else {
            result.append(" (exponent ").append(exponent).append(")\n");
            for (NestNode child : getChildren()) {
                result.append(child.toStringRecursive(depth + 1));
            }
        }
        return result.toString();
    }
}
