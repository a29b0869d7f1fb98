package com.psl.orchestrator.decompose;

import java.util.Locale;
import java.util.Objects;

public final class SubQuery {
    public enum Role {
        PRIMARY,
        REQUIRED,
        OPTIONAL,
        SUPPORTING;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String text;
    private final double weight;
    private final Role role;

    public SubQuery(String text, double weight, Role role) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("sub-query text is required");
        }
        if (!(weight > 0.0) || weight > 1.0) {
            throw new IllegalArgumentException("sub-query weight must be in (0, 1]: " + weight);
        }
        this.text = text.trim();
        this.weight = weight;
        this.role = Objects.requireNonNull(role, "role");
    }

    public static SubQuery whole(String text) {
        return new SubQuery(text, 1.0, Role.PRIMARY);
    }

    public String getText() {
        return text;
    }

    public double getWeight() {
        return weight;
    }

    public Role getRole() {
        return role;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SubQuery)) {
            return false;
        }
        SubQuery that = (SubQuery) other;
        return Double.compare(weight, that.weight) == 0 && text.equals(that.text) && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, weight, role);
    }

    @Override
    public String toString() {
        return role.wireName() + ":" + text + "@" + weight;
    }
}
