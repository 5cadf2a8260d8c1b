package com.eda.defparser.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value of a "+ NAME ..." feature on a component.
 *
 * A feature followed by exactly one token is a {@link Scalar}; zero or several
 * tokens make a {@link Multi}. Consumers rely on this distinction, so a single
 * value is never wrapped in a one-element list.
 */
public abstract class FeatureValue {

    private FeatureValue() {
    }

    public abstract <T> T accept(FeatureValueVisitor<T> visitor);

    /**
     * All tokens of this value in order, regardless of shape.
     */
    public abstract List<String> tokens();

    public boolean isScalar() {
        return false;
    }

    public static FeatureValue of(List<String> values) {
        if (values.size() == 1) {
            return new Scalar(values.get(0));
        }
        return new Multi(values);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Scalar extends FeatureValue {
        private final String value;

        public Scalar(String value) {
            this.value = value;
        }

        @Override
        public <T> T accept(FeatureValueVisitor<T> visitor) {
            return visitor.visitScalar(this);
        }

        @Override
        public List<String> tokens() {
            return List.of(value);
        }

        @Override
        public boolean isScalar() {
            return true;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Multi extends FeatureValue {
        private final List<String> values;

        public Multi(List<String> values) {
            this.values = List.copyOf(values);
        }

        @Override
        public <T> T accept(FeatureValueVisitor<T> visitor) {
            return visitor.visitMulti(this);
        }

        @Override
        public List<String> tokens() {
            return values;
        }

        public int size() {
            return values.size();
        }
    }
}
