package com.eda.defparser.model;

/**
 * Visitor over the two shapes a component feature value can take.
 */
public interface FeatureValueVisitor<T> {
    T visitScalar(FeatureValue.Scalar scalar);
    T visitMulti(FeatureValue.Multi multi);
}
