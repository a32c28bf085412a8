package com.geofeature.factory;

import com.geofeature.model.Feature;
import com.geofeature.model.FeatureSchema;
import org.locationtech.jts.geom.GeometryFactory;

/**
 * Creates features that all share one schema
 */
public interface FeatureFactory {

    /**
     * Create a feature with the given id
     */
    Feature create(long id);

    /**
     * Create a feature with the next id of this factory's sequence
     */
    Feature create();

    /**
     * The schema shared by every feature of this factory
     */
    FeatureSchema getSchema();

    /**
     * Geometry factory for building geometries to attach to features
     */
    GeometryFactory getGeometryFactory();
}
