package com.geofeature.factory.impl;

import com.geofeature.factory.FeatureFactory;
import com.geofeature.model.Feature;
import com.geofeature.model.FeatureSchema;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default FeatureFactory backed by a single shared schema and an id sequence
 */
public class FeatureFactoryImpl implements FeatureFactory {

    private static final Logger logger = LoggerFactory.getLogger(FeatureFactoryImpl.class);

    private final FeatureSchema schema;
    private final GeometryFactory geometryFactory;
    private final AtomicLong nextId;

    public FeatureFactoryImpl(FeatureSchema schema, GeometryFactory geometryFactory, long startId) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory");
        this.nextId = new AtomicLong(startId);
        logger.info("Feature factory ready with {} schema attributes, SRID {}, ids starting at {}",
                schema.size(), geometryFactory.getSRID(), startId);
    }

    @Override
    public Feature create(long id) {
        return new Feature(schema, id);
    }

    @Override
    public Feature create() {
        return create(nextId.getAndIncrement());
    }

    @Override
    public FeatureSchema getSchema() {
        return schema;
    }

    @Override
    public GeometryFactory getGeometryFactory() {
        return geometryFactory;
    }
}
