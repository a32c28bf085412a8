package com.geofeature.config;

import com.geofeature.factory.FeatureFactory;
import com.geofeature.factory.impl.FeatureFactoryImpl;
import com.geofeature.model.FeatureSchema;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application configuration for shared-schema features
 */
@Configuration
@EnableConfigurationProperties(FeatureProperties.class)
@Slf4j
public class FeatureConfiguration {

    @Bean
    public GeometryFactory geometryFactory(FeatureProperties properties) {
        return new GeometryFactory(new PrecisionModel(), properties.getGeometry().getSrid());
    }

    @Bean
    public WKTReader wktReader(GeometryFactory geometryFactory) {
        return new WKTReader(geometryFactory);
    }

    @Bean
    public WKTWriter wktWriter() {
        return new WKTWriter();
    }

    /**
     * Schema shared by every feature created through the factory bean
     */
    @Bean
    public FeatureSchema featureSchema(FeatureProperties properties) {
        FeatureSchema schema = new FeatureSchema();
        for (String name : properties.getSchema().getAttributes()) {
            schema.registerSlot(name);
        }
        log.info("Registered {} schema attributes: {}", schema.size(), properties.getSchema().getAttributes());
        return schema;
    }

    @Bean
    public FeatureFactory featureFactory(FeatureSchema featureSchema, GeometryFactory geometryFactory,
                                         FeatureProperties properties) {
        return new FeatureFactoryImpl(featureSchema, geometryFactory, properties.getIds().getStart());
    }
}
