package com.geofeature.config;

import com.geofeature.factory.FeatureFactory;
import com.geofeature.model.AttributeValue;
import com.geofeature.model.Feature;
import com.geofeature.model.FeatureSchema;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the feature beans are wired from geofeature.* properties
 */
@SpringBootTest(classes = FeatureConfiguration.class)
@TestPropertySource(properties = {
        "geofeature.schema.attributes=name,pop,area",
        "geofeature.geometry.srid=2056",
        "geofeature.ids.start=100"
})
public class FeatureConfigurationTest {

    @Autowired
    private FeatureFactory featureFactory;

    @Autowired
    private FeatureSchema featureSchema;

    @Autowired
    private WKTReader wktReader;

    @Autowired
    private WKTWriter wktWriter;

    @Test
    public void testSchemaIsRegisteredFromProperties() {
        assertEquals(3, featureSchema.size());
        assertEquals(0, featureSchema.indexOf("name").getAsInt());
        assertEquals(1, featureSchema.indexOf("pop").getAsInt());
        assertEquals(2, featureSchema.indexOf("area").getAsInt());
        assertSame(featureSchema, featureFactory.getSchema());
    }

    @Test
    public void testFactoryUsesConfiguredSettings() {
        Feature feature = featureFactory.create();

        assertTrue(feature.getId() >= 100);
        assertEquals(2056, featureFactory.getGeometryFactory().getSRID());
    }

    @Test
    public void testWktRoundTripThroughFeature() throws Exception {
        Feature feature = featureFactory.create(1);
        feature.put("name", "Bern");
        Geometry geometry = wktReader.read("POINT (2600000 1200000)");
        feature.addGeometry(geometry);

        assertEquals(2056, feature.getGeometry(0).getSRID());
        assertEquals("POINT (2600000 1200000)", wktWriter.write(feature.getGeometry(0)));
        assertEquals(AttributeValue.of("Bern"), feature.get("name"));
    }
}
