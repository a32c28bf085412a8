package com.geofeature.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code geofeature.*} properties
 */
@Data
@ConfigurationProperties(prefix = "geofeature")
public class FeatureProperties {

    private Schema schema = new Schema();
    private Geometry geometry = new Geometry();
    private Ids ids = new Ids();

    @Data
    public static class Schema {
        /**
         * Attribute names registered at startup, in slot order
         */
        private List<String> attributes = new ArrayList<>();
    }

    @Data
    public static class Geometry {
        private int srid = 4326;
    }

    @Data
    public static class Ids {
        /**
         * First id handed out by FeatureFactory#create()
         */
        private long start = 1;
    }
}
