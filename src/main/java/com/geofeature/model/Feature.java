package com.geofeature.model;

import com.geofeature.exception.KeyNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Feature - a single geospatial entity: an id, attribute values laid out by a
 * shared {@link FeatureSchema}, owned geometries and an optional raster.
 *
 * <p>The value list is sized from the schema when the feature is created. The
 * schema may keep growing afterwards, so a slot that exists in the schema does
 * not necessarily exist in this feature.
 */
@Slf4j
public class Feature implements Iterable<Map.Entry<String, AttributeValue>> {

    private long id;
    private final FeatureSchema schema;
    private final List<AttributeValue> data;
    private final List<Geometry> geometries = new ArrayList<>();
    private Raster raster;

    private long droppedWrites;

    public Feature(FeatureSchema schema, long id) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.id = id;
        this.data = new ArrayList<>(Collections.nCopies(schema.size(), AttributeValue.NULL));
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    /**
     * Overwrite the value of an existing slot. A null value stores
     * {@link AttributeValue#NULL}.
     *
     * @throws KeyNotFoundException if the key is not in the schema or its slot
     *                              is beyond this feature's value list
     */
    public void put(String key, AttributeValue value) {
        int index = slotOf(key);
        if (index < 0) {
            throw new KeyNotFoundException(key);
        }
        data.set(index, value != null ? value : AttributeValue.NULL);
    }

    public void put(String key, Object value) {
        put(key, AttributeValue.of(value));
    }

    /**
     * Write a value, registering the key in the shared schema if needed.
     *
     * <p>A newly registered key is appended only when its slot is the next one
     * in this feature's value list. If other features sharing the schema have
     * already grown it past this feature, the schema still grows but the value
     * is dropped; see {@link #getDroppedWriteCount()}.
     */
    public void putNew(String key, AttributeValue value) {
        if (value == null) {
            value = AttributeValue.NULL;
        }
        int index = slotOf(key);
        if (index >= 0) {
            data.set(index, value);
            return;
        }
        int registered = schema.registerSlot(key);
        if (registered == data.size()) {
            data.add(value);
        } else {
            droppedWrites++;
            log.debug("Dropped value for '{}' on feature {}: slot {} is beyond value list of size {}",
                    key, id, registered, data.size());
        }
    }

    public void putNew(String key, Object value) {
        putNew(key, AttributeValue.of(value));
    }

    // slot index inside this feature's value list, or -1
    private int slotOf(String key) {
        OptionalInt index = schema.indexOf(key);
        if (index.isPresent() && index.getAsInt() < data.size()) {
            return index.getAsInt();
        }
        return -1;
    }

    /**
     * Whether the key is registered in the schema. A registered key may still
     * read as null if its slot is beyond this feature's value list.
     */
    public boolean hasKey(String key) {
        return schema.contains(key);
    }

    public AttributeValue get(String key) {
        OptionalInt index = schema.indexOf(key);
        return index.isPresent() ? get(index.getAsInt()) : AttributeValue.NULL;
    }

    public AttributeValue get(int index) {
        if (index >= 0 && index < data.size()) {
            return data.get(index);
        }
        return AttributeValue.NULL;
    }

    /**
     * Length of this feature's value list, which may trail the schema size
     */
    public int size() {
        return data.size();
    }

    public boolean isBehindSchema() {
        return data.size() < schema.size();
    }

    /**
     * Number of {@link #putNew} calls whose value was lost because this
     * feature's value list had fallen behind the schema
     */
    public long getDroppedWriteCount() {
        return droppedWrites;
    }

    public List<AttributeValue> getData() {
        return Collections.unmodifiableList(data);
    }

    /**
     * Replace all values. The caller keeps the list aligned with the schema.
     */
    public void setData(List<AttributeValue> values) {
        List<AttributeValue> copy = new ArrayList<>(values);
        for (AttributeValue value : copy) {
            Objects.requireNonNull(value, "values must not contain null, use AttributeValue.NULL");
        }
        data.clear();
        data.addAll(copy);
    }

    /**
     * Take ownership of a geometry
     */
    public void addGeometry(Geometry geometry) {
        geometries.add(Objects.requireNonNull(geometry, "geometry"));
    }

    public int numGeometries() {
        return geometries.size();
    }

    /**
     * @throws IndexOutOfBoundsException if index is not in [0, numGeometries())
     */
    public Geometry getGeometry(int index) {
        Objects.checkIndex(index, geometries.size());
        return geometries.get(index);
    }

    public List<Geometry> getGeometries() {
        return Collections.unmodifiableList(geometries);
    }

    /**
     * Release every owned geometry
     */
    public void clearGeometries() {
        geometries.clear();
    }

    /**
     * Bounding box of all geometries, computed on every call.
     * Empty when the feature has no geometry.
     */
    public Bounds envelope() {
        Bounds result = Bounds.empty();
        for (int i = 0; i < geometries.size(); i++) {
            Bounds box = Bounds.fromEnvelope(geometries.get(i).getEnvelopeInternal());
            if (i == 0) {
                if (!box.isEmpty()) {
                    result.init(box.getMinX(), box.getMinY(), box.getMaxX(), box.getMaxY());
                }
            } else {
                result.expandToInclude(box);
            }
        }
        return result;
    }

    public Optional<Raster> getRaster() {
        return Optional.ofNullable(raster);
    }

    public void setRaster(Raster raster) {
        this.raster = Objects.requireNonNull(raster, "raster, use clearRaster() to detach");
    }

    public void clearRaster() {
        this.raster = null;
    }

    /**
     * Iterate (name, value) pairs in schema name order. Names whose slot is
     * beyond this feature's value list pair with {@link AttributeValue#NULL}.
     * Neither the feature nor its schema may change while iterating.
     */
    @Override
    public Iterator<Map.Entry<String, AttributeValue>> iterator() {
        return new FeatureKvIterator(this);
    }

    public Stream<Map.Entry<String, AttributeValue>> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), schema.size(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Debug text form. Only names whose slot lies inside this feature's value
     * list are written.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Feature ( id=").append(id).append('\n');
        for (Map.Entry<String, Integer> entry : schema.entries()) {
            int index = entry.getValue();
            if (index < data.size()) {
                AttributeValue value = data.get(index);
                sb.append("  ").append(entry.getKey()).append(':')
                        .append(value.isNull() ? "null" : value.toString())
                        .append('\n');
            }
        }
        sb.append(")\n");
        return sb.toString();
    }
}
