package com.tracking.engine.dto;

import com.tracking.engine.geo.GeoMath;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A registered geofence: a circle around a center or, when {@code vertices}
 * are given, a polygon. The center is always used to rank regions by distance,
 * also for polygons.
 *
 * Containment is boundary inclusive in both shapes: a fix exactly on the
 * radius (or on a polygon edge) counts as inside.
 *
 * @param identifier     unique region id
 * @param latitude       center latitude
 * @param longitude      center longitude
 * @param radius         circle radius in meters (default 200)
 * @param notifyOnEntry  emit ENTER events (default true)
 * @param notifyOnExit   emit EXIT events (default true)
 * @param notifyOnDwell  emit DWELL events (default false)
 * @param loiteringDelay dwell delay in milliseconds, 0 falls back to the configured dwell delay
 * @param extras         free-form metadata copied into geofence events
 * @param vertices       optional polygon as {@code [[lat, lon], ...]}, at least three points
 */
@Builder(toBuilder = true)
public record GeofenceRegion(
    @NotBlank(message = "Geofence identifier cannot be blank")
    String identifier,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @Positive(message = "Radius must be > 0")
    Double radius,

    Boolean notifyOnEntry,

    Boolean notifyOnExit,

    Boolean notifyOnDwell,

    @PositiveOrZero(message = "Loitering delay must be >= 0")
    Long loiteringDelay,

    Map<String, Object> extras,

    List<List<Double>> vertices
) {

    public static final double DEFAULT_RADIUS_METERS = 200.0;

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    public GeofenceRegion {
        if (radius == null) {
            radius = DEFAULT_RADIUS_METERS;
        }
        if (notifyOnEntry == null) {
            notifyOnEntry = Boolean.TRUE;
        }
        if (notifyOnExit == null) {
            notifyOnExit = Boolean.TRUE;
        }
        if (notifyOnDwell == null) {
            notifyOnDwell = Boolean.FALSE;
        }
        if (loiteringDelay == null) {
            loiteringDelay = 0L;
        }
        extras = extras == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
        if (vertices != null && !vertices.isEmpty()) {
            if (vertices.size() < 3) {
                throw new IllegalArgumentException("Polygon geofence needs at least 3 vertices: " + identifier);
            }
            List<List<Double>> copy = new ArrayList<>(vertices.size());
            for (List<Double> vertex : vertices) {
                if (vertex == null || vertex.size() != 2 || vertex.contains(null)) {
                    throw new IllegalArgumentException("Vertex must be [lat, lon]: " + identifier);
                }
                copy.add(List.copyOf(vertex));
            }
            vertices = List.copyOf(copy);
        } else {
            vertices = List.of();
        }
    }

    public boolean polygonal() {
        return !vertices.isEmpty();
    }

    /**
     * Distance in meters from the region center to a fix.
     */
    public double distanceFromCenter(LocationSample sample) {
        return GeoMath.distanceMeters(latitude, longitude, sample.latitude(), sample.longitude());
    }

    /**
     * Boundary-inclusive containment test.
     */
    public boolean contains(LocationSample sample) {
        if (polygonal()) {
            Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(sample.longitude(), sample.latitude()));
            return toPolygon().covers(point);
        }
        return distanceFromCenter(sample) <= radius;
    }

    /**
     * Builds the JTS polygon (x = longitude, y = latitude), closing the ring if needed.
     */
    public Polygon toPolygon() {
        int size = vertices.size();
        List<Double> first = vertices.get(0);
        List<Double> last = vertices.get(size - 1);
        boolean closed = first.equals(last);
        Coordinate[] ring = new Coordinate[closed ? size : size + 1];
        for (int i = 0; i < size; i++) {
            List<Double> vertex = vertices.get(i);
            ring[i] = new Coordinate(vertex.get(1), vertex.get(0));
        }
        if (!closed) {
            ring[size] = new Coordinate(first.get(1), first.get(0));
        }
        return GEOMETRY_FACTORY.createPolygon(ring);
    }

    public String toLogString() {
        return polygonal()
            ? String.format("Geofence[%s, polygon %d vertices]", identifier, vertices.size())
            : String.format("Geofence[%s, lat=%.6f, lon=%.6f, r=%.0fm]", identifier, latitude, longitude, radius);
    }
}
