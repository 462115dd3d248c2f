package org.brightlights.utils.gridstore;

import com.vividsolutions.jts.geom.Coordinate;
import com.vividsolutions.jts.geom.Geometry;
import com.vividsolutions.jts.geom.GeometryFactory;
import com.vividsolutions.jts.geom.Polygon;
import com.vividsolutions.jts.io.ParseException;
import com.vividsolutions.jts.io.WKTReader;

/**
 * Двумерная граница области поиска на плоскости (долгота, широта).
 * Задаётся в WKT: {@code POLYGON((lon lat, lon lat, ...))}.
 */
public final class BoundaryPolygon {

    private final GeometryFactory gf = new GeometryFactory();
    private final Polygon polygon;

    private BoundaryPolygon(Polygon polygon) {
        this.polygon = polygon;
    }

    /**
     * Разбор полигона из WKT.
     * @throws IllegalArgumentException если строка не читается или это не полигон
     */
    public static BoundaryPolygon fromWkt(String wkt) {
        Geometry geometry;
        try {
            geometry = new WKTReader(new GeometryFactory()).read(wkt);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid boundary " + wkt, e);
        }
        if (!(geometry instanceof Polygon)) {
            throw new IllegalArgumentException("boundary must be a POLYGON, got "
                    + geometry.getGeometryType());
        }
        return new BoundaryPolygon((Polygon) geometry);
    }

    /**
     * Строгая проверка «точка внутри»: точки на самой границе считаются снаружи.
     */
    public boolean contains(double latitude, double longitude) {
        return polygon.contains(gf.createPoint(new Coordinate(longitude, latitude)));
    }

    @Override public String toString() {
        return polygon.toText();
    }
}
