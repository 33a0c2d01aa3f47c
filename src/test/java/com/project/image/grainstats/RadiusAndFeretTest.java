package com.project.image.grainstats;

import com.project.image.grainstats.geometry.Feret;
import com.project.image.grainstats.geometry.FeretDiameters;
import com.project.image.grainstats.geometry.Point;
import com.project.image.grainstats.geometry.RadiusStatistics;
import com.project.image.grainstats.service.BoundaryExtractor;
import com.project.image.grainstats.service.EdgeDetectionMethod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RadiusAndFeretTest {
    private static final double TOLERANCE = 1e-9;

    @Test
    void radius_squareRing_measuredFromRingCentre() {
        RadiusStatistics stats = RadiusStatistics.of(Masks.rectangleRing(5, 5));

        assertThat(stats.centroid()).isEqualTo(new Point(2, 2));
        assertThat(stats.min()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(stats.max()).isCloseTo(Math.sqrt(8), within(TOLERANCE));
        assertThat(stats.median()).isCloseTo(Math.sqrt(5), within(TOLERANCE));
        assertThat(stats.mean()).isCloseTo((4 * 2 + 8 * Math.sqrt(5) + 4 * Math.sqrt(8)) / 16, within(TOLERANCE));
    }

    @Test
    void radius_diskOutline_isNearlyConstant() {
        List<Point> outline = new BoundaryExtractor().extract(Masks.disk(20), EdgeDetectionMethod.BINARY_EROSION);

        RadiusStatistics stats = RadiusStatistics.of(outline);

        assertThat(stats.centroid().row()).isCloseTo(20.0, within(TOLERANCE));
        assertThat(stats.centroid().col()).isCloseTo(20.0, within(TOLERANCE));
        assertThat(stats.min()).isGreaterThanOrEqualTo(0.9 * stats.max());
        assertThat(stats.max()).isCloseTo(20.0, within(0.5));
    }

    @Test
    void feret_filledSquare() {
        FeretDiameters feret = Feret.minMax(BoundaryExtractor.points(Masks.filled(5, 5)));

        assertThat(feret.min()).isCloseTo(4.0, within(TOLERANCE));
        assertThat(feret.max()).isCloseTo(Math.sqrt(32), within(TOLERANCE));
        assertThat(feret.maxStart().distanceTo(feret.maxEnd())).isCloseTo(feret.max(), within(TOLERANCE));
    }

    @Test
    void feret_rectangle_minIsShortSide() {
        FeretDiameters feret = Feret.minMax(BoundaryExtractor.points(Masks.filled(4, 10)));

        assertThat(feret.min()).isCloseTo(3.0, within(TOLERANCE));
        assertThat(feret.max()).isCloseTo(Math.sqrt(9 + 81), within(TOLERANCE));
    }

    @Test
    void feret_lineHasNoWidth() {
        FeretDiameters feret = Feret.minMax(List.of(Point.of(0, 0), Point.of(0, 1), Point.of(0, 2), Point.of(0, 3)));

        assertThat(feret.min()).isZero();
        assertThat(feret.max()).isCloseTo(3.0, within(TOLERANCE));
    }

    @Test
    void feret_singlePointAndScaling() {
        assertThat(Feret.minMax(List.of(Point.of(2, 2), Point.of(2, 2))).max()).isZero();

        FeretDiameters scaled = Feret.minMax(BoundaryExtractor.points(Masks.filled(5, 5))).scaled(0.5);
        assertThat(scaled.min()).isCloseTo(2.0, within(TOLERANCE));
    }

    @Test
    void feret_emptyInputIsRejected() {
        assertThatThrownBy(() -> Feret.minMax(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
