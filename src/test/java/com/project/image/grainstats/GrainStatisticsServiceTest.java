package com.project.image.grainstats;

import com.project.image.grainstats.DTOs.Direction;
import com.project.image.grainstats.DTOs.GrainPlotData;
import com.project.image.grainstats.DTOs.GrainRecord;
import com.project.image.grainstats.DTOs.GrainStatsResult;
import com.project.image.grainstats.DTOs.GrainStatsTable;
import com.project.image.grainstats.DTOs.SkippedGrain;
import com.project.image.grainstats.exceptions.GrainStatsException;
import com.project.image.grainstats.service.BoundaryExtractor;
import com.project.image.grainstats.service.CannyEdgeDetector;
import com.project.image.grainstats.service.EdgeDetectionMethod;
import com.project.image.grainstats.service.GrainStatisticsService;
import com.project.image.grainstats.service.GrainStatsOptions;
import com.project.image.grainstats.service.HeightProfileService;
import com.project.image.grainstats.service.RegionExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GrainStatisticsServiceTest {
    private static final double TOLERANCE = 1e-9;

    // metre factor of 1 keeps everything in pixel / image units
    private static final GrainStatsOptions PIXEL_UNITS = new GrainStatsOptions(
            EdgeDetectionMethod.BINARY_EROSION, false, -1, 1.0, 5, Path.of("out"));

    private final GrainStatisticsService service = new GrainStatisticsService(
            new BoundaryExtractor(), new RegionExtractor(), new HeightProfileService(), GrainStatsOptions.defaults());

    private double[][] image;
    private int[][] labels;

    @BeforeEach
    void setup() {
        // 30x30 image: a 5x5 square (label 1) at height 2, a 6x10 rectangle (label 2) whose height
        // grows with the column, and a single pixel (label 3)
        image = new double[30][30];
        labels = new int[30][30];
        for (int y = 2; y < 7; y++) {
            for (int x = 3; x < 8; x++) {
                labels[y][x] = 1;
                image[y][x] = 2.0;
            }
        }
        for (int y = 15; y < 21; y++) {
            for (int x = 10; x < 20; x++) {
                labels[y][x] = 2;
                image[y][x] = x - 9;
            }
        }
        labels[25][25] = 3;
        image[25][25] = 100;
    }

    @Test
    void calculateStats_twoGrains_oneTooSmall() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS);

        GrainStatsTable table = result.table();
        assertThat(table.columns()).isEqualTo(GrainStatsTable.COLUMNS);
        assertThat(table.rows()).extracting(GrainRecord::grainNumber).containsExactly(1, 2);
        assertThat(result.skipped()).containsExactly(new SkippedGrain(3, SkippedGrain.Reason.TOO_SMALL));
        assertThat(table.rows()).allSatisfy(r -> {
            assertThat(r.threshold()).isEqualTo(Direction.ABOVE);
            assertThat(r.image()).isEqualTo("img");
        });
    }

    @Test
    void calculateStats_squareGrain_shapeAndHeights() {
        GrainRecord square = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS)
                .table().rows().get(0);

        assertThat(square.centreX()).isCloseTo(5.0, within(TOLERANCE));
        assertThat(square.centreY()).isCloseTo(4.0, within(TOLERANCE));
        assertThat(square.smallestBoundingWidth()).isCloseTo(4.0, within(1e-7));
        assertThat(square.smallestBoundingLength()).isCloseTo(4.0, within(1e-7));
        assertThat(square.smallestBoundingArea()).isCloseTo(16.0, within(1e-7));
        assertThat(square.aspectRatio()).isCloseTo(1.0, within(1e-7));
        assertThat(square.area()).isEqualTo(25.0);
        assertThat(square.areaCartesianBbox()).isEqualTo(25.0);
        assertThat(square.radiusMin()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(square.radiusMax()).isCloseTo(Math.sqrt(8), within(TOLERANCE));
        assertThat(square.minFeret()).isCloseTo(4.0, within(TOLERANCE));
        assertThat(square.maxFeret()).isCloseTo(Math.sqrt(32), within(TOLERANCE));
        assertThat(square.heightMin()).isEqualTo(2.0);
        assertThat(square.heightMax()).isEqualTo(2.0);
        assertThat(square.heightMedian()).isEqualTo(2.0);
        assertThat(square.heightMean()).isEqualTo(2.0);
        assertThat(square.volume()).isCloseTo(50.0, within(TOLERANCE));
    }

    @Test
    void calculateStats_rectangleGrain_heightStatistics() {
        GrainRecord rectangle = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS)
                .table().rows().get(1);

        assertThat(rectangle.heightMin()).isEqualTo(1.0);
        assertThat(rectangle.heightMax()).isEqualTo(10.0);
        assertThat(rectangle.heightMean()).isCloseTo(5.5, within(TOLERANCE));
        assertThat(rectangle.heightMedian()).isCloseTo(5.5, within(TOLERANCE));
        assertThat(rectangle.volume()).isCloseTo(6 * 55.0, within(TOLERANCE));
        assertThat(rectangle.smallestBoundingWidth()).isCloseTo(5.0, within(1e-7));
        assertThat(rectangle.smallestBoundingLength()).isCloseTo(9.0, within(1e-7));
        assertThat(rectangle.aspectRatio()).isCloseTo(5.0 / 9.0, within(1e-7));
    }

    @Test
    void calculateStats_scalesToMetres() {
        GrainStatsOptions metres = new GrainStatsOptions(
                EdgeDetectionMethod.BINARY_EROSION, false, -1, GrainStatsOptions.NANOMETRE_TO_METRE, 5, Path.of("out"));

        GrainRecord square = service.calculateStats(image, labels, 2.0, Direction.BELOW, "img", metres)
                .table().rows().get(0);

        double length = 2.0 * 1e-9;
        assertThat(square.centreX()).isCloseTo(5.0 * length, within(1e-18));
        assertThat(square.area()).isCloseTo(25.0 * length * length, within(1e-30));
        assertThat(square.smallestBoundingWidth()).isCloseTo(4.0 * length, within(1e-15));
        assertThat(square.heightMean()).isCloseTo(2.0e-9, within(1e-20));
        assertThat(square.volume()).isCloseTo(50.0 * 4.0 * 1e-27, within(1e-36));
        assertThat(square.aspectRatio()).isCloseTo(1.0, within(1e-7));
        assertThat(square.threshold()).isEqualTo(Direction.BELOW);
    }

    @Test
    void calculateStats_noLabels_returnsEmptyTableWithColumns() {
        GrainStatsResult result = service.calculateStats(image, null, 1.0, Direction.ABOVE, "img", PIXEL_UNITS);

        assertThat(result.table().isEmpty()).isTrue();
        assertThat(result.table().columns()).isEqualTo(GrainStatsTable.COLUMNS);
        assertThat(result.plotData()).isEmpty();
        assertThat(result.heightProfiles()).isEmpty();
    }

    @Test
    void calculateStats_noSurvivors_returnsEmptyTableWithColumns() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img",
                PIXEL_UNITS.withMinGrainSize(50));

        assertThat(result.table().isEmpty()).isTrue();
        assertThat(result.table().columns()).containsExactlyElementsOf(GrainStatsTable.COLUMNS);
        assertThat(result.skipped()).hasSize(3);
    }

    @Test
    void calculateStats_singlePixelWithoutSizeFilter_isSkippedNotRaised() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img",
                PIXEL_UNITS.withMinGrainSize(1));

        assertThat(result.table().rows()).extracting(GrainRecord::grainNumber).containsExactly(1, 2);
        assertThat(result.skipped()).containsExactly(new SkippedGrain(3, SkippedGrain.Reason.INSUFFICIENT_POINTS));
    }

    @Test
    void calculateStats_ignoresNaNHeights() {
        image[4][5] = Double.NaN;

        GrainRecord square = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS)
                .table().rows().get(0);

        assertThat(square.heightMean()).isEqualTo(2.0);
        assertThat(square.volume()).isCloseTo(48.0, within(TOLERANCE));
    }

    @Test
    void calculateStats_plotDataPerGrain() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS);

        assertThat(result.plotData()).hasSize(6);
        assertThat(result.plotData()).extracting(GrainPlotData::name).containsExactly(
                "grain_image", "grain_mask", "grain_mask_image",
                "grain_image", "grain_mask", "grain_mask_image");
        GrainPlotData first = result.plotData().get(0);
        assertThat(first.filename()).isEqualTo("img_grain_image_1");
        assertThat(first.outputDir()).isEqualTo(Path.of("out", "above"));
        assertThat(first.data()).hasDimensions(5, 5);
    }

    @Test
    void calculateStats_fixedCropSize_centresCropOnGrain() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img",
                PIXEL_UNITS.withCroppedSize(6));

        GrainPlotData mask = result.plotData().get(1);
        assertThat(mask.data()).hasDimensions(7, 7);
        // square spans rows 2-6, cols 3-7; its centre (4, 5) sits at the middle of the crop
        assertThat(mask.data()[3][3]).isEqualTo(1.0);
        GrainPlotData maskImage = result.plotData().get(2);
        assertThat(maskImage.data()[3][3]).isEqualTo(2.0);
    }

    @Test
    void calculateStats_heightProfilesKeyedByLabel() {
        GrainStatsResult result = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img",
                PIXEL_UNITS.withHeightProfiles(true));

        assertThat(result.heightProfiles()).containsOnlyKeys(1, 2);
        assertThat(result.heightProfiles().get(1)).hasSize(6).containsOnly(2.0);
    }

    @Test
    void calculateStats_canny_measuresGrainFromItsTightCrop() {
        assumeTrue(CannyEdgeDetector.isAvailable(), "OpenCV native library not available");
        double[][] flat = new double[20][20];
        int[][] oneGrain = new int[20][20];
        for (int y = 4; y < 16; y++) {
            for (int x = 4; x < 16; x++) {
                oneGrain[y][x] = 1;
                flat[y][x] = 1.0;
            }
        }

        GrainRecord grain = service.calculateStats(flat, oneGrain, 1.0, Direction.ABOVE, "img",
                PIXEL_UNITS.withEdgeDetectionMethod(EdgeDetectionMethod.CANNY)).table().rows().get(0);

        assertThat(grain.smallestBoundingWidth()).isCloseTo(11.0, within(1e-7));
        assertThat(grain.smallestBoundingLength()).isCloseTo(11.0, within(1e-7));
    }

    @Test
    void calculateStats_mismatchedShapes_areRejected() {
        int[][] wrongLabels = new int[29][30];

        assertThatThrownBy(() -> service.calculateStats(image, wrongLabels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS))
                .isInstanceOf(GrainStatsException.class)
                .hasMessageContaining("rows");
    }

    @Test
    void calculateStats_nonPositiveScaling_isRejected() {
        assertThatThrownBy(() -> service.calculateStats(image, labels, 0.0, Direction.ABOVE, "img", PIXEL_UNITS))
                .isInstanceOf(GrainStatsException.class);
    }

    @Test
    void calculateStats_isRepeatable() {
        GrainStatsResult first = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS);
        GrainStatsResult second = service.calculateStats(image, labels, 1.0, Direction.ABOVE, "img", PIXEL_UNITS);

        assertThat(second.table()).isEqualTo(first.table());
    }
}
