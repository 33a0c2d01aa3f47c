package com.project.image.grainstats.service;

import com.project.image.grainstats.DTOs.Direction;
import com.project.image.grainstats.DTOs.GrainPlotData;
import com.project.image.grainstats.DTOs.GrainRecord;
import com.project.image.grainstats.DTOs.GrainStatsRequest;
import com.project.image.grainstats.DTOs.GrainStatsResult;
import com.project.image.grainstats.DTOs.GrainStatsTable;
import com.project.image.grainstats.DTOs.SkippedGrain;
import com.project.image.grainstats.exceptions.GrainStatsException;
import com.project.image.grainstats.geometry.BoundingRectangle;
import com.project.image.grainstats.geometry.ConvexHull;
import com.project.image.grainstats.geometry.Feret;
import com.project.image.grainstats.geometry.FeretDiameters;
import com.project.image.grainstats.geometry.GrahamScan;
import com.project.image.grainstats.geometry.MinimumBoundingRectangle;
import com.project.image.grainstats.geometry.Point;
import com.project.image.grainstats.geometry.RadiusStatistics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes shape and height statistics for every labelled grain of one (image, direction) pair.
 * <p>
 * Each grain goes through boundary extraction, convex hull, minimum bounding rectangle, radius and
 * feret measurement, then its heights are read from the image under the grain mask. A grain that
 * is too small or has degenerate geometry is skipped and reported; it never fails the whole image.
 */
@Service
public class GrainStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(GrainStatisticsService.class);

    private final BoundaryExtractor boundaryExtractor;
    private final RegionExtractor regionExtractor;
    private final HeightProfileService heightProfileService;
    private final GrainStatsOptions defaults;

    public GrainStatisticsService(BoundaryExtractor boundaryExtractor, RegionExtractor regionExtractor,
                                  HeightProfileService heightProfileService, GrainStatsOptions defaults) {
        this.boundaryExtractor = boundaryExtractor;
        this.regionExtractor = regionExtractor;
        this.heightProfileService = heightProfileService;
        this.defaults = defaults;
    }

    public GrainStatsResult calculateStats(GrainStatsRequest request) {
        return calculateStats(request.image(), request.labels(), request.pixelToNanometreScaling(),
                request.direction(), request.imageName(), defaults.overriddenBy(request));
    }

    public GrainStatsResult calculateStats(double[][] image, int[][] labels, double pixelToNanometreScaling,
                                           Direction direction, String imageName, GrainStatsOptions options) {
        if (labels == null) {
            log.warn("[{}] : No labelled regions for this image, grain statistics can not be calculated.", imageName);
            return GrainStatsResult.empty(imageName, direction);
        }
        validate(image, labels, pixelToNanometreScaling);

        log.info("[{}] : Calculating grain statistics ({}), edge detection: {}",
                imageName, direction, options.edgeDetectionMethod().key());

        List<GrainRecord> records = new ArrayList<>();
        List<GrainPlotData> plotData = new ArrayList<>();
        Map<Integer, double[]> heightProfiles = new LinkedHashMap<>();
        List<SkippedGrain> skipped = new ArrayList<>();

        Path outputDir = options.baseOutputDir().resolve(direction.tag());
        for (LabelledRegion region : regionExtractor.regions(labels)) {
            log.debug("[{}] : Processing grain: {}", imageName, region.label());

            if (region.minSide() < options.minGrainSize()) {
                log.debug("[{}] : Skipping grain {} due to being too small (size: {}x{}) to calculate stats for.",
                        imageName, region.label(), region.height(), region.width());
                skipped.add(new SkippedGrain(region.label(), SkippedGrain.Reason.TOO_SMALL));
                continue;
            }

            double[][] grainImage = regionExtractor.crop(image, region);
            List<Point> edges = boundaryExtractor.extract(region.mask(), options.edgeDetectionMethod());
            if (edges.size() < 3) {
                log.debug("[{}] : Skipping grain {}, only {} boundary points", imageName, region.label(), edges.size());
                skipped.add(new SkippedGrain(region.label(), SkippedGrain.Reason.INSUFFICIENT_POINTS));
                continue;
            }
            ConvexHull hull = GrahamScan.build(edges);
            if (hull.distinctPointCount() < 2) {
                log.debug("[{}] : Skipping grain {}, convex hull is a single point", imageName, region.label());
                skipped.add(new SkippedGrain(region.label(), SkippedGrain.Reason.DEGENERATE_HULL));
                continue;
            }
            if (log.isTraceEnabled()) {
                log.trace("[{}] : grain {} hull: {}", imageName, region.label(), hull.points());
                log.trace("[{}] : grain {} simplices: {}", imageName, region.label(), hull.simplices());
            }

            records.add(grainRecord(region, grainImage, edges, hull, pixelToNanometreScaling,
                    direction, imageName, options));
            plotData.addAll(plotData(image, labels, region, grainImage, pixelToNanometreScaling,
                    outputDir, imageName, options));

            if (options.extractHeightProfile()) {
                heightProfiles.put(region.label(),
                        heightProfileService.interpolateHeightProfile(grainImage, region.mask()));
                log.debug("[{}] : Height profiles extracted.", imageName);
            }
        }

        if (records.isEmpty()) {
            log.info("[{}] : No grains survived filtering ({} skipped)", imageName, skipped.size());
        } else {
            log.info("[{}] : Calculated statistics for {} grains ({} skipped)", imageName, records.size(), skipped.size());
        }
        return new GrainStatsResult(imageName, direction, GrainStatsTable.of(records), plotData, heightProfiles, skipped);
    }

    private GrainRecord grainRecord(LabelledRegion region, double[][] grainImage, List<Point> edges, ConvexHull hull,
                                    double pixelToNanometreScaling, Direction direction, String imageName,
                                    GrainStatsOptions options) {
        BoundingRectangle rectangle = MinimumBoundingRectangle.compute(edges, hull.simplices());
        RadiusStatistics radius = RadiusStatistics.of(edges);

        double metre = options.metreScalingFactor();
        double lengthScale = pixelToNanometreScaling * metre;
        double areaScale = lengthScale * lengthScale;

        FeretDiameters feret = Feret.minMax(BoundaryExtractor.points(region.mask())).scaled(lengthScale);

        DescriptiveStatistics heights = maskedHeights(grainImage, region.mask());
        double heightSum = heights.getN() == 0 ? 0 : heights.getSum();

        // centroid is local to the crop
        double centreX = radius.centroid().col() + region.minCol();
        double centreY = radius.centroid().row() + region.minRow();

        return new GrainRecord(
                region.label(),
                centreX * lengthScale,
                centreY * lengthScale,
                radius.min() * lengthScale,
                radius.max() * lengthScale,
                radius.mean() * lengthScale,
                radius.median() * lengthScale,
                heights.getMin() * metre,
                heights.getMax() * metre,
                heights.getPercentile(50) * metre,
                heights.getMean() * metre,
                // px * px * nm
                heightSum * pixelToNanometreScaling * pixelToNanometreScaling * metre * metre * metre,
                region.area() * areaScale,
                region.bboxArea() * areaScale,
                rectangle.width() * lengthScale,
                rectangle.length() * lengthScale,
                rectangle.width() * rectangle.length() * areaScale,
                rectangle.aspectRatio(),
                feret.max(),
                feret.min(),
                direction,
                imageName);
    }

    /** Non-NaN image values under the mask. */
    static DescriptiveStatistics maskedHeights(double[][] grainImage, boolean[][] mask) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int y = 0; y < mask.length; y++) {
            for (int x = 0; x < mask[y].length; x++) {
                if (mask[y][x] && !Double.isNaN(grainImage[y][x])) {
                    stats.addValue(grainImage[y][x]);
                }
            }
        }
        return stats;
    }

    private List<GrainPlotData> plotData(double[][] image, int[][] labels, LabelledRegion region, double[][] grainImage,
                                         double pixelToNanometreScaling, Path outputDir, String imageName,
                                         GrainStatsOptions options) {
        double[][] croppedImage;
        double[][] croppedMask;
        double[][] croppedMaskImage;
        if (options.croppedSize() < 0) {
            croppedImage = grainImage;
            croppedMask = RegionExtractor.toDouble(region.mask());
            croppedMaskImage = RegionExtractor.maskedImage(grainImage, region.mask());
        } else {
            int centreRow = (region.minRow() + region.maxRow()) / 2;
            int centreCol = (region.minCol() + region.maxCol()) / 2;
            int halfLength = (int) (options.croppedSize() / (2 * pixelToNanometreScaling));
            croppedImage = regionExtractor.cropAround(image, halfLength, centreRow, centreCol);
            croppedMask = regionExtractor.soloMaskAround(labels, region.label(), halfLength, centreRow, centreCol);
            croppedMaskImage = new double[croppedImage.length][];
            for (int y = 0; y < croppedImage.length; y++) {
                croppedMaskImage[y] = new double[croppedImage[y].length];
                for (int x = 0; x < croppedImage[y].length; x++) {
                    croppedMaskImage[y][x] = croppedMask[y][x] > 0 ? croppedImage[y][x] : Double.NaN;
                }
            }
        }

        List<GrainPlotData> plots = new ArrayList<>(3);
        plots.add(plot(croppedImage, "grain_image", outputDir, imageName, region.label()));
        plots.add(plot(croppedMask, "grain_mask", outputDir, imageName, region.label()));
        plots.add(plot(croppedMaskImage, "grain_mask_image", outputDir, imageName, region.label()));
        return plots;
    }

    private static GrainPlotData plot(double[][] data, String name, Path outputDir, String imageName, int label) {
        return new GrainPlotData(data, outputDir, imageName + "_" + name + "_" + label, name);
    }

    private static void validate(double[][] image, int[][] labels, double pixelToNanometreScaling) {
        if (!(pixelToNanometreScaling > 0) || Double.isInfinite(pixelToNanometreScaling)) {
            throw new GrainStatsException("Pixel to nanometre scaling must be a positive number, got " + pixelToNanometreScaling);
        }
        if (image == null || image.length == 0) {
            throw new GrainStatsException("Image is empty");
        }
        if (image.length != labels.length) {
            throw new GrainStatsException("Image has " + image.length + " rows but labelled image has " + labels.length);
        }
        for (int y = 0; y < image.length; y++) {
            if (image[y].length != image[0].length || labels[y].length != image[y].length) {
                throw new GrainStatsException("Image and labelled image must have the same rectangular shape (row " + y + ")");
            }
        }
    }
}
