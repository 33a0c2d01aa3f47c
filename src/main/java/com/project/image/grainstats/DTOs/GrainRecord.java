package com.project.image.grainstats.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Statistics of one grain. Lengths are in metres, areas in square metres, volume in cubic metres.
 */
@JsonPropertyOrder({
        "grain_number", "centre_x", "centre_y",
        "radius_min", "radius_max", "radius_mean", "radius_median",
        "height_min", "height_max", "height_median", "height_mean",
        "volume", "area", "area_cartesian_bbox",
        "smallest_bounding_width", "smallest_bounding_length", "smallest_bounding_area",
        "aspect_ratio", "max_feret", "min_feret", "threshold", "image"
})
public record GrainRecord(
        @JsonProperty("grain_number") int grainNumber,
        @JsonProperty("centre_x") double centreX,
        @JsonProperty("centre_y") double centreY,
        @JsonProperty("radius_min") double radiusMin,
        @JsonProperty("radius_max") double radiusMax,
        @JsonProperty("radius_mean") double radiusMean,
        @JsonProperty("radius_median") double radiusMedian,
        @JsonProperty("height_min") double heightMin,
        @JsonProperty("height_max") double heightMax,
        @JsonProperty("height_median") double heightMedian,
        @JsonProperty("height_mean") double heightMean,
        @JsonProperty("volume") double volume,
        @JsonProperty("area") double area,
        @JsonProperty("area_cartesian_bbox") double areaCartesianBbox,
        @JsonProperty("smallest_bounding_width") double smallestBoundingWidth,
        @JsonProperty("smallest_bounding_length") double smallestBoundingLength,
        @JsonProperty("smallest_bounding_area") double smallestBoundingArea,
        @JsonProperty("aspect_ratio") double aspectRatio,
        @JsonProperty("max_feret") double maxFeret,
        @JsonProperty("min_feret") double minFeret,
        @JsonProperty("threshold") Direction threshold,
        @JsonProperty("image") String image
) {}
