package com.project.image.grainstats.geometry;

/** One hull edge, as a pair of indices into the boundary point list. */
public record Simplex(int from, int to) {}
