package com.flamingo.ai.epubcfi.service.cfi.model;

/**
 * Spatial position ({@code @x:y}) within an element such as an image.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record SpatialPosition(double x, double y) {}
