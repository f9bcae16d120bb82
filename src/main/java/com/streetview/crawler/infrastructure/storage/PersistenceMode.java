package com.streetview.crawler.infrastructure.storage;

/**
 * How the images of a panorama are written to disk.
 */
public enum PersistenceMode {
    /** One file per directional image. */
    SIMPLE,
    /** One stitched composite per panorama. */
    GLUED
}
