package com.scholary.mp3.converter.service;

import com.scholary.mp3.converter.admission.Tier;
import java.nio.file.Path;

/**
 * A finished conversion.
 *
 * @param artifact the MP3; a cache path unless temporary
 * @param filename suggested download filename
 * @param sizeBytes artifact size
 * @param elapsedSeconds wall time of the conversion
 * @param cached whether the result was served from the cache without new work
 * @param temporary whether the artifact is a scratch file the caller must {@code discard}
 * @param tier the tier the conversion ran under
 */
public record ConversionResult(
    Path artifact,
    String filename,
    long sizeBytes,
    double elapsedSeconds,
    boolean cached,
    boolean temporary,
    Tier tier) {}
