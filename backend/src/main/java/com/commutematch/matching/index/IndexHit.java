package com.commutematch.matching.index;

/**
 * One trip found near a query point, with the distance to its closest indexed sample.
 */
public record IndexHit(String tripId, double matchedSampleDistance) {
}
