package com.greencover.analysis;

/**
 * Streaming accumulator for valid NDVI samples. Mean and population standard
 * deviation use Welford's update so a single pass over the tiles suffices.
 */
public class NdviStatistics {

    private long count;
    private long vegetatedCount;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double totalArea;
    private double vegetatedArea;

    public void accept(double ndvi, boolean vegetated, double pixelArea) {
        count++;
        double delta = ndvi - mean;
        mean += delta / count;
        m2 += delta * (ndvi - mean);
        if (ndvi < min) {
            min = ndvi;
        }
        if (ndvi > max) {
            max = ndvi;
        }
        totalArea += pixelArea;
        if (vegetated) {
            vegetatedCount++;
            vegetatedArea += pixelArea;
        }
    }

    public long getCount() {
        return count;
    }

    public long getVegetatedCount() {
        return vegetatedCount;
    }

    public double getMean() {
        return count == 0 ? Double.NaN : mean;
    }

    public double getStandardDeviation() {
        return count == 0 ? Double.NaN : Math.sqrt(m2 / count);
    }

    public double getMin() {
        return count == 0 ? Double.NaN : min;
    }

    public double getMax() {
        return count == 0 ? Double.NaN : max;
    }

    public double getTotalArea() {
        return totalArea;
    }

    public double getVegetatedArea() {
        return vegetatedArea;
    }

    public double coveragePercentage() {
        return count == 0 ? 0.0 : vegetatedCount * 100.0 / count;
    }
}
