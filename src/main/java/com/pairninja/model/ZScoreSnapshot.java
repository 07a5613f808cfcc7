package com.pairninja.model;

/**
 * Indicator output for one bar. Everything except r is null while the
 * z-score window is still warming up.
 */
public final class ZScoreSnapshot {

    private final double r;
    private final Double mean;
    private final Double sigma;
    private final Double sigmaFloor;
    private final Double sigmaEff;
    private final Double zscore;

    public ZScoreSnapshot(double r, Double mean, Double sigma, Double sigmaFloor, Double sigmaEff, Double zscore) {
        this.r = r;
        this.mean = mean;
        this.sigma = sigma;
        this.sigmaFloor = sigmaFloor;
        this.sigmaEff = sigmaEff;
        this.zscore = zscore;
    }

    public static ZScoreSnapshot warmingUp(double r) {
        return new ZScoreSnapshot(r, null, null, null, null, null);
    }

    public boolean isReady() {
        return zscore != null;
    }

    public double getR() {
        return r;
    }

    public Double getMean() {
        return mean;
    }

    public Double getSigma() {
        return sigma;
    }

    public Double getSigmaFloor() {
        return sigmaFloor;
    }

    public Double getSigmaEff() {
        return sigmaEff;
    }

    public Double getZscore() {
        return zscore;
    }

    @Override
    public String toString() {
        return "ZScoreSnapshot{r=" + r + ", mean=" + mean + ", sigma=" + sigma + ", floor=" + sigmaFloor
                + ", sigmaEff=" + sigmaEff + ", z=" + zscore + "}";
    }
}
