package com.orthosense.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Clinical thresholds used by the biomechanical rule book.
 *
 * <p>Values are empirical and normalized to image coordinates unless noted as degrees.
 * Defaults can be tuned in application.properties under {@code orthosense.diagnostics.*}.
 */
@Component
@ConfigurationProperties(prefix = "orthosense.diagnostics")
public class DiagnosticsProperties {

    private SquatThresholds squat = new SquatThresholds();
    private double torsoShift = 0.12;
    private double earShoulderDistance = 0.12;
    private double wristHeightAsymmetry = 0.15;
    private double pelvicTilt = 0.08;
    private double heelRise = 0.03;
    private double trunkLeanRatio = 0.50;
    private double kneeWidthRatio = 0.75;
    private double raisedLegLift = 0.05;
    private double straightKneeAngle = 150.0;
    private double straightElbowAngle = 140.0;
    private double elbowDrift = 0.15;

    public SquatThresholds getSquat() {
        return squat;
    }

    public void setSquat(SquatThresholds squat) {
        this.squat = squat;
    }

    public double getTorsoShift() {
        return torsoShift;
    }

    public void setTorsoShift(double torsoShift) {
        this.torsoShift = torsoShift;
    }

    public double getEarShoulderDistance() {
        return earShoulderDistance;
    }

    public void setEarShoulderDistance(double earShoulderDistance) {
        this.earShoulderDistance = earShoulderDistance;
    }

    public double getWristHeightAsymmetry() {
        return wristHeightAsymmetry;
    }

    public void setWristHeightAsymmetry(double wristHeightAsymmetry) {
        this.wristHeightAsymmetry = wristHeightAsymmetry;
    }

    public double getPelvicTilt() {
        return pelvicTilt;
    }

    public void setPelvicTilt(double pelvicTilt) {
        this.pelvicTilt = pelvicTilt;
    }

    public double getHeelRise() {
        return heelRise;
    }

    public void setHeelRise(double heelRise) {
        this.heelRise = heelRise;
    }

    public double getTrunkLeanRatio() {
        return trunkLeanRatio;
    }

    public void setTrunkLeanRatio(double trunkLeanRatio) {
        this.trunkLeanRatio = trunkLeanRatio;
    }

    public double getKneeWidthRatio() {
        return kneeWidthRatio;
    }

    public void setKneeWidthRatio(double kneeWidthRatio) {
        this.kneeWidthRatio = kneeWidthRatio;
    }

    public double getRaisedLegLift() {
        return raisedLegLift;
    }

    public void setRaisedLegLift(double raisedLegLift) {
        this.raisedLegLift = raisedLegLift;
    }

    public double getStraightKneeAngle() {
        return straightKneeAngle;
    }

    public void setStraightKneeAngle(double straightKneeAngle) {
        this.straightKneeAngle = straightKneeAngle;
    }

    public double getStraightElbowAngle() {
        return straightElbowAngle;
    }

    public void setStraightElbowAngle(double straightElbowAngle) {
        this.straightElbowAngle = straightElbowAngle;
    }

    public double getElbowDrift() {
        return elbowDrift;
    }

    public void setElbowDrift(double elbowDrift) {
        this.elbowDrift = elbowDrift;
    }

    /**
     * Deep squat thresholds.
     */
    public static class SquatThresholds {
        private double shallowKneeAngle = 100.0;
        private double kneeWidthRatio = 0.75;
        private double maxLean = 0.70;

        public double getShallowKneeAngle() {
            return shallowKneeAngle;
        }

        public void setShallowKneeAngle(double shallowKneeAngle) {
            this.shallowKneeAngle = shallowKneeAngle;
        }

        public double getKneeWidthRatio() {
            return kneeWidthRatio;
        }

        public void setKneeWidthRatio(double kneeWidthRatio) {
            this.kneeWidthRatio = kneeWidthRatio;
        }

        public double getMaxLean() {
            return maxLean;
        }

        public void setMaxLean(double maxLean) {
            this.maxLean = maxLean;
        }
    }
}
