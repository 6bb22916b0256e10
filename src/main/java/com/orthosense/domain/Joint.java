package com.orthosense.domain;

/**
 * Single pose landmark in normalized image coordinates.
 *
 * <p>x grows to the right, y grows downward, z is relative depth.
 *
 * @param x          horizontal coordinate
 * @param y          vertical coordinate
 * @param z          depth coordinate
 * @param visibility detector visibility score in [0,1]
 */
public record Joint(double x, double y, double z, double visibility) {

    public static final double DEFAULT_VISIBILITY = 1.0;

    public Joint {
        if (visibility < 0.0 || visibility > 1.0) {
            throw new IllegalArgumentException("visibility must be between 0.0 and 1.0, got: " + visibility);
        }
    }

    public static Joint of(double x, double y, double z) {
        return new Joint(x, y, z, DEFAULT_VISIBILITY);
    }

    public Joint withVisibility(double newVisibility) {
        return new Joint(x, y, z, newVisibility);
    }

    /** Midpoint of two joints; visibility is the lower of the two. */
    public static Joint midpoint(Joint a, Joint b) {
        return new Joint(
                (a.x + b.x) / 2,
                (a.y + b.y) / 2,
                (a.z + b.z) / 2,
                Math.min(a.visibility, b.visibility));
    }
}
