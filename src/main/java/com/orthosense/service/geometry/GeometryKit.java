package com.orthosense.service.geometry;

import com.orthosense.domain.Joint;
import org.springframework.stereotype.Component;

/**
 * Stateless vector math over pose joints.
 *
 * <p>Degenerate input never raises: a zero-length ray yields an angle of 0 degrees.
 * Thread-safe.
 */
@Component
public class GeometryKit {

    /**
     * Angle at vertex {@code b} between rays b→a and b→c.
     *
     * @return angle in degrees within [0,180], or 0 when either ray has zero length
     */
    public double angle(Joint a, Joint b, Joint c) {
        double bax = a.x() - b.x();
        double bay = a.y() - b.y();
        double baz = a.z() - b.z();
        double bcx = c.x() - b.x();
        double bcy = c.y() - b.y();
        double bcz = c.z() - b.z();

        double normBa = Math.sqrt(bax * bax + bay * bay + baz * baz);
        double normBc = Math.sqrt(bcx * bcx + bcy * bcy + bcz * bcz);
        if (normBa == 0.0 || normBc == 0.0) {
            return 0.0;
        }
        double cosine = (bax * bcx + bay * bcy + baz * bcz) / (normBa * normBc);
        return Math.toDegrees(Math.acos(clamp(cosine)));
    }

    /** Euclidean distance between two joints. */
    public double distance(Joint a, Joint b) {
        double dx = a.x() - b.x();
        double dy = a.y() - b.y();
        double dz = a.z() - b.z();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    private static double clamp(double cosine) {
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
