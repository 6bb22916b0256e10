/**
 * Geometry-based corrections applied after model fusion, in a fixed order:
 * {@link com.orthosense.service.classify.override.DeepSquatOverride} then
 * {@link com.orthosense.service.classify.override.LungeSymmetryOverride}.
 */
package com.orthosense.service.classify.override;
