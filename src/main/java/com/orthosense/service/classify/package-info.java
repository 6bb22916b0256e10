/**
 * Exercise identification: pluggable {@link com.orthosense.service.classify.ExerciseModel}
 * implementations fused by {@link com.orthosense.service.classify.EnsembleClassifier}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code fusion} - choosing between the two model candidates</li>
 *   <li>{@code override} - geometry rules correcting the fused decision</li>
 * </ul>
 */
package com.orthosense.service.classify;
