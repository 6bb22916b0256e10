/**
 * Rule-based biomechanical evaluation.
 *
 * <p>{@link com.orthosense.service.diagnostics.ExerciseRuleBook} holds the per-exercise predicate
 * tables; {@link com.orthosense.service.diagnostics.BiomechanicalEvaluator} applies them and owns
 * the temporal smoothing used for Deep Squat.
 */
package com.orthosense.service.diagnostics;
