/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.orthosense.exception.OrthoSenseException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.orthosense.exception.InvalidFrameException} - Thrown when a pose frame
 *       fails ingestion checks (joint count, coordinate arity, non-finite values)</li>
 *   <li>{@link com.orthosense.exception.UnknownExerciseException} - Thrown when a caller names an
 *       exercise outside the catalogue</li>
 * </ul>
 *
 * <p>Empty recordings and recordings without a confident exercise are not exceptions; they are
 * reported through {@link com.orthosense.domain.AnalysisOutcome}. Degenerate geometry is handled
 * locally by {@link com.orthosense.service.geometry.GeometryKit}.
 *
 * @see com.orthosense.presentation.exception.GlobalExceptionHandler
 */
package com.orthosense.exception;
