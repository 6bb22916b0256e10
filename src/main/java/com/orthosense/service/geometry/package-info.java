/**
 * Pure geometry helpers (joint angles and distances) shared by the classifier overrides and the
 * biomechanical rules.
 */
package com.orthosense.service.geometry;
