/**
 * Presentation layer: the thin HTTP surface over the analysis services.
 */
package com.orthosense.presentation;
