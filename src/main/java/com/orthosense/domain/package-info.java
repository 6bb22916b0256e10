/**
 * Immutable domain model: pose frames and windows, the exercise catalogue, and the
 * classification, diagnostic and session results built from them.
 *
 * <p>All types are records or enums and are safe to share between threads once built.
 */
package com.orthosense.domain;
