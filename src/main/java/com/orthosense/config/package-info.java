/**
 * Spring configuration: bean wiring for the analysis pipeline, the feedback thread pool and
 * typed configuration properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code properties} - {@code @ConfigurationProperties} classes bound from application.properties</li>
 *   <li>{@code logging} - request-scoped logging context</li>
 * </ul>
 */
package com.orthosense.config;
