/**
 * Frame ingestion and windowing.
 *
 * <ul>
 *   <li>{@link com.orthosense.service.window.FrameValidator} and
 *       {@link com.orthosense.service.window.FrameJsonParser} reject malformed detector output</li>
 *   <li>{@link com.orthosense.service.window.FrameRingBuffer} keeps the latest frames of a live session</li>
 *   <li>{@link com.orthosense.service.window.BatchWindower} splits a recording into overlapping windows</li>
 * </ul>
 */
package com.orthosense.service.window;
