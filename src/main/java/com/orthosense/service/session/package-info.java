/**
 * Per-session orchestration: batch two-pass recording analysis, live buffering with feedback,
 * and the factories that keep session state isolated.
 */
package com.orthosense.service.session;
