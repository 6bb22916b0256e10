/**
 * Logging infrastructure: the servlet filter that seeds the Log4j2 ThreadContext per request.
 */
package com.orthosense.config.logging;
