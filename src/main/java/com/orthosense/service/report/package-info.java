/**
 * Narrative text report for a completed recording analysis.
 */
package com.orthosense.service.report;
