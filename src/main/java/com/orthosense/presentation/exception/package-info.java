/**
 * HTTP error mapping for the REST boundary.
 */
package com.orthosense.presentation.exception;
