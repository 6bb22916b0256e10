/**
 * Analysis services, one sub-package per pipeline stage: {@code window}, {@code geometry},
 * {@code classify}, {@code diagnostics}, {@code report}, {@code session}, {@code feedback},
 * plus {@code metrics} and {@code health} for operations.
 */
package com.orthosense.service;
