/**
 * REST controllers: liveness ping and the recording and window analysis endpoints.
 */
package com.orthosense.presentation.controller;
