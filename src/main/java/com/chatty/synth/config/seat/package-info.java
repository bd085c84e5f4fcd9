/**
 * Seat-to-model resolution from properties, an optional JSON file and environment overrides.
 */
package com.chatty.synth.config.seat;
