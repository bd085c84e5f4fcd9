/**
 * Single-shot CLI process used to answer requests addressed to a non-synth seat.
 */
package com.chatty.synth.service.seat;
