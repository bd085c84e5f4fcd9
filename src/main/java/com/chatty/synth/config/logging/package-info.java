/**
 * Request correlation for Log4j2: populates the ThreadContext per HTTP request.
 */
package com.chatty.synth.config.logging;
