/**
 * Final merge step: prompt construction and the synthesis model call.
 */
package com.chatty.synth.service.synthesis;
