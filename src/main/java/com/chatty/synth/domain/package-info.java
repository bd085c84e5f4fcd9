/**
 * Request, reply and value types shared by the classifier, context assembler, dispatcher and
 * synthesizer. All values are immutable and live for one request.
 */
package com.chatty.synth.domain;
