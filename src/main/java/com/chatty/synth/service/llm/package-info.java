/**
 * Language-model backend abstraction and its Ollama HTTP implementation.
 */
package com.chatty.synth.service.llm;
