/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@code POST /chatty-sync} - synchronous chat; merged answer for the synth seat,
 *       pass-through JSON for any other seat</li>
 *   <li>{@code GET /last-messages} - last 100 sync exchanges, oldest first</li>
 * </ul>
 *
 * @see com.chatty.synth.presentation.exception.GlobalExceptionHandler
 */
package com.chatty.synth.presentation.controller;
