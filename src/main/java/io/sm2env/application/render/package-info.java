/**
 * Secret rendering engine: classification of fetched payloads, one encoder per output format, and the router
 * that decides between console and file destinations.
 */
package io.sm2env.application.render;
