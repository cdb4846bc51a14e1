package com.scholary.mp3.converter.extraction;

import java.util.List;

/**
 * A named client identity used to talk to a platform through the extraction tool.
 *
 * <p>Immutable. Personas differ in the player client they claim to be, the headers they send,
 * the format they ask for and whether they go through the proxy.
 *
 * @param name unique name, referenced from configuration
 * @param clientIdentity player client(s) passed as extractor args, null for the tool's default
 * @param userAgent user agent, null for the tool's default
 * @param headers extra headers in {@code Name:Value} form
 * @param formatSelector the tool's format selector
 * @param usesProxy whether the configured proxy is attached
 * @param compact whether this persona is a cheap fit for short content
 * @param extraArgs additional tool arguments
 */
public record Persona(
    String name,
    String clientIdentity,
    String userAgent,
    List<String> headers,
    String formatSelector,
    boolean usesProxy,
    boolean compact,
    List<String> extraArgs) {

  public Persona {
    headers = headers == null ? List.of() : List.copyOf(headers);
    extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
  }
}
