package com.questrail.conversation.api;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The parts of a WebSocket upgrade request an authenticator may look at.
 *
 * <p>Header names are matched case-insensitively.</p>
 *
 * @param conversation conversation id taken from the request path
 * @param headers      request headers; the last value wins for repeated names
 */
public record HandshakeRequest(long conversation, Map<String, String> headers)
{
    public HandshakeRequest
    {
        Objects.requireNonNull(headers, "headers");
        final TreeMap<String, String> normalized = new TreeMap<>();
        headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        headers = Map.copyOf(normalized);
    }

    public Optional<String> header(String name)
    {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }
}
