package org.Aayush.geomatch.parse;

/**
 * Transient result of recognizing one coordinate token.
 *
 * @param raw trimmed source text.
 * @param format grammar that matched the whole token.
 * @param value signed decimal degrees.
 * @param hemisphere hemisphere letter, or null when the token carried none.
 */
public record CoordinateToken(String raw, CoordinateFormat format, double value, Hemisphere hemisphere) {
}
