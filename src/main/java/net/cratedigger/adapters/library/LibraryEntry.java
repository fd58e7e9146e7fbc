package net.cratedigger.adapters.library;

/**
 * One album (or artist-only entry when {@code album} is blank) in the library document.
 */
public record LibraryEntry(String artist, String album, String genre) {
}
